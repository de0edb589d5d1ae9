package com.partd.campusqa.model;

import lombok.Getter;
import lombok.ToString;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A compiled intent rule: a label and the pattern that selects it.
 * Rules are evaluated in list order and the first match wins.
 */
@Getter
@ToString
public final class IntentRule {

    private final String label;
    private final Pattern pattern;

    public IntentRule(String label, Pattern pattern) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Intent rule label must not be empty");
        }
        this.label = label;
        this.pattern = Objects.requireNonNull(pattern, "pattern");
    }

    public boolean matches(String text) {
        return text != null && pattern.matcher(text).find();
    }
}
