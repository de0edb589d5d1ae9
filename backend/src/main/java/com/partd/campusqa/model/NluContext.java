package com.partd.campusqa.model;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable configuration shared by every request: the ordered intent rules and the gazetteer.
 * Built once at startup and handed to the resolver and slot extractor.
 */
@Getter
public final class NluContext {

    private final List<IntentRule> intentRules;
    private final Gazetteer gazetteer;
    private final Set<String> knownIntents;

    public NluContext(List<IntentRule> intentRules, Gazetteer gazetteer) {
        this.intentRules = List.copyOf(intentRules);
        this.gazetteer = gazetteer != null ? gazetteer : Gazetteer.empty();

        Set<String> labels = new LinkedHashSet<>();
        for (IntentRule rule : this.intentRules) {
            labels.add(rule.getLabel());
        }
        this.knownIntents = Collections.unmodifiableSet(labels);
    }
}
