package com.partd.campusqa.model;

import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of intent resolution for one request.
 */
@Getter
@ToString
public final class ResolvedIntent {

    public enum Source { RULE, CLASSIFIER, NONE }

    private static final ResolvedIntent NONE = new ResolvedIntent(null, 0.0, Source.NONE);

    private final String intent;
    private final double confidence;
    private final Source source;

    private ResolvedIntent(String intent, double confidence, Source source) {
        this.intent = intent;
        this.confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
        this.source = source;
    }

    public static ResolvedIntent fromRule(String intent, double confidence) {
        return new ResolvedIntent(intent, confidence, Source.RULE);
    }

    public static ResolvedIntent fromClassifier(String intent, double confidence) {
        return new ResolvedIntent(intent, confidence, Source.CLASSIFIER);
    }

    public static ResolvedIntent none() {
        return NONE;
    }

    public boolean isResolved() {
        return intent != null;
    }
}
