package com.partd.campusqa.client;

import com.partd.campusqa.model.IntentClassification;

import java.util.Set;

/**
 * Fallback intent classification, consulted only when no intent rule matched.
 * Implementations never throw and only ever answer with a label from {@code allowedLabels} or no label.
 */
public interface IntentClassifier {

    IntentClassification classify(String text, Set<String> allowedLabels);

    /**
     * Short name for logs and the health endpoint.
     */
    String name();
}
