package com.partd.campusqa.client;

import com.partd.campusqa.model.IntentClassification;

import java.util.Set;

public class NoOpIntentClassifier implements IntentClassifier {

    @Override
    public IntentClassification classify(String text, Set<String> allowedLabels) {
        return IntentClassification.noOpinion();
    }

    @Override
    public String name() {
        return "none";
    }
}
