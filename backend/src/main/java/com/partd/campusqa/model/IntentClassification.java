package com.partd.campusqa.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * What an external intent classifier answered. A null intent means "no opinion".
 */
@Data
@AllArgsConstructor
public class IntentClassification {

    private String intent;

    private double confidence;

    private String rawResponse;

    public static IntentClassification noOpinion() {
        return new IntentClassification(null, 0.0, null);
    }

    public static IntentClassification noOpinion(String rawResponse) {
        return new IntentClassification(null, 0.0, rawResponse);
    }
}
