package com.partd.campusqa.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Quality scores for one answer, each on a 0-100 scale.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvaluationResult {

    private double overallScore;

    private double relevanceScore;

    private double completenessScore;

    private double clarityScore;

    private double accuracyScore;

    private String feedback;

    private List<String> suggestions;

    private boolean passed;

    private double qualityThreshold;
}
