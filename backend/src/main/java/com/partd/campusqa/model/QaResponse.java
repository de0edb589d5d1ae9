package com.partd.campusqa.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QaResponse {

    private String requestId;

    private String question;

    private ProcessorOutput processed;

    private AnswerResult answer;

    private EvaluationResult evaluation;

    private Long processingTimeMs;
}
