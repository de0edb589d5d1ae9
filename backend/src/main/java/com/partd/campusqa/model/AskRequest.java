package com.partd.campusqa.model;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request model for /api/qa/process and /api/qa/ask.
 * An empty question is allowed and yields a clarification answer.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AskRequest {
    @NotNull(message = "Question is required")
    private String question;
}
