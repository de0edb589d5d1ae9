package com.partd.campusqa.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Result of question understanding, consumed as-is by the answer synthesizer.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProcessorOutput {

    public static final String INTENT_CONFIDENCE = "intent";
    public static final String DOMAIN_CONFIDENCE = "domain";

    @JsonProperty("raw_text")
    private String rawText;

    @JsonProperty("clean_text")
    private String cleanText;

    @JsonProperty("domain")
    private String domain;

    @JsonProperty("intent")
    private String intent;

    @JsonProperty("slots")
    private SlotMap slots;

    @JsonProperty("retrieval_query")
    private String retrievalQuery;

    @JsonProperty("confidence")
    private Map<String, Double> confidence;  // intent, domain

    public double intentConfidence() {
        return confidenceOf(INTENT_CONFIDENCE);
    }

    public double domainConfidence() {
        return confidenceOf(DOMAIN_CONFIDENCE);
    }

    private double confidenceOf(String key) {
        if (confidence == null) {
            return 0.0;
        }
        Double value = confidence.get(key);
        return value == null ? 0.0 : value;
    }
}
