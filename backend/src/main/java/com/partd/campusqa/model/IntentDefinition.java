package com.partd.campusqa.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One intent document from intent-patterns.json.
 * An intent owns several regex patterns; each pattern becomes its own {@link IntentRule}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class IntentDefinition {

    @JsonProperty("_id")
    @JsonAlias("intent")
    private String intent;

    @JsonProperty("domain")
    private String domain;  // informational only, the domain table in IntentResolver is authoritative

    @JsonProperty("patterns")
    private List<PatternDefinition> patterns;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PatternDefinition {

        @JsonProperty("regex")
        private String regex;

        @JsonProperty("flags")
        private List<String> flags;  // IGNORECASE | MULTILINE | DOTALL
    }
}
