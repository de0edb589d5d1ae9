package com.partd.campusqa.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnswerResult {

    private String answer;

    private List<SourceCitation> sources;

    private Double confidence;  // 0.0 to 1.0

    private Map<String, Object> debug;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class SourceCitation {
        private String title;
        private String url;
        private String snippet;
    }
}
