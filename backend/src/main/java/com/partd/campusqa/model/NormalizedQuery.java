package com.partd.campusqa.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class NormalizedQuery {

    private String rawText;

    private String cleanText;  // never null, "" for empty input
}
