package com.partd.campusqa.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class RoomPrice {

    @JsonProperty("year")
    private String year;  // academic year, e.g. "2025/26"

    @JsonProperty("per_week_amount")
    @JsonAlias("per_week")
    private BigDecimal perWeekAmount;

    @JsonProperty("total_amount")
    @JsonAlias("total")
    private BigDecimal totalAmount;
}
