package com.partd.campusqa.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class RoomType {

    @JsonProperty("name")
    private String name;

    @JsonProperty("ensuite")
    private Boolean ensuite;

    @JsonProperty("tenancy_weeks")
    private Integer tenancyWeeks;

    @JsonProperty("prices")
    private List<RoomPrice> prices;  // chronological, last entry is current

    public List<RoomPrice> getPrices() {
        return prices == null ? List.of() : prices;
    }

    /**
     * The chronologically last price entry, or null when none is listed.
     */
    public RoomPrice currentPrice() {
        List<RoomPrice> all = getPrices();
        return all.isEmpty() ? null : all.get(all.size() - 1);
    }
}
