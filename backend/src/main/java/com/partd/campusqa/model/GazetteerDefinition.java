package com.partd.campusqa.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One slot-type document from gazetteer.json: {@code {_id: slot_type, items: [{canonical, aliases}]}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GazetteerDefinition {

    @JsonProperty("_id")
    private String slotType;

    @JsonProperty("items")
    private List<Item> items;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Item {

        @JsonProperty("canonical")
        private String canonical;

        @JsonProperty("aliases")
        private List<String> aliases;
    }
}
