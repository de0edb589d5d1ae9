package com.partd.campusqa.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One accommodation hall from the knowledge store.
 * Every field but {@code name} may be missing; list accessors never return null.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class HallRecord {

    @JsonProperty("name")
    private String name;

    @JsonProperty("short_description")
    private String shortDescription;

    @JsonProperty("address")
    private String address;

    @JsonProperty("catering_type")
    private String cateringType;

    @JsonProperty("tags")
    private List<String> tags;

    @JsonProperty("lifestyle_tags")
    private List<String> lifestyleTags;

    @JsonProperty("facilities")
    private List<String> facilities;

    @JsonProperty("room_features_common")
    private List<String> roomFeaturesCommon;

    @JsonProperty("services")
    private List<String> services;

    @JsonProperty("room_types")
    private List<RoomType> roomTypes;

    @JsonProperty("official_url")
    private String officialUrl;

    @JsonProperty("contact_email")
    private String contactEmail;

    @JsonProperty("contact_phone")
    private String contactPhone;

    public List<String> getTags() {
        return tags == null ? List.of() : tags;
    }

    public List<String> getLifestyleTags() {
        return lifestyleTags == null ? List.of() : lifestyleTags;
    }

    public List<String> getFacilities() {
        return facilities == null ? List.of() : facilities;
    }

    public List<String> getRoomFeaturesCommon() {
        return roomFeaturesCommon == null ? List.of() : roomFeaturesCommon;
    }

    public List<String> getServices() {
        return services == null ? List.of() : services;
    }

    public List<RoomType> getRoomTypes() {
        return roomTypes == null ? List.of() : roomTypes;
    }
}
