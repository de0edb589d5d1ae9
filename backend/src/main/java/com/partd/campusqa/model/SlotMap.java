package com.partd.campusqa.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Slot type → ordered values.
 * Gazetteer slots keep canonical values unique; the {@code place} slot keeps raw phrases as captured.
 */
@ToString
@EqualsAndHashCode
public class SlotMap {

    public static final String PLACE = "place";

    private final Map<String, List<String>> slots = new LinkedHashMap<>();

    public SlotMap() {
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public SlotMap(Map<String, List<String>> values) {
        if (values != null) {
            values.forEach((type, list) -> {
                if (type != null && list != null) {
                    slots.put(type, new ArrayList<>(list));
                }
            });
        }
    }

    /**
     * Records a canonical value unless this slot type already holds it.
     */
    public void addCanonical(String slotType, String value) {
        List<String> values = slots.computeIfAbsent(slotType, k -> new ArrayList<>());
        if (!values.contains(value)) {
            values.add(value);
        }
    }

    public void addPlace(String phrase) {
        slots.computeIfAbsent(PLACE, k -> new ArrayList<>()).add(phrase);
    }

    public List<String> get(String slotType) {
        List<String> values = slots.get(slotType);
        return values == null ? List.of() : Collections.unmodifiableList(values);
    }

    /**
     * All values in slot-type order, then value order.
     */
    public List<String> allValues() {
        List<String> all = new ArrayList<>();
        slots.values().forEach(all::addAll);
        return all;
    }

    public boolean isEmpty() {
        return slots.values().stream().allMatch(List::isEmpty);
    }

    @JsonValue
    public Map<String, List<String>> asMap() {
        return Collections.unmodifiableMap(slots);
    }
}
