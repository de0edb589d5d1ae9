package com.partd.campusqa.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable slot type → canonical value → aliases table.
 * Iteration order is the order in which the configuration listed the entries.
 */
public final class Gazetteer {

    private final Map<String, Map<String, List<String>>> entries;

    private Gazetteer(Map<String, Map<String, List<String>>> entries) {
        this.entries = entries;
    }

    public static Gazetteer empty() {
        return new Gazetteer(Collections.emptyMap());
    }

    public Map<String, Map<String, List<String>>> entries() {
        return entries;
    }

    public Set<String> slotTypes() {
        return entries.keySet();
    }

    public int size() {
        return entries.values().stream().mapToInt(Map::size).sum();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final Map<String, Map<String, Set<String>>> entries = new LinkedHashMap<>();

        /**
         * Adds a canonical value under a slot type. Repeated canonical values merge their aliases.
         */
        public Builder add(String slotType, String canonical, List<String> aliases) {
            Set<String> merged = entries
                    .computeIfAbsent(slotType, k -> new LinkedHashMap<>())
                    .computeIfAbsent(canonical, k -> new LinkedHashSet<>());
            if (aliases != null) {
                for (String alias : aliases) {
                    if (alias != null && !alias.isBlank()) {
                        merged.add(alias);
                    }
                }
            }
            return this;
        }

        public Gazetteer build() {
            Map<String, Map<String, List<String>>> frozen = new LinkedHashMap<>();
            entries.forEach((slotType, values) -> {
                Map<String, List<String>> frozenValues = new LinkedHashMap<>();
                values.forEach((canonical, aliases) -> frozenValues.put(canonical, List.copyOf(aliases)));
                frozen.put(slotType, Collections.unmodifiableMap(frozenValues));
            });
            return new Gazetteer(Collections.unmodifiableMap(frozen));
        }
    }
}
