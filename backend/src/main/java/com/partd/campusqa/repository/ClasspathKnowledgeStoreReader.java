package com.partd.campusqa.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.partd.campusqa.model.HallRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Knowledge store read from a JSON file shaped as {@code {"halls": [ {...}, ... ]}}.
 * The file is read once; a missing file means an empty store and a malformed record is skipped.
 */
@Component
@ConditionalOnProperty(name = "knowledge.store", havingValue = "classpath", matchIfMissing = true)
@Slf4j
public class ClasspathKnowledgeStoreReader implements KnowledgeStoreReader {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final Map<String, List<HallRecord>> collections;

    public ClasspathKnowledgeStoreReader(
            @Value("${knowledge.classpath-location:classpath:knowledge/halls.json}") Resource source) {
        this.collections = read(source);
    }

    @Override
    public List<HallRecord> fetchAllRecords(String collection) {
        return collections.getOrDefault(collection, List.of());
    }

    private static Map<String, List<HallRecord>> read(Resource source) {
        if (source == null || !source.exists()) {
            log.warn("⚠️  Knowledge file {} not found, store is empty", source);
            return Collections.emptyMap();
        }

        JsonNode root;
        try (InputStream is = source.getInputStream()) {
            root = OBJECT_MAPPER.readTree(is);
        } catch (IOException e) {
            log.error("❌ Error reading knowledge file {}: {}", source.getDescription(), e.getMessage(), e);
            return Collections.emptyMap();
        }
        if (root == null || !root.isObject()) {
            log.error("❌ Knowledge file {} must be an object of collections, store is empty", source.getDescription());
            return Collections.emptyMap();
        }

        Map<String, List<HallRecord>> frozen = new LinkedHashMap<>();
        root.fields().forEachRemaining(collection -> {
            List<HallRecord> records = readCollection(collection.getKey(), collection.getValue());
            log.info("✅ Loaded {} records into collection '{}' from {}",
                    records.size(), collection.getKey(), source.getFilename());
            frozen.put(collection.getKey(), records);
        });
        return Collections.unmodifiableMap(frozen);
    }

    // Each record is bound on its own; a malformed one is skipped.
    private static List<HallRecord> readCollection(String collection, JsonNode items) {
        if (items == null || !items.isArray()) {
            if (items != null && !items.isNull()) {
                log.warn("⚠️  Collection '{}' is not an array, treating it as empty", collection);
            }
            return List.of();
        }

        List<HallRecord> records = new ArrayList<>();
        int index = 0;
        for (JsonNode item : items) {
            if (item != null && !item.isNull()) {
                try {
                    records.add(OBJECT_MAPPER.convertValue(item, HallRecord.class));
                } catch (IllegalArgumentException e) {
                    log.warn("⚠️  Skipping record {} ('{}') of collection '{}': {}",
                            index, item.path("name").asText(""), collection, e.getMessage());
                }
            }
            index++;
        }
        return Collections.unmodifiableList(records);
    }
}
