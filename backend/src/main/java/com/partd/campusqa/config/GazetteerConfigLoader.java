package com.partd.campusqa.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.partd.campusqa.model.Gazetteer;
import com.partd.campusqa.model.GazetteerDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Loads the slot gazetteer from gazetteer.json.
 * Blocks without an {@code _id} and items without a canonical value are skipped.
 */
@Component
@Slf4j
public class GazetteerConfigLoader {

    private final ObjectMapper objectMapper = new ObjectMapper();

    public Gazetteer load(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new IllegalStateException("Gazetteer source not found: " + resource);
        }

        List<GazetteerDefinition> definitions;
        try (InputStream is = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(is);
            if (root == null || !root.isArray()) {
                throw new IllegalStateException("Invalid gazetteer source " + resource.getDescription()
                        + ": top-level array expected");
            }
            definitions = objectMapper.convertValue(root, new TypeReference<List<GazetteerDefinition>>() {});
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Cannot read gazetteer source " + resource.getDescription(), e);
        }

        Gazetteer gazetteer = build(definitions);
        log.info("✅ Loaded gazetteer with {} slot types and {} canonical values from {}",
                gazetteer.slotTypes().size(), gazetteer.size(), resource.getFilename());
        return gazetteer;
    }

    Gazetteer build(List<GazetteerDefinition> definitions) {
        Gazetteer.Builder builder = Gazetteer.builder();
        for (GazetteerDefinition block : definitions) {
            if (block == null || block.getSlotType() == null || block.getSlotType().isBlank()) {
                log.warn("⚠️  Skipping gazetteer block without _id");
                continue;
            }
            if (block.getItems() == null) {
                continue;
            }
            for (GazetteerDefinition.Item item : block.getItems()) {
                if (item == null || item.getCanonical() == null || item.getCanonical().isBlank()) {
                    log.warn("⚠️  Skipping gazetteer item without canonical value in '{}'", block.getSlotType());
                    continue;
                }
                builder.add(block.getSlotType(), item.getCanonical(), item.getAliases());
            }
        }
        return builder.build();
    }
}
