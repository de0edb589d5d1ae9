package com.partd.campusqa.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.partd.campusqa.model.IntentDefinition;
import com.partd.campusqa.model.IntentRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Loads intent rules from intent-patterns.json.
 * The file order is preserved: it is the first-match-wins priority of the rules.
 */
@Component
@Slf4j
public class IntentConfigLoader {

    private static final Map<String, Integer> FLAG_MAP = Map.of(
        "IGNORECASE", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE,
        "MULTILINE", Pattern.MULTILINE,
        "DOTALL", Pattern.DOTALL
    );

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Compile every usable pattern of the resource into an ordered rule list.
     *
     * @throws IllegalStateException if the resource is missing, unreadable or not a JSON array
     */
    public List<IntentRule> load(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new IllegalStateException("Intent pattern source not found: " + resource);
        }

        List<IntentDefinition> definitions;
        try (InputStream is = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(is);
            if (root == null || !root.isArray()) {
                throw new IllegalStateException("Invalid intent pattern source " + resource.getDescription()
                        + ": top-level array expected");
            }
            definitions = objectMapper.convertValue(root, new TypeReference<List<IntentDefinition>>() {});
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Cannot read intent pattern source " + resource.getDescription(), e);
        }

        List<IntentRule> rules = compile(definitions);
        log.info("✅ Loaded {} intent rules for {} intents from {}",
                rules.size(), definitions.size(), resource.getFilename());
        return rules;
    }

    List<IntentRule> compile(List<IntentDefinition> definitions) {
        List<IntentRule> rules = new ArrayList<>();
        for (IntentDefinition definition : definitions) {
            if (definition == null || definition.getIntent() == null || definition.getIntent().isBlank()) {
                log.warn("⚠️  Skipping intent entry without a label: {}", definition);
                continue;
            }
            if (definition.getPatterns() == null) {
                log.warn("⚠️  Skipping intent '{}': no patterns", definition.getIntent());
                continue;
            }
            for (IntentDefinition.PatternDefinition p : definition.getPatterns()) {
                if (p == null || p.getRegex() == null || p.getRegex().isEmpty()) {
                    log.warn("⚠️  Skipping pattern without regex for intent '{}'", definition.getIntent());
                    continue;
                }
                try {
                    rules.add(new IntentRule(definition.getIntent(), Pattern.compile(p.getRegex(), flags(p.getFlags()))));
                } catch (PatternSyntaxException e) {
                    log.warn("⚠️  Skipping invalid regex '{}' for intent '{}': {}",
                            p.getRegex(), definition.getIntent(), e.getDescription());
                }
            }
        }
        return rules;
    }

    private int flags(List<String> names) {
        int flags = 0;
        if (names == null) {
            return flags;
        }
        for (String name : names) {
            Integer flag = name == null ? null : FLAG_MAP.get(name.trim().toUpperCase(Locale.ROOT));
            if (flag == null) {
                log.debug("Ignoring unknown regex flag '{}'", name);
                continue;
            }
            flags |= flag;
        }
        return flags;
    }
}
