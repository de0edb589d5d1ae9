package com.partd.campusqa.service;

import com.partd.campusqa.model.NluContext;
import com.partd.campusqa.model.SlotMap;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Extracts slots from normalized text: gazetteer hits by substring, then free-text place phrases.
 */
@Service
public class SlotExtractor {

    private static final List<Pattern> PLACE_PATTERNS = List.of(
        Pattern.compile("how\\s+do\\s+i\\s+get\\s+to\\s+(.*)"),
        Pattern.compile("where\\s+is\\s+(.*)")
    );

    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\\p{Punct}\\s]+|[\\p{Punct}\\s]+$");

    private final NluContext context;
    private final TextNormalizer normalizer;

    public SlotExtractor(NluContext context, TextNormalizer normalizer) {
        this.context = context;
        this.normalizer = normalizer;
    }

    public SlotMap extract(String cleanText) {
        SlotMap slots = new SlotMap();
        if (cleanText == null || cleanText.isEmpty()) {
            return slots;
        }

        for (Map.Entry<String, Map<String, List<String>>> slotType : context.getGazetteer().entries().entrySet()) {
            for (Map.Entry<String, List<String>> entry : slotType.getValue().entrySet()) {
                if (mentions(cleanText, entry.getKey(), entry.getValue())) {
                    slots.addCanonical(slotType.getKey(), entry.getKey());
                }
            }
        }

        for (String phrase : extractPlacePhrases(cleanText)) {
            slots.addPlace(phrase);
        }
        return slots;
    }

    /**
     * Phrases after "how do i get to" / "where is"; every pattern that matches contributes one.
     */
    List<String> extractPlacePhrases(String cleanText) {
        return PLACE_PATTERNS.stream()
                .map(p -> p.matcher(cleanText))
                .filter(Matcher::find)
                .map(m -> EDGE_PUNCTUATION.matcher(m.group(1)).replaceAll(""))
                .filter(phrase -> !phrase.isEmpty())
                .collect(Collectors.toList());
    }

    private boolean mentions(String cleanText, String canonical, List<String> aliases) {
        if (contains(cleanText, canonical)) {
            return true;
        }
        for (String alias : aliases) {
            if (contains(cleanText, alias)) {
                return true;
            }
        }
        return false;
    }

    private boolean contains(String cleanText, String phrase) {
        String needle = normalizer.normalize(phrase);
        return !needle.isEmpty() && cleanText.contains(needle);
    }
}
