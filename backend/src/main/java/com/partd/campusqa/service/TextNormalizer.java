package com.partd.campusqa.service;

import com.partd.campusqa.model.NormalizedQuery;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Canonicalizes question text so rule and gazetteer matching see a stable form.
 * NFKC is applied on both sides of lowercasing, so normalizing twice gives the same result.
 */
@Component
public class TextNormalizer {

    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String folded = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        return Normalizer.normalize(folded, Normalizer.Form.NFKC).strip();
    }

    public NormalizedQuery toQuery(String rawText) {
        String raw = rawText == null ? "" : rawText;
        return new NormalizedQuery(raw, normalize(raw));
    }
}
