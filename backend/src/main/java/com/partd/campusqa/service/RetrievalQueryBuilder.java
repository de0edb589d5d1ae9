package com.partd.campusqa.service;

import com.partd.campusqa.model.SlotMap;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the retrieval query: clean text ; slot values joined by " | " ; domain hint.
 */
@Component
public class RetrievalQueryBuilder {

    static final String SEGMENT_SEPARATOR = " ; ";
    static final String SLOT_SEPARATOR = " | ";

    private static final Map<String, String> DOMAIN_HINTS = Map.of(
        IntentResolver.LOCATION, "location on campus",
        IntentResolver.COURSE_INFO, "course information and entry requirements",
        IntentResolver.EVENT_INFO, "date and time",
        IntentResolver.ACCOMMODATION, "halls of residence and prices"
    );

    public String build(String cleanText, String domain, SlotMap slots) {
        List<String> parts = new ArrayList<>();
        parts.add(cleanText == null ? "" : cleanText);

        List<String> slotTerms = slots == null ? List.of() : slots.allValues();
        if (!slotTerms.isEmpty()) {
            parts.add(String.join(SLOT_SEPARATOR, slotTerms));
        }

        String hint = hintFor(domain);
        if (hint != null) {
            parts.add(hint);
        }
        return String.join(SEGMENT_SEPARATOR, parts);
    }

    public String hintFor(String domain) {
        return domain == null ? null : DOMAIN_HINTS.get(domain);
    }
}
