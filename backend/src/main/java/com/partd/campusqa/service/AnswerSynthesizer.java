package com.partd.campusqa.service;

import com.partd.campusqa.model.AnswerResult;
import com.partd.campusqa.model.HallRecord;
import com.partd.campusqa.model.ProcessorOutput;
import com.partd.campusqa.model.SlotMap;
import com.partd.campusqa.repository.KnowledgeStoreReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns processed questions into answers from the hall knowledge store.
 *
 * <p>Outcomes, checked in this order:
 * <ul>
 *   <li>NO_DATA: the store holds no halls at all</li>
 *   <li>UNDETERMINED: no domain, even after keyword and hall-name inference</li>
 *   <li>UNSUPPORTED: a domain with no knowledge collection behind it</li>
 *   <li>DETAIL_ANSWER: one hall is named, it is described in full</li>
 *   <li>SHORTLIST: otherwise, up to three halls ranked by wanted tags</li>
 * </ul>
 *
 * <p>Never throws; missing record fields become placeholders and store failures count as an empty store.
 */
@Service
@Slf4j
public class AnswerSynthesizer {

    public enum State { NO_DATA, UNDETERMINED, UNSUPPORTED, DETAIL_ANSWER, SHORTLIST }

    static final double INTENT_WEIGHT = 0.6;
    static final double DOMAIN_WEIGHT = 0.4;
    static final double DOMAIN_CONFIDENCE = 0.8;
    static final double MIN_CONFIDENCE = 0.1;
    static final double DETAIL_BOOST = 0.25;
    static final double SHORTLIST_BOOST = 0.15;
    static final int SHORTLIST_SIZE = 3;

    static final String UNDETERMINED_MESSAGE =
        "Sorry, I couldn't work out what you're asking about. Could you rephrase, or mention the hall, "
        + "building or service you mean?";
    static final String NO_DATA_MESSAGE =
        "I couldn't find any accommodation information yet. Please check back later.";
    static final String UNSUPPORTED_MESSAGE =
        "I can't answer questions about %s yet. At the moment I can only help with accommodation: "
        + "halls of residence, their room types and prices.";

    // Domains backed by a knowledge collection.
    private static final Map<String, String> DOMAIN_COLLECTIONS = Map.of(
        IntentResolver.ACCOMMODATION, KnowledgeStoreReader.HALLS
    );

    private static final Map<String, Pattern> DOMAIN_KEYWORDS = new LinkedHashMap<>();

    static {
        DOMAIN_KEYWORDS.put(IntentResolver.ACCOMMODATION, Pattern.compile(
            "\\b(?:accommodation|halls?|dorms?|rooms?|rent|en-?suite|catered|self-catered|tenanc(?:y|ies)|residences?|flats?"
            + "|stay(?:ing)?|live|living|housing|lodgings?)\\b"));
        DOMAIN_KEYWORDS.put(IntentResolver.LIBRARY, Pattern.compile(
            "\\b(?:library|librar(?:y|ies)|borrow|books?)\\b"));
        DOMAIN_KEYWORDS.put(IntentResolver.IT_SUPPORT, Pattern.compile(
            "\\b(?:wifi|wi-fi|eduroam|password|login|log in)\\b"));
        DOMAIN_KEYWORDS.put(IntentResolver.FEES_FUNDING, Pattern.compile(
            "\\b(?:fees?|tuition|scholarships?|bursar(?:y|ies)|funding)\\b"));
        DOMAIN_KEYWORDS.put(IntentResolver.COURSE_INFO, Pattern.compile(
            "\\b(?:courses?|modules?|degree|entry requirements)\\b"));
        DOMAIN_KEYWORDS.put(IntentResolver.LOCATION, Pattern.compile(
            "\\b(?:where|directions|map)\\b"));
        DOMAIN_KEYWORDS.put(IntentResolver.EVENT_INFO, Pattern.compile(
            "\\b(?:when|what time|opening hours)\\b"));
    }

    private final KnowledgeStoreReader knowledgeStore;
    private final HallMatcher hallMatcher;
    private final HallAnswerFormatter formatter;

    public AnswerSynthesizer(KnowledgeStoreReader knowledgeStore,
                             HallMatcher hallMatcher,
                             HallAnswerFormatter formatter) {
        this.knowledgeStore = knowledgeStore;
        this.hallMatcher = hallMatcher;
        this.formatter = formatter;
    }

    public AnswerResult answer(ProcessorOutput processed) {
        try {
            return synthesize(processed == null ? new ProcessorOutput() : processed);
        } catch (RuntimeException e) {
            log.error("❌ Answer synthesis failed, returning clarification: {}", e.getMessage(), e);
            Map<String, Object> debug = new LinkedHashMap<>();
            debug.put("state", State.UNDETERMINED.name());
            debug.put("reason", "synthesis_error");
            debug.put("error", e.getClass().getSimpleName());
            return result(UNDETERMINED_MESSAGE, List.of(), MIN_CONFIDENCE, debug);
        }
    }

    private AnswerResult synthesize(ProcessorOutput processed) {
        String cleanText = processed.getCleanText() == null ? "" : processed.getCleanText();
        SlotMap slots = processed.getSlots() == null ? new SlotMap() : processed.getSlots();
        List<HallRecord> halls = fetchHalls();

        Map<String, Object> debug = new LinkedHashMap<>();
        debug.put("record_count", halls.size());

        // Step 1: domain, from the resolver or inferred
        String domain = processed.getDomain();
        String domainSource = "resolver";
        if (domain == null) {
            domain = inferDomainFromKeywords(cleanText);
            domainSource = "keyword_fallback";
        }
        if (domain == null && hallMatcher.mentionsHallName(cleanText, halls)) {
            domain = IntentResolver.ACCOMMODATION;
            domainSource = "record_name_fallback";
        }
        debug.put("domain", domain);
        debug.put("domain_source", domain == null ? null : domainSource);

        double base = baseConfidence(processed.intentConfidence(), domain);
        debug.put("base_confidence", base);

        if (halls.isEmpty()) {
            debug.put("state", State.NO_DATA.name());
            debug.put("reason", "no_records");
            return result(NO_DATA_MESSAGE, List.of(), Math.max(MIN_CONFIDENCE, base), debug);
        }

        if (domain == null) {
            debug.put("state", State.UNDETERMINED.name());
            debug.put("reason", "domain_none_after_fallback");
            return result(UNDETERMINED_MESSAGE, List.of(), Math.max(MIN_CONFIDENCE, base), debug);
        }

        // Step 2: only domains with a loaded collection can be answered
        if (!DOMAIN_COLLECTIONS.containsKey(domain)) {
            debug.put("state", State.UNSUPPORTED.name());
            debug.put("reason", "domain_not_supported_yet");
            String message = String.format(UNSUPPORTED_MESSAGE, domain.replace('_', ' '));
            return result(message, List.of(), Math.max(MIN_CONFIDENCE, base), debug);
        }

        // Step 3: a named hall gets the full description
        String combined = combinedText(cleanText, slots, processed.getRetrievalQuery());
        Optional<HallRecord> named = hallMatcher.findNamedHall(combined, halls);
        if (named.isPresent()) {
            HallRecord hall = named.get();
            debug.put("state", State.DETAIL_ANSWER.name());
            debug.put("matched_record", hall.getName());
            log.info("Detail answer for hall '{}'", hall.getName());
            return result(formatter.formatDetail(hall), List.of(formatter.toSource(hall)),
                    Math.min(1.0, base + DETAIL_BOOST), debug);
        }

        // Step 4: otherwise rank by wanted tags
        Set<String> wanted = hallMatcher.wantedTags(combined);
        List<HallMatcher.ScoredHall> shortlist = hallMatcher.shortlist(halls, wanted, SHORTLIST_SIZE);
        debug.put("state", State.SHORTLIST.name());
        debug.put("wanted_tags", new ArrayList<>(wanted));
        debug.put("scores", shortlist.stream()
                .map(s -> s.getHall().getName() + ":" + s.getScore())
                .collect(Collectors.toList()));
        log.info("Shortlist of {} halls for wanted tags {}", shortlist.size(), wanted);

        List<AnswerResult.SourceCitation> sources = shortlist.stream()
                .map(s -> formatter.toSource(s.getHall()))
                .collect(Collectors.toList());
        return result(formatter.formatShortlist(shortlist, wanted), sources,
                Math.min(1.0, base + SHORTLIST_BOOST), debug);
    }

    /**
     * 0.6 × intent confidence + 0.4 × domain confidence, where a known domain counts as 0.8.
     */
    static double baseConfidence(double intentConfidence, String domain) {
        double domainConfidence = domain != null ? DOMAIN_CONFIDENCE : 0.0;
        return INTENT_WEIGHT * clamp(intentConfidence) + DOMAIN_WEIGHT * domainConfidence;
    }

    String inferDomainFromKeywords(String cleanText) {
        if (cleanText.isEmpty()) {
            return null;
        }
        for (Map.Entry<String, Pattern> entry : DOMAIN_KEYWORDS.entrySet()) {
            if (entry.getValue().matcher(cleanText).find()) {
                return entry.getKey();
            }
        }
        return null;
    }

    private List<HallRecord> fetchHalls() {
        try {
            List<HallRecord> halls = knowledgeStore.fetchAllRecords(KnowledgeStoreReader.HALLS);
            if (halls == null) {
                return List.of();
            }
            return halls.stream()
                    .filter(h -> h != null)
                    .collect(Collectors.toList());
        } catch (RuntimeException e) {
            log.error("❌ Knowledge store read failed, answering as if empty: {}", e.getMessage(), e);
            return List.of();
        }
    }

    private static String combinedText(String cleanText, SlotMap slots, String retrievalQuery) {
        List<String> parts = new ArrayList<>();
        parts.add(cleanText);
        parts.addAll(slots.allValues());
        if (retrievalQuery != null) {
            parts.add(retrievalQuery);
        }
        return String.join(" ", parts);
    }

    private static AnswerResult result(String answer, List<AnswerResult.SourceCitation> sources,
                                       double confidence, Map<String, Object> debug) {
        return AnswerResult.builder()
                .answer(answer)
                .sources(sources)
                .confidence(clamp(confidence))
                .debug(debug)
                .build();
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
