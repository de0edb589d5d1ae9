package com.partd.campusqa.service;

import com.partd.campusqa.model.NormalizedQuery;
import com.partd.campusqa.model.ProcessorOutput;
import com.partd.campusqa.model.ResolvedIntent;
import com.partd.campusqa.model.SlotMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Question understanding: normalize → intent → domain → slots → retrieval query.
 */
@Service
@Slf4j
public class QuestionProcessor {

    static final double RESOLVED_DOMAIN_CONFIDENCE = 0.8;

    private final TextNormalizer normalizer;
    private final IntentResolver intentResolver;
    private final SlotExtractor slotExtractor;
    private final RetrievalQueryBuilder queryBuilder;

    public QuestionProcessor(TextNormalizer normalizer,
                             IntentResolver intentResolver,
                             SlotExtractor slotExtractor,
                             RetrievalQueryBuilder queryBuilder) {
        this.normalizer = normalizer;
        this.intentResolver = intentResolver;
        this.slotExtractor = slotExtractor;
        this.queryBuilder = queryBuilder;
    }

    public ProcessorOutput process(String question) {
        NormalizedQuery query = normalizer.toQuery(question);
        String cleanText = query.getCleanText();

        ResolvedIntent resolved = intentResolver.resolve(cleanText);
        String domain = intentResolver.mapToDomain(resolved.getIntent());
        SlotMap slots = slotExtractor.extract(cleanText);
        String retrievalQuery = queryBuilder.build(cleanText, domain, slots);

        Map<String, Double> confidence = new LinkedHashMap<>();
        confidence.put(ProcessorOutput.INTENT_CONFIDENCE, resolved.getConfidence());
        confidence.put(ProcessorOutput.DOMAIN_CONFIDENCE, domain != null ? RESOLVED_DOMAIN_CONFIDENCE : 0.0);

        log.info("Processed '{}': intent={} ({}, {}), domain={}, slots={}",
                cleanText, resolved.getIntent(), resolved.getSource(), resolved.getConfidence(), domain, slots.asMap());

        return ProcessorOutput.builder()
                .rawText(query.getRawText())
                .cleanText(cleanText)
                .domain(domain)
                .intent(resolved.getIntent())
                .slots(slots)
                .retrievalQuery(retrievalQuery)
                .confidence(confidence)
                .build();
    }
}
