package com.partd.campusqa.service;

import com.partd.campusqa.client.IntentClassifier;
import com.partd.campusqa.model.IntentClassification;
import com.partd.campusqa.model.IntentRule;
import com.partd.campusqa.model.NluContext;
import com.partd.campusqa.model.ResolvedIntent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Resolves the intent of a normalized question and maps it to a domain.
 * Rules are tried in configured order, first match wins; the classifier is only asked when none match.
 */
@Service
@Slf4j
public class IntentResolver {

    public static final String LOCATION = "location";
    public static final String EVENT_INFO = "event_info";
    public static final String COURSE_INFO = "course_info";
    public static final String FEES_FUNDING = "fees_funding";
    public static final String ACCOMMODATION = "accommodation";
    public static final String IT_SUPPORT = "it_support";
    public static final String LIBRARY = "library";

    private static final Map<String, String> INTENT_TO_DOMAIN = Map.of(
        "ask_location", LOCATION,
        "ask_directions", LOCATION,
        "ask_time", EVENT_INFO,
        "ask_entry_requirements", COURSE_INFO,
        "ask_course_info", COURSE_INFO,
        "ask_fees", FEES_FUNDING,
        "ask_funding", FEES_FUNDING,
        "ask_accommodation", ACCOMMODATION,
        "ask_it_help", IT_SUPPORT,
        "ask_library", LIBRARY
    );

    private final NluContext context;
    private final IntentClassifier classifier;
    private final double ruleConfidence;

    public IntentResolver(NluContext context,
                          IntentClassifier classifier,
                          @Value("${nlu.rule-confidence:0.9}") double ruleConfidence) {
        this.context = context;
        this.classifier = classifier;
        this.ruleConfidence = ruleConfidence;
    }

    public ResolvedIntent resolve(String cleanText) {
        if (cleanText == null || cleanText.isEmpty()) {
            return ResolvedIntent.none();
        }

        for (IntentRule rule : context.getIntentRules()) {
            if (rule.matches(cleanText)) {
                log.debug("Intent '{}' matched by pattern /{}/", rule.getLabel(), rule.getPattern().pattern());
                return ResolvedIntent.fromRule(rule.getLabel(), ruleConfidence);
            }
        }

        return classify(cleanText);
    }

    /**
     * Fixed intent → domain table; unknown or null intents have no domain.
     */
    public String mapToDomain(String intent) {
        return intent == null ? null : INTENT_TO_DOMAIN.get(intent);
    }

    private ResolvedIntent classify(String cleanText) {
        IntentClassification classification;
        try {
            classification = classifier.classify(cleanText, context.getKnownIntents());
        } catch (RuntimeException e) {
            log.warn("Intent classifier '{}' failed, no intent resolved: {}", classifier.name(), e.getMessage());
            return ResolvedIntent.none();
        }

        if (classification == null || classification.getIntent() == null) {
            log.debug("No rule matched and classifier '{}' had no opinion", classifier.name());
            return ResolvedIntent.none();
        }
        if (!context.getKnownIntents().contains(classification.getIntent())) {
            log.warn("Classifier '{}' returned unknown intent '{}', ignoring", classifier.name(), classification.getIntent());
            return ResolvedIntent.none();
        }

        log.debug("Intent '{}' from classifier '{}' (confidence {})",
                classification.getIntent(), classifier.name(), classification.getConfidence());
        return ResolvedIntent.fromClassifier(classification.getIntent(), classification.getConfidence());
    }
}
