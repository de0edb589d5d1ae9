package com.partd.campusqa.config;

import com.partd.campusqa.client.IntentClassifier;
import com.partd.campusqa.client.NoOpIntentClassifier;
import com.partd.campusqa.client.OpenAiIntentClassifier;
import com.partd.campusqa.model.Gazetteer;
import com.partd.campusqa.model.IntentRule;
import com.partd.campusqa.model.NluContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Builds the shared NLU context and picks the fallback intent classifier.
 * A missing or unreadable rule or gazetteer source fails application startup.
 */
@Configuration
@Slf4j
public class NluConfig {

    @Bean
    public NluContext nluContext(IntentConfigLoader intentConfigLoader,
                                 GazetteerConfigLoader gazetteerConfigLoader,
                                 @Value("${nlu.intent-patterns:classpath:nlu/intent-patterns.json}") Resource intentPatterns,
                                 @Value("${nlu.gazetteer:classpath:nlu/gazetteer.json}") Resource gazetteerSource) {
        List<IntentRule> rules = intentConfigLoader.load(intentPatterns);
        Gazetteer gazetteer = gazetteerConfigLoader.load(gazetteerSource);
        NluContext context = new NluContext(rules, gazetteer);
        log.info("NLU context ready: {} rules, {} known intents, {} slot types",
                rules.size(), context.getKnownIntents().size(), gazetteer.slotTypes().size());
        return context;
    }

    @Bean
    public IntentClassifier intentClassifier(
            @Value("${nlu.classifier.provider:none}") String provider,
            @Value("${nlu.classifier.endpoint-url:https://api.openai.com/v1/chat/completions}") String endpointUrl,
            @Value("${nlu.classifier.api-key:}") String apiKey,
            @Value("${nlu.classifier.model:gpt-4o-mini}") String model,
            @Value("${nlu.classifier.timeout-ms:20000}") long timeoutMs) {
        String normalized = provider == null ? "" : provider.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "openai":
            case "openai_compatible":
            case "openai-compatible":
                if (apiKey == null || apiKey.isBlank()) {
                    log.warn("⚠️  nlu.classifier.provider={} but no api key is set, classifier fallback disabled", provider);
                    return new NoOpIntentClassifier();
                }
                log.info("Using OpenAI-compatible intent classifier at {} (model: {}, timeout: {}ms)",
                        endpointUrl, model, timeoutMs);
                return new OpenAiIntentClassifier(WebClient.builder(), endpointUrl, apiKey.trim(), model,
                        Duration.ofMillis(timeoutMs));
            case "":
            case "none":
            case "off":
            case "disabled":
                log.info("Intent classifier fallback disabled");
                return new NoOpIntentClassifier();
            default:
                log.warn("⚠️  Unknown nlu.classifier.provider '{}', classifier fallback disabled", provider);
                return new NoOpIntentClassifier();
        }
    }
}
