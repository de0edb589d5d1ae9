package com.partd.campusqa.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.partd.campusqa.model.IntentClassification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Intent classifier backed by an OpenAI-compatible chat completions endpoint.
 * One blocking call per question with a fixed timeout and no retries; any failure means "no opinion".
 */
@Slf4j
public class OpenAiIntentClassifier implements IntentClassifier {

    static final double MENTION_CONFIDENCE = 0.5;

    private static final String SYSTEM_PROMPT =
        "You are an intent classifier. Return ONLY valid JSON with keys " +
        "'intent' and 'confidence'. 'intent' must be one of the provided " +
        "labels or null. 'confidence' must be a float between 0 and 1.";

    private final WebClient webClient;
    private final String endpointUrl;
    private final String model;
    private final Duration timeout;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OpenAiIntentClassifier(WebClient.Builder builder, String endpointUrl, String apiKey,
                                  String model, Duration timeout) {
        this.webClient = builder
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .build();
        this.endpointUrl = endpointUrl;
        this.model = model;
        this.timeout = timeout;
    }

    @Override
    public IntentClassification classify(String text, Set<String> allowedLabels) {
        Set<String> labels = new TreeSet<>();
        if (allowedLabels != null) {
            allowedLabels.stream().filter(l -> l != null && !l.isBlank()).forEach(labels::add);
        }
        if (labels.isEmpty() || text == null || text.isBlank()) {
            return IntentClassification.noOpinion();
        }

        String responseBody;
        try {
            log.debug("Classifying intent via {} for text: {}", endpointUrl, text);
            responseBody = webClient.post()
                    .uri(endpointUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(buildRequest(text, labels))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
        } catch (Exception e) {
            log.warn("Intent classifier call failed, continuing without intent: {}", e.getMessage());
            return IntentClassification.noOpinion();
        }

        return parseResponse(responseBody, labels);
    }

    @Override
    public String name() {
        return "openai:" + model;
    }

    Map<String, Object> buildRequest(String text, Set<String> labels) {
        return Map.of(
            "model", model,
            "temperature", 0,
            "max_tokens", 50,
            "messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content",
                        "Text: " + text + "\nAllowed intents: " + String.join(", ", labels))
            )
        );
    }

    /**
     * Reads the chat completion body. The message content should be JSON with intent and confidence;
     * otherwise the first allowed label mentioned in the content is taken at a reduced confidence.
     */
    IntentClassification parseResponse(String responseBody, Set<String> labels) {
        String content = extractMessageContent(responseBody);
        if (content == null || content.isBlank()) {
            log.warn("Intent classifier returned no message content");
            return IntentClassification.noOpinion(responseBody);
        }

        JsonNode parsed = readTree(content);
        if (parsed != null && parsed.isObject()) {
            JsonNode intentNode = parsed.get("intent");
            double confidence = parsed.path("confidence").asDouble(0.0);
            if (!Double.isFinite(confidence)) {
                log.warn("Intent classifier returned a non-finite confidence, ignoring answer: {}", content);
                return IntentClassification.noOpinion(content);
            }
            if (intentNode == null || intentNode.isNull() || "null".equals(intentNode.asText())) {
                return new IntentClassification(null, clamp(confidence), content);
            }
            String intent = intentNode.asText();
            if (labels.contains(intent)) {
                return new IntentClassification(intent, clamp(confidence), content);
            }
        }

        String lowered = content.toLowerCase(Locale.ROOT);
        for (String label : labels) {
            if (lowered.contains(label.toLowerCase(Locale.ROOT))) {
                return new IntentClassification(label, MENTION_CONFIDENCE, content);
            }
        }
        log.debug("Intent classifier answer did not name an allowed intent: {}", content);
        return IntentClassification.noOpinion(content);
    }

    private String extractMessageContent(String responseBody) {
        JsonNode root = readTree(responseBody);
        if (root == null) {
            return null;
        }
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            return null;
        }
        JsonNode content = choices.get(0).path("message").path("content");
        return content.isTextual() ? content.asText() : null;
    }

    private JsonNode readTree(String text) {
        if (text == null) {
            return null;
        }
        try {
            return objectMapper.readTree(text);
        } catch (Exception e) {
            log.debug("Classifier payload is not JSON: {}", e.getMessage());
            return null;
        }
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
