package com.partd.campusqa.service;

import com.partd.campusqa.model.AnswerResult;
import com.partd.campusqa.model.EvaluationResult;
import com.partd.campusqa.model.ProcessorOutput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Heuristic quality scoring of a synthesized answer.
 * Four sub-scores on 0-100 are combined with configurable weights into an overall score.
 */
@Service
@Slf4j
public class AnswerEvaluator {

    private static final Set<String> STOP_WORDS = Set.of(
        "the", "a", "an", "is", "are", "was", "were", "for", "of", "to", "in", "on", "at",
        "and", "or", "me", "my", "i", "you", "about", "what", "which", "how", "tell", "can", "do", "does"
    );

    private static final List<String> STRUCTURE_MARKERS = List.of(
        "first", "second", "step", "because", "however", "- ", "• ", ":"
    );

    private final double relevanceWeight;
    private final double completenessWeight;
    private final double clarityWeight;
    private final double accuracyWeight;
    private final double qualityThreshold;

    public AnswerEvaluator(@Value("${evaluator.weights.relevance:0.35}") double relevanceWeight,
                           @Value("${evaluator.weights.completeness:0.25}") double completenessWeight,
                           @Value("${evaluator.weights.clarity:0.20}") double clarityWeight,
                           @Value("${evaluator.weights.accuracy:0.20}") double accuracyWeight,
                           @Value("${evaluator.quality-threshold:70}") double qualityThreshold) {
        this.relevanceWeight = relevanceWeight;
        this.completenessWeight = completenessWeight;
        this.clarityWeight = clarityWeight;
        this.accuracyWeight = accuracyWeight;
        this.qualityThreshold = qualityThreshold;
    }

    public EvaluationResult evaluate(String question, ProcessorOutput processed, AnswerResult answer) {
        String state = stateOf(answer);

        double relevance = evaluateRelevance(processed, answer, state);
        double completeness = evaluateCompleteness(answer);
        double clarity = evaluateClarity(answer);
        double accuracy = evaluateAccuracy(answer, state);

        double overall = Math.round((relevance * relevanceWeight
                + completeness * completenessWeight
                + clarity * clarityWeight
                + accuracy * accuracyWeight) * 100.0) / 100.0;
        boolean passed = overall >= qualityThreshold;

        log.info("Evaluated answer for '{}': overall={} (relevance={}, completeness={}, clarity={}, accuracy={}), passed={}",
                question, overall, relevance, completeness, clarity, accuracy, passed);

        return EvaluationResult.builder()
                .overallScore(overall)
                .relevanceScore(relevance)
                .completenessScore(completeness)
                .clarityScore(clarity)
                .accuracyScore(accuracy)
                .feedback(feedback(relevance, completeness, clarity, accuracy))
                .suggestions(suggestions(relevance, completeness, clarity, accuracy))
                .passed(passed)
                .qualityThreshold(qualityThreshold)
                .build();
    }

    /**
     * Share of question keywords echoed in the answer, blended with whether a record-backed strategy answered.
     */
    double evaluateRelevance(ProcessorOutput processed, AnswerResult answer, String state) {
        String text = answerText(answer).toLowerCase(Locale.ROOT);
        Set<String> keywords = keywords(processed);

        double keywordScore;
        if (keywords.isEmpty()) {
            keywordScore = 50;
        } else {
            long hits = keywords.stream().filter(text::contains).count();
            keywordScore = hits * 100.0 / keywords.size();
        }
        double strategyScore = isRecordBacked(state) ? 100 : 70;
        return bound(keywordScore * 0.6 + strategyScore * 0.4);
    }

    double evaluateCompleteness(AnswerResult answer) {
        double score = 0;
        if (answerText(answer).length() > 20) {
            score += 40;
        }
        if (answer != null && answer.getSources() != null && !answer.getSources().isEmpty()) {
            score += 30;
        }
        if (confidenceOf(answer) >= 0.5) {
            score += 30;
        }
        return bound(score);
    }

    double evaluateClarity(AnswerResult answer) {
        String text = answerText(answer);
        if (text.isBlank()) {
            return 0;
        }
        double score = 50;

        int wordCount = text.trim().split("\\s+").length;
        if (wordCount >= 10 && wordCount <= 200) {
            score += 25;
        } else if (wordCount > 5) {
            score += 15;
        }

        if (text.contains(".") || text.contains("!") || text.contains("?") || text.contains(":")) {
            score += 15;
        }

        String lower = text.toLowerCase(Locale.ROOT);
        if (STRUCTURE_MARKERS.stream().anyMatch(lower::contains)) {
            score += 10;
        }
        return bound(score);
    }

    double evaluateAccuracy(AnswerResult answer, String state) {
        double confidence = confidenceOf(answer);
        double score;
        if (confidence >= 0.75) {
            score = 85;
        } else if (confidence >= 0.5) {
            score = 70;
        } else {
            score = 50;
        }

        if (AnswerSynthesizer.State.DETAIL_ANSWER.name().equals(state)) {
            score += 10;
        } else if (AnswerSynthesizer.State.UNDETERMINED.name().equals(state)) {
            score -= 10;
        }
        return bound(score);
    }

    private String feedback(double relevance, double completeness, double clarity, double accuracy) {
        List<String> parts = new ArrayList<>();
        parts.add(relevance >= 80 ? "The answer is highly relevant to the question."
                : relevance >= 60 ? "The answer is reasonably relevant but could be more focused."
                : "The answer lacks relevance to the original question.");
        parts.add(completeness >= 80 ? "The answer is comprehensive and well-supported."
                : completeness >= 60 ? "The answer covers the main points but lacks some details."
                : "The answer is incomplete and needs more information.");
        parts.add(clarity >= 80 ? "The answer is clear and well-structured."
                : clarity >= 60 ? "The answer is understandable but could be clearer."
                : "The answer lacks clarity and structure.");
        parts.add(accuracy >= 80 ? "The answer appears to be accurate and reliable."
                : accuracy >= 60 ? "The answer seems reasonably accurate but needs verification."
                : "The accuracy of the answer is questionable.");
        return String.join(" ", parts);
    }

    private List<String> suggestions(double relevance, double completeness, double clarity, double accuracy) {
        List<String> suggestions = new ArrayList<>();
        if (relevance < 70) {
            suggestions.add("Include more keywords from the original question in the answer");
        }
        if (completeness < 70) {
            suggestions.add("Add more supporting details and cite sources");
        }
        if (clarity < 70) {
            suggestions.add("Improve structure and readability of the answer");
        }
        if (accuracy < 70) {
            suggestions.add("Verify information and provide more confident responses");
        }
        if (suggestions.isEmpty()) {
            suggestions.add("The answer meets quality standards");
        }
        return suggestions;
    }

    private Set<String> keywords(ProcessorOutput processed) {
        Set<String> keywords = new LinkedHashSet<>();
        if (processed == null || processed.getCleanText() == null) {
            return keywords;
        }
        for (String word : processed.getCleanText().split("\\s+")) {
            String token = word.replaceAll("[^\\p{L}\\p{N}]", "");
            if (token.length() > 2 && !STOP_WORDS.contains(token)) {
                keywords.add(token);
            }
        }
        return keywords;
    }

    private static boolean isRecordBacked(String state) {
        return AnswerSynthesizer.State.DETAIL_ANSWER.name().equals(state)
                || AnswerSynthesizer.State.SHORTLIST.name().equals(state);
    }

    private static String stateOf(AnswerResult answer) {
        if (answer == null || answer.getDebug() == null) {
            return null;
        }
        Map<String, Object> debug = answer.getDebug();
        Object state = debug.get("state");
        return state == null ? null : state.toString();
    }

    private static String answerText(AnswerResult answer) {
        return answer == null || answer.getAnswer() == null ? "" : answer.getAnswer();
    }

    private static double confidenceOf(AnswerResult answer) {
        return answer == null || answer.getConfidence() == null ? 0.0 : answer.getConfidence();
    }

    private static double bound(double score) {
        return Math.max(0, Math.min(100, score));
    }
}
