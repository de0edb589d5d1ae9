package com.partd.campusqa.service;

import com.partd.campusqa.client.IntentClassifier;
import com.partd.campusqa.model.Gazetteer;
import com.partd.campusqa.model.IntentClassification;
import com.partd.campusqa.model.IntentRule;
import com.partd.campusqa.model.NluContext;
import com.partd.campusqa.model.ResolvedIntent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IntentResolverTest {

    @Mock
    private IntentClassifier classifier;

    private IntentResolver resolver;

    @BeforeEach
    void setUp() {
        NluContext context = new NluContext(List.of(
                rule("ask_location", "\\bwhere(?:'s| is)\\b"),
                rule("ask_time", "\\bwhen(?:'s| is)\\b"),
                rule("ask_accommodation", "\\bhalls?\\b")
        ), Gazetteer.empty());
        resolver = new IntentResolver(context, classifier, 0.9);
    }

    @Test
    void firstMatchingRuleWinsWithoutAskingClassifier() {
        ResolvedIntent resolved = resolver.resolve("where is the hall reception");

        assertThat(resolved.getIntent()).isEqualTo("ask_location");
        assertThat(resolved.getConfidence()).isEqualTo(0.9);
        assertThat(resolved.getSource()).isEqualTo(ResolvedIntent.Source.RULE);
        verify(classifier, never()).classify(anyString(), anySet());
    }

    @Test
    void classifierAnswerIsAdoptedWhenNoRuleMatches() {
        when(classifier.classify(eq("i need help with money"), anySet()))
                .thenReturn(new IntentClassification("ask_time", 0.72, "{}"));

        ResolvedIntent resolved = resolver.resolve("i need help with money");

        assertThat(resolved.getIntent()).isEqualTo("ask_time");
        assertThat(resolved.getConfidence()).isEqualTo(0.72);
        assertThat(resolved.getSource()).isEqualTo(ResolvedIntent.Source.CLASSIFIER);
    }

    @Test
    void classifierIsOfferedKnownIntentsInRuleOrder() {
        when(classifier.classify(anyString(), anySet())).thenAnswer(invocation -> {
            assertThat(invocation.<Set<String>>getArgument(1))
                    .containsExactly("ask_location", "ask_time", "ask_accommodation");
            return IntentClassification.noOpinion();
        });

        assertThat(resolver.resolve("something else").isResolved()).isFalse();
    }

    @Test
    void labelOutsideKnownIntentsIsRejected() {
        when(classifier.classify(anyString(), anySet()))
                .thenReturn(new IntentClassification("ask_weather", 0.95, "{}"));

        ResolvedIntent resolved = resolver.resolve("is it going to rain");

        assertThat(resolved.getIntent()).isNull();
        assertThat(resolved.getConfidence()).isZero();
    }

    @Test
    void classifierFailureMeansNoIntent() {
        when(classifier.classify(anyString(), anySet())).thenThrow(new IllegalStateException("boom"));
        when(classifier.name()).thenReturn("mock");

        ResolvedIntent resolved = resolver.resolve("random words");

        assertThat(resolved.getIntent()).isNull();
        assertThat(resolved.getSource()).isEqualTo(ResolvedIntent.Source.NONE);
    }

    @Test
    void classifierConfidenceIsClamped() {
        when(classifier.classify(anyString(), anySet()))
                .thenReturn(new IntentClassification("ask_time", 1.7, "{}"));

        assertThat(resolver.resolve("random words").getConfidence()).isEqualTo(1.0);
    }

    @Test
    void nanClassifierConfidenceBecomesZero() {
        when(classifier.classify(anyString(), anySet()))
                .thenReturn(new IntentClassification("ask_time", Double.NaN, "{}"));

        ResolvedIntent resolved = resolver.resolve("random words");

        assertThat(resolved.getIntent()).isEqualTo("ask_time");
        assertThat(resolved.getConfidence()).isZero();
    }

    @Test
    void emptyTextResolvesToNothing() {
        ResolvedIntent resolved = resolver.resolve("");

        assertThat(resolved.isResolved()).isFalse();
        verify(classifier, never()).classify(anyString(), anySet());
    }

    @Test
    void mapsIntentsToDomains() {
        assertThat(resolver.mapToDomain("ask_location")).isEqualTo("location");
        assertThat(resolver.mapToDomain("ask_directions")).isEqualTo("location");
        assertThat(resolver.mapToDomain("ask_time")).isEqualTo("event_info");
        assertThat(resolver.mapToDomain("ask_entry_requirements")).isEqualTo("course_info");
        assertThat(resolver.mapToDomain("ask_course_info")).isEqualTo("course_info");
        assertThat(resolver.mapToDomain("ask_fees")).isEqualTo("fees_funding");
        assertThat(resolver.mapToDomain("ask_funding")).isEqualTo("fees_funding");
        assertThat(resolver.mapToDomain("ask_accommodation")).isEqualTo("accommodation");
        assertThat(resolver.mapToDomain("ask_it_help")).isEqualTo("it_support");
        assertThat(resolver.mapToDomain("ask_library")).isEqualTo("library");
        assertThat(resolver.mapToDomain("ask_weather")).isNull();
        assertThat(resolver.mapToDomain(null)).isNull();
    }

    private static IntentRule rule(String label, String regex) {
        return new IntentRule(label, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }
}
