package com.partd.campusqa.service;

import com.partd.campusqa.client.NoOpIntentClassifier;
import com.partd.campusqa.config.GazetteerConfigLoader;
import com.partd.campusqa.config.IntentConfigLoader;
import com.partd.campusqa.model.NluContext;
import com.partd.campusqa.model.ProcessorOutput;
import com.partd.campusqa.model.SlotMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import static org.assertj.core.api.Assertions.assertThat;

class QuestionProcessorTest {

    private QuestionProcessor processor;

    @BeforeEach
    void setUp() {
        NluContext context = new NluContext(
                new IntentConfigLoader().load(new ClassPathResource("nlu/intent-patterns.json")),
                new GazetteerConfigLoader().load(new ClassPathResource("nlu/gazetteer.json")));
        TextNormalizer normalizer = new TextNormalizer();
        processor = new QuestionProcessor(
                normalizer,
                new IntentResolver(context, new NoOpIntentClassifier(), 0.9),
                new SlotExtractor(context, normalizer),
                new RetrievalQueryBuilder());
    }

    @Test
    void locationQuestion() {
        ProcessorOutput output = processor.process("Where is the Haslegrave building?");

        assertThat(output.getRawText()).isEqualTo("Where is the Haslegrave building?");
        assertThat(output.getCleanText()).isEqualTo("where is the haslegrave building?");
        assertThat(output.getIntent()).isEqualTo("ask_location");
        assertThat(output.getDomain()).isEqualTo("location");
        assertThat(output.getSlots().get("campus_location")).containsExactly("haslegrave building");
        assertThat(output.getSlots().get(SlotMap.PLACE)).containsExactly("the haslegrave building");
        assertThat(output.getRetrievalQuery()).isEqualTo(
                "where is the haslegrave building? ; haslegrave building | the haslegrave building ; location on campus");
        assertThat(output.getConfidence())
                .containsEntry(ProcessorOutput.INTENT_CONFIDENCE, 0.9)
                .containsEntry(ProcessorOutput.DOMAIN_CONFIDENCE, 0.8);
    }

    @Test
    void earlierRuleWinsOverLaterOne() {
        // matches both the time and the library rules; time is listed first
        ProcessorOutput output = processor.process("What time does the library close?");

        assertThat(output.getIntent()).isEqualTo("ask_time");
        assertThat(output.getDomain()).isEqualTo("event_info");
        assertThat(output.getRetrievalQuery()).endsWith(" ; date and time");
    }

    @Test
    void accommodationQuestion() {
        ProcessorOutput output = processor.process("Are there cheap halls for first years?");

        assertThat(output.getIntent()).isEqualTo("ask_accommodation");
        assertThat(output.getDomain()).isEqualTo("accommodation");
        assertThat(output.getRetrievalQuery())
                .isEqualTo("are there cheap halls for first years? ; halls of residence and prices");
    }

    @Test
    void hallNameAloneLeavesIntentUnresolved() {
        ProcessorOutput output = processor.process("Tell me about Butler Court");

        assertThat(output.getIntent()).isNull();
        assertThat(output.getDomain()).isNull();
        assertThat(output.getSlots().get("hall")).containsExactly("butler court");
        assertThat(output.getRetrievalQuery()).isEqualTo("tell me about butler court ; butler court");
        assertThat(output.intentConfidence()).isZero();
        assertThat(output.domainConfidence()).isZero();
    }

    @Test
    void domainWithoutHint() {
        ProcessorOutput output = processor.process("How do I reset my password");

        assertThat(output.getIntent()).isEqualTo("ask_it_help");
        assertThat(output.getDomain()).isEqualTo("it_support");
        assertThat(output.getRetrievalQuery()).isEqualTo("how do i reset my password");
    }

    @Test
    void emptyQuestion() {
        ProcessorOutput output = processor.process("   ");

        assertThat(output.getCleanText()).isEmpty();
        assertThat(output.getIntent()).isNull();
        assertThat(output.getDomain()).isNull();
        assertThat(output.getSlots().isEmpty()).isTrue();
        assertThat(output.getRetrievalQuery()).isEmpty();
        assertThat(output.intentConfidence()).isZero();
        assertThat(output.domainConfidence()).isZero();
    }
}
