package com.partd.campusqa.service;

import com.partd.campusqa.config.GazetteerConfigLoader;
import com.partd.campusqa.model.Gazetteer;
import com.partd.campusqa.model.NluContext;
import com.partd.campusqa.model.SlotMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SlotExtractorTest {

    private SlotExtractor extractor;

    @BeforeEach
    void setUp() {
        Gazetteer gazetteer = new GazetteerConfigLoader().load(new ClassPathResource("nlu/gazetteer.json"));
        extractor = new SlotExtractor(new NluContext(List.of(), gazetteer), new TextNormalizer());
    }

    @Test
    void canonicalValueIsRecordedOnceWhenSeveralAliasesHit() {
        SlotMap slots = extractor.extract("is the haslegrave building near haslegrave car park");

        assertThat(slots.get("campus_location")).containsExactly("haslegrave building");
    }

    @Test
    void aliasResolvesToCanonicalValue() {
        SlotMap slots = extractor.extract("can i get a room in butler next year");

        assertThat(slots.get("hall")).containsExactly("butler court");
    }

    @Test
    void capturesPlaceAfterDirectionsPhrase() {
        SlotMap slots = extractor.extract("how do i get to the haslegrave building?");

        assertThat(slots.get("campus_location")).containsExactly("haslegrave building");
        assertThat(slots.get(SlotMap.PLACE)).containsExactly("the haslegrave building");
    }

    @Test
    void placeHasEdgePunctuationTrimmed() {
        SlotMap slots = extractor.extract("where is the su building?!");

        assertThat(slots.get(SlotMap.PLACE)).containsExactly("the su building");
        assertThat(slots.get("campus_location")).containsExactly("students' union");
    }

    @Test
    void everyMatchingPlacePatternContributes() {
        List<String> places = extractor.extractPlacePhrases("where is rutland and how do i get to rutland");

        assertThat(places).containsExactly("rutland", "rutland and how do i get to rutland");
    }

    @Test
    void slotTypesFollowGazetteerOrderThenPlace() {
        SlotMap slots = extractor.extract("where is eduroam help near the pilkington library");

        assertThat(slots.asMap().keySet()).containsExactly("campus_location", "service", SlotMap.PLACE);
        assertThat(slots.allValues())
                .containsExactly("pilkington library", "eduroam", "eduroam help near the pilkington library");
    }

    @Test
    void nothingMatchesGivesEmptySlots() {
        assertThat(extractor.extract("hello there").isEmpty()).isTrue();
        assertThat(extractor.extract("").isEmpty()).isTrue();
    }
}
