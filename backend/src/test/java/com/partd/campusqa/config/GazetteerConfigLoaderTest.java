package com.partd.campusqa.config;

import com.partd.campusqa.model.Gazetteer;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GazetteerConfigLoaderTest {

    private final GazetteerConfigLoader loader = new GazetteerConfigLoader();

    @Test
    void loadsBundledGazetteer() {
        Gazetteer gazetteer = loader.load(new ClassPathResource("nlu/gazetteer.json"));

        assertThat(gazetteer.slotTypes()).contains("campus_location", "hall", "service");
        assertThat(gazetteer.entries().get("hall")).containsKey("butler court");
        assertThat(gazetteer.entries().get("hall").get("butler court")).contains("butler");
    }

    @Test
    void skipsBlocksWithoutIdAndItemsWithoutCanonical() {
        String json = "["
                + "{\"items\":[{\"canonical\":\"orphan\"}]},"
                + "{\"_id\":\"hall\",\"items\":["
                + "  {\"aliases\":[\"nameless\"]},"
                + "  {\"canonical\":\"  \"},"
                + "  {\"canonical\":\"rutland\",\"aliases\":[\"rutland hall\"]}"
                + "]},"
                + "{\"_id\":\"empty\"}"
                + "]";

        Gazetteer gazetteer = load(json);

        assertThat(gazetteer.slotTypes()).containsExactly("hall");
        assertThat(gazetteer.size()).isEqualTo(1);
        assertThat(gazetteer.entries().get("hall").get("rutland")).containsExactly("rutland hall");
    }

    @Test
    void repeatedCanonicalValuesMergeAliases() {
        String json = "[{\"_id\":\"hall\",\"items\":["
                + "{\"canonical\":\"faraday\",\"aliases\":[\"faraday hall\"]},"
                + "{\"canonical\":\"faraday\",\"aliases\":[\"faraday hall\",\"faraday halls\"]}"
                + "]}]";

        Gazetteer gazetteer = load(json);

        assertThat(gazetteer.size()).isEqualTo(1);
        assertThat(gazetteer.entries().get("hall").get("faraday")).containsExactly("faraday hall", "faraday halls");
    }

    @Test
    void missingSourceFailsLoudly() {
        assertThatThrownBy(() -> loader.load(new ClassPathResource("nlu/missing-gazetteer.json")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void nonArraySourceFailsLoudly() {
        assertThatThrownBy(() -> load("{\"hall\":[]}"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("top-level array");
    }

    private Gazetteer load(String json) {
        return loader.load(new ByteArrayResource(json.getBytes(StandardCharsets.UTF_8), "test gazetteer"));
    }
}
