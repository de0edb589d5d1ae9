package com.partd.campusqa.config;

import com.partd.campusqa.model.IntentRule;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntentConfigLoaderTest {

    private final IntentConfigLoader loader = new IntentConfigLoader();

    @Test
    void loadsBundledPatternsInFileOrder() {
        List<IntentRule> rules = loader.load(new ClassPathResource("nlu/intent-patterns.json"));

        List<String> labels = rules.stream().map(IntentRule::getLabel).distinct().collect(Collectors.toList());
        assertThat(labels).containsExactly(
                "ask_location", "ask_directions", "ask_time", "ask_entry_requirements", "ask_course_info",
                "ask_fees", "ask_funding", "ask_accommodation", "ask_it_help", "ask_library");
        assertThat(rules.get(0).matches("where is the library")).isTrue();
    }

    @Test
    void ignoreCaseFlagIsHonoured() {
        List<IntentRule> rules = load("[{\"_id\":\"ask_fees\",\"patterns\":[{\"regex\":\"\\\\bfees\\\\b\",\"flags\":[\"IGNORECASE\"]}]}]");

        assertThat(rules).hasSize(1);
        assertThat(rules.get(0).matches("What are the FEES?")).isTrue();
    }

    @Test
    void flagNamesAreReadIndependentlyOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            List<IntentRule> rules = load("[{\"_id\":\"ask_fees\",\"patterns\":[{\"regex\":\"fees\",\"flags\":[\"ignorecase\"]}]}]");

            assertThat(rules.get(0).matches("FEES")).isTrue();
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void patternsWithoutFlagsAreCaseSensitive() {
        List<IntentRule> rules = load("[{\"_id\":\"ask_fees\",\"patterns\":[{\"regex\":\"fees\"}]}]");

        assertThat(rules.get(0).matches("FEES")).isFalse();
        assertThat(rules.get(0).matches("fees")).isTrue();
    }

    @Test
    void malformedEntriesAreSkipped() {
        String json = "["
                + "{\"patterns\":[{\"regex\":\"orphan\"}]},"
                + "{\"_id\":\"no_patterns\"},"
                + "{\"_id\":\"ask_library\",\"patterns\":["
                + "  {\"regex\":\"\"},"
                + "  {\"flags\":[\"IGNORECASE\"]},"
                + "  {\"regex\":\"([unclosed\"},"
                + "  {\"regex\":\"\\\\blibrary\\\\b\",\"flags\":[\"IGNORECASE\",\"VERBOSE\"]}"
                + "]}"
                + "]";

        List<IntentRule> rules = load(json);

        assertThat(rules).hasSize(1);
        assertThat(rules.get(0).getLabel()).isEqualTo("ask_library");
        assertThat(rules.get(0).matches("Library hours")).isTrue();
    }

    @Test
    void acceptsIntentKeyAsAliasForId() {
        List<IntentRule> rules = load("[{\"intent\":\"ask_time\",\"patterns\":[{\"regex\":\"when\"}]}]");

        assertThat(rules).extracting(IntentRule::getLabel).containsExactly("ask_time");
    }

    @Test
    void missingSourceFailsLoudly() {
        assertThatThrownBy(() -> loader.load(new ClassPathResource("nlu/does-not-exist.json")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void nonArraySourceFailsLoudly() {
        assertThatThrownBy(() -> load("{\"_id\":\"ask_fees\"}"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("top-level array");
    }

    @Test
    void invalidJsonFailsLoudly() {
        assertThatThrownBy(() -> load("[{\"_id\": "))
                .isInstanceOf(IllegalStateException.class);
    }

    private List<IntentRule> load(String json) {
        return loader.load(new ByteArrayResource(json.getBytes(StandardCharsets.UTF_8), "test patterns"));
    }
}
