package com.wayfinder.storefront.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonResponseExtractorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonResponseExtractor extractor = new JsonResponseExtractor(objectMapper);

    @Test
    void shouldParsePlainJsonObject() {
        ObjectNode parsed = extractor.extract("{\"destination\":\"Yosemite\",\"dates\":null,\"activity\":\"hiking\"}");

        assertThat(parsed.get("destination").asText()).isEqualTo("Yosemite");
        assertThat(parsed.get("dates").isNull()).isTrue();
    }

    @Test
    void shouldParseFencedBlockIgnoringSurroundingProse() {
        String answer = """
                Here is the context I found:
                ```json
                {"destination": "Moab", "activity": "biking"}
                ```
                Let me know if you need more.
                """;

        ObjectNode parsed = extractor.extract(answer, List.of("destination"), null);

        assertThat(parsed.get("destination").asText()).isEqualTo("Moab");
        assertThat(parsed.get("activity").asText()).isEqualTo("biking");
    }

    @Test
    void shouldFallBackToFlatObjectMentioningRequiredField() {
        String answer = "Sure! The trip: {\"destination\": \"Banff\", \"dates\": \"June\"} enjoy.";

        ObjectNode parsed = extractor.extract(answer, List.of("destination", "dates"), null);

        assertThat(parsed.get("destination").asText()).isEqualTo("Banff");
    }

    @Test
    void shouldReturnCopyOfFallbackWhenNothingParses() {
        ObjectNode fallback = objectMapper.createObjectNode();
        fallback.putArray("days");

        ObjectNode parsed = extractor.extract("I could not build an itinerary.", List.of("days"), fallback);
        parsed.put("mutated", true);

        assertThat(parsed.get("days").isArray()).isTrue();
        assertThat(fallback.has("mutated")).isFalse();
    }

    @Test
    void emptyTextShouldYieldEmptyObjectWithoutFallback() {
        assertThat(extractor.extract("   ", List.of("days"), null).isEmpty()).isTrue();
        assertThat(extractor.extract(null).isEmpty()).isTrue();
    }

    @Test
    void stripCodeFenceShouldKeepUnfencedTextAsIs() {
        assertThat(extractor.stripCodeFence("  {\"a\":1}  ")).isEqualTo("{\"a\":1}");
        assertThat(extractor.stripCodeFence("```\n{\"a\":1}\n```")).isEqualTo("{\"a\":1}");
    }
}
