package com.wayfinder.storefront.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.wayfinder.storefront.config.AgentBuilderProperties;
import com.wayfinder.storefront.service.AgentBuilderClient;
import com.wayfinder.storefront.service.AgentUpstreamException;
import com.wayfinder.storefront.vision.VisionResult;
import com.wayfinder.storefront.vision.VisionService;
import com.wayfinder.storefront.vision.WarmStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.FluxExchangeResult;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.MOCK,
        properties = {
                "wayfinder.auth.api-key=",
                "wayfinder.agent-builder.base-url=http://127.0.0.1:9",
                "wayfinder.vision.api-key="
        }
)
@AutoConfigureWebTestClient
@Import(ChatControllerTest.StubUpstreamConfig.class)
class ChatControllerTest {

    private static final AtomicReference<String> LAST_INPUT = new AtomicReference<>();
    private static final AtomicReference<String> LAST_AGENT = new AtomicReference<>();

    @Autowired
    private WebTestClient webTestClient;

    @TestConfiguration
    static class StubUpstreamConfig {

        @Bean
        @Primary
        AgentBuilderClient stubAgentBuilderClient(AgentBuilderProperties properties) {
            return new AgentBuilderClient(properties, WebClient.builder()) {
                @Override
                public Flux<byte[]> converse(String input, String agentId) {
                    LAST_INPUT.set(input);
                    LAST_AGENT.set(agentId);
                    if ("context-extractor-agent".equals(agentId)) {
                        return Flux.just(frame("{\"data\":{\"message_content\":"
                                + "\"{\\\"destination\\\":\\\"Zion\\\",\\\"dates\\\":\\\"May\\\",\\\"activity\\\":\\\"canyoneering\\\"}\"}}"));
                    }
                    if ("itinerary-extractor-agent".equals(agentId)) {
                        return Flux.just(frame("{\"data\":{\"message_content\":\"No plan found.\"}}"));
                    }
                    if ("response-parser-agent".equals(agentId)) {
                        return Flux.just(frame("{\"data\":{\"message_content\":"
                                + "\"{\\\"products\\\":[{\\\"name\\\":\\\"Trail Tent\\\"}],\\\"safety_notes\\\":[\\\"Pack layers\\\"]}\"}}"));
                    }
                    return Flux.just(
                            frame("{\"data\":{\"conversation_id\":\"conv-42\"}}"),
                            frame("{\"data\":{\"reasoning\":\"Checking the catalog\"}}"),
                            frame("{\"data\":{\"text_chunk\":\"Here you go\"}}"),
                            frame("{\"data\":{\"message_content\":\"Here you go\"}}")
                    );
                }

                @Override
                public Mono<JsonNode> runWorkflow(String workflowName, Map<String, Object> inputs) {
                    return Mono.error(new AgentUpstreamException(404, "workflow " + workflowName + " not found"));
                }

                @Override
                public Mono<Boolean> agentExists(String agentId) {
                    if ("broken".equals(agentId)) {
                        return Mono.error(new IllegalStateException("connection reset"));
                    }
                    return Mono.just("wayfinder-search-agent".equals(agentId));
                }
            };
        }

        @Bean
        @Primary
        VisionService stubVisionService() {
            return new VisionService() {
                @Override
                public boolean isConfigured() {
                    return false;
                }

                @Override
                public Mono<VisionResult> analyze(String imageBase64) {
                    return Mono.error(new IllegalStateException("not expected"));
                }

                @Override
                public Mono<VisionResult> analyze(String imageBase64, String prompt) {
                    return analyze(imageBase64);
                }

                @Override
                public Mono<WarmStatus> warm() {
                    return Mono.just(WarmStatus.UNAVAILABLE);
                }
            };
        }

        private static byte[] frame(String json) {
            return ("data: " + json + "\n\n").getBytes(StandardCharsets.UTF_8);
        }
    }

    @BeforeEach
    void resetCaptures() {
        LAST_INPUT.set(null);
        LAST_AGENT.set(null);
    }

    @Test
    void chatShouldStreamEventsEndingWithCompletion() {
        FluxExchangeResult<String> result = webTestClient.post()
                .uri("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("message", "Need a tent", "user_id", "u-1"))
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
                .expectHeader().valueEquals("X-Accel-Buffering", "no")
                .returnResult(String.class);

        List<String> chunks = result.getResponseBody()
                .collectList()
                .block(Duration.ofSeconds(8));

        assertThat(chunks).isNotNull();
        String joined = String.join("", chunks);
        int started = joined.indexOf("\"type\":\"conversation_started\"");
        int reasoning = joined.indexOf("\"type\":\"reasoning\"");
        int chunk = joined.indexOf("\"type\":\"message_chunk\"");
        int complete = joined.indexOf("\"type\":\"message_complete\"");
        int completion = joined.indexOf("\"type\":\"completion\"");
        assertThat(started).isGreaterThanOrEqualTo(0);
        assertThat(reasoning).isGreaterThan(started);
        assertThat(chunk).isGreaterThan(reasoning);
        assertThat(complete).isGreaterThan(chunk);
        assertThat(completion).isGreaterThan(complete);
        assertThat(joined).contains("\"conversation_id\":\"conv-42\"");
        assertThat(LAST_INPUT.get()).isEqualTo("[User ID: u-1] Need a tent");
        assertThat(LAST_AGENT.get()).isEqualTo("wayfinder-search-agent");
    }

    @Test
    void chatShouldAcceptLegacyQueryParameters() {
        FluxExchangeResult<String> result = webTestClient.post()
                .uri(uriBuilder -> uriBuilder.path("/api/chat")
                        .queryParam("message", "Boots for snow")
                        .queryParam("user_id", "legacy-user")
                        .queryParam("agent_id", "trip-planner-agent")
                        .build())
                .exchange()
                .expectStatus().isOk()
                .returnResult(String.class);

        String joined = String.join("", result.getResponseBody().collectList().block(Duration.ofSeconds(8)));

        assertThat(joined).contains("\"type\":\"completion\"");
        assertThat(LAST_INPUT.get()).isEqualTo("[User ID: legacy-user] Boots for snow");
        assertThat(LAST_AGENT.get()).isEqualTo("trip-planner-agent");
    }

    @Test
    void chatWithoutMessageShouldBeRejectedBeforeStreaming() {
        webTestClient.post()
                .uri("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("user_id", "u-1"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Message is required")
                .jsonPath("$.status_code").isEqualTo(400);

        assertThat(LAST_INPUT.get()).isNull();
    }

    @Test
    void parseTripContextShouldReturnExtractedFields() {
        webTestClient.post()
                .uri(uriBuilder -> uriBuilder.path("/api/parse-trip-context").queryParam("message", "Zion in May").build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.destination").isEqualTo("Zion")
                .jsonPath("$.dates").isEqualTo("May")
                .jsonPath("$.activity").isEqualTo("canyoneering");
    }

    @Test
    void extractItineraryShouldReturnEmptyDaysWhenAgentHasNoJson() {
        webTestClient.post()
                .uri(uriBuilder -> uriBuilder.path("/api/extract-itinerary").queryParam("trip_plan", "Hike").build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.days").isArray()
                .jsonPath("$.days.length()").isEqualTo(0);
    }

    @Test
    void extractTripEntitiesShouldReturnSidebarPanelsInSnakeCase() {
        webTestClient.post()
                .uri(uriBuilder -> uriBuilder.path("/api/extract-trip-entities").queryParam("trip_plan", "Two nights at Zion").build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.products[0].name").isEqualTo("Trail Tent")
                .jsonPath("$.safety_notes[0]").isEqualTo("Pack layers")
                .jsonPath("$.itinerary.length()").isEqualTo(0)
                .jsonPath("$.weather").isEmpty();
        assertThat(LAST_AGENT.get()).isEqualTo("response-parser-agent");
        assertThat(LAST_INPUT.get()).isEqualTo("Two nights at Zion");
    }

    @Test
    void agentStatusShouldReportExistenceAndErrors() {
        webTestClient.get()
                .uri("/api/agent-status/wayfinder-search-agent")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.exists").isEqualTo(true)
                .jsonPath("$.agent_id").isEqualTo("wayfinder-search-agent")
                .jsonPath("$.error").doesNotExist();

        webTestClient.get()
                .uri("/api/agent-status/broken")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.exists").isEqualTo(false)
                .jsonPath("$.error").isEqualTo("connection reset");
    }

    @Test
    void visionEndpointsShouldReportUnavailableModel() {
        webTestClient.post()
                .uri("/api/vision/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("image_base64", "aW1hZ2U="))
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.status_code").isEqualTo(503);

        webTestClient.post()
                .uri("/api/vision/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("prompt", "what is it"))
                .exchange()
                .expectStatus().isBadRequest();

        webTestClient.post()
                .uri("/api/vision/warm")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("unavailable");
    }

    @Test
    void healthShouldBeOpen() {
        webTestClient.get()
                .uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("healthy");
    }
}
