package com.wayfinder.storefront.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wayfinder.storefront.config.AgentBuilderProperties;
import com.wayfinder.storefront.model.api.ItineraryResponse;
import com.wayfinder.storefront.model.api.TripEntitiesResponse;
import com.wayfinder.storefront.model.api.TripContextResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Structured extraction through dedicated agents whose answers contain JSON.
 */
@Service
public class TripExtractionService {

    private static final Logger log = LoggerFactory.getLogger(TripExtractionService.class);

    static final String CONTEXT_AGENT_ID = "context-extractor-agent";
    static final String ITINERARY_AGENT_ID = "itinerary-extractor-agent";
    static final String PARSER_AGENT_ID = "response-parser-agent";
    static final String ENTITIES_WORKFLOW = "extract_trip_entities";

    private static final List<String> CONTEXT_FIELDS = List.of("destination", "dates", "activity");
    private static final List<String> ITINERARY_FIELDS = List.of("days");
    private static final List<String> ENTITY_FIELDS = List.of("products");

    private final AgentBuilderClient agentBuilderClient;
    private final AgentResponseCollector collector;
    private final JsonResponseExtractor jsonResponseExtractor;
    private final AgentBuilderProperties properties;
    private final ObjectMapper objectMapper;

    public TripExtractionService(
            AgentBuilderClient agentBuilderClient,
            AgentResponseCollector collector,
            JsonResponseExtractor jsonResponseExtractor,
            AgentBuilderProperties properties,
            ObjectMapper objectMapper
    ) {
        this.agentBuilderClient = agentBuilderClient;
        this.collector = collector;
        this.jsonResponseExtractor = jsonResponseExtractor;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public Mono<TripContextResponse> parseTripContext(String message) {
        requireText(message, "message");
        ObjectNode fallback = objectMapper.createObjectNode();
        CONTEXT_FIELDS.forEach(fallback::putNull);
        return collector.collect(message, CONTEXT_AGENT_ID)
                .map(answer -> jsonResponseExtractor.extract(answer, CONTEXT_FIELDS, fallback))
                .map(parsed -> new TripContextResponse(
                        field(parsed, "destination"),
                        field(parsed, "dates"),
                        field(parsed, "activity")
                ))
                .onErrorMap(ex -> toStatusException(CONTEXT_AGENT_ID, ex));
    }

    public Mono<ItineraryResponse> extractItinerary(String tripPlan) {
        requireText(tripPlan, "trip_plan");
        ObjectNode fallback = objectMapper.createObjectNode();
        fallback.putArray("days");
        return collector.collect(tripPlan, ITINERARY_AGENT_ID)
                .map(answer -> jsonResponseExtractor.extract(answer, ITINERARY_FIELDS, fallback))
                .map(parsed -> {
                    JsonNode days = parsed.get("days");
                    return new ItineraryResponse(days == null || days.isNull() ? objectMapper.createArrayNode() : days);
                })
                .onErrorMap(ex -> toStatusException(ITINERARY_AGENT_ID, ex));
    }

    /**
     * Products, itinerary, safety notes and weather for the sidebar panels.
     * <p>
     * The {@code extract_trip_entities} workflow is tried first; when it answers with anything but 200 the
     * trip plan goes straight to {@code response-parser-agent} instead. Transport failures and timeouts are not
     * retried through the agent.
     */
    public Mono<TripEntitiesResponse> extractTripEntities(String tripPlan) {
        requireText(tripPlan, "trip_plan");
        ObjectNode fallback = objectMapper.createObjectNode();
        fallback.putArray("products");
        fallback.putArray("itinerary");
        fallback.putArray("safety_notes");
        fallback.putNull("weather");

        Mono<String> viaAgent = Mono.defer(() -> collector.collect(tripPlan, PARSER_AGENT_ID));
        return agentBuilderClient.runWorkflow(ENTITIES_WORKFLOW, Map.of("trip_plan_text", tripPlan))
                .timeout(Duration.ofMillis(properties.getWorkflowTimeoutMs()))
                .map(this::workflowAnswer)
                .onErrorResume(AgentUpstreamException.class, ex -> {
                    log.info("Workflow {} unavailable status={}, falling back to agent {}",
                            ENTITIES_WORKFLOW, ex.getStatus(), PARSER_AGENT_ID);
                    return viaAgent;
                })
                .map(answer -> jsonResponseExtractor.extract(answer, ENTITY_FIELDS, fallback))
                .map(parsed -> new TripEntitiesResponse(
                        listField(parsed, "products"),
                        listField(parsed, "itinerary"),
                        listField(parsed, "safety_notes"),
                        field(parsed, "weather")
                ))
                .onErrorMap(ex -> toStatusException(PARSER_AGENT_ID, ex));
    }

    /**
     * Answer text inside a workflow result: {@code response}, else {@code output.response.message}, else the
     * output or the whole result as JSON.
     */
    String workflowAnswer(JsonNode result) {
        if (result.has("response")) {
            return text(result.get("response"));
        }
        JsonNode output = result.get("output");
        if (output != null) {
            if (output.isObject() && output.has("response")) {
                return output.get("response").path("message").asText("");
            }
            return text(output);
        }
        return result.toString();
    }

    private String text(JsonNode node) {
        return node.isTextual() ? node.asText() : node.toString();
    }

    private JsonNode listField(ObjectNode parsed, String name) {
        JsonNode value = parsed.get(name);
        return value == null || value.isNull() ? objectMapper.createArrayNode() : value;
    }

    private JsonNode field(ObjectNode parsed, String name) {
        JsonNode value = parsed.get(name);
        return value == null ? NullNode.getInstance() : value;
    }

    private void requireText(String value, String name) {
        if (!StringUtils.hasText(value)) {
            throw new IllegalArgumentException(name + " is required");
        }
    }

    private Throwable toStatusException(String agentId, Throwable ex) {
        if (ex instanceof ResponseStatusException) {
            return ex;
        }
        if (ex instanceof AgentUpstreamException upstream) {
            log.warn("Extraction agent {} rejected request status={}", agentId, upstream.getStatus());
            return new ResponseStatusException(HttpStatusCode.valueOf(upstream.getStatus()), upstream.getMessage(), ex);
        }
        if (ex instanceof TimeoutException) {
            log.warn("Extraction agent {} timed out", agentId);
            return new ResponseStatusException(HttpStatus.GATEWAY_TIMEOUT, "Request timeout", ex);
        }
        if (ex instanceof WebClientRequestException) {
            log.warn("Extraction agent {} unreachable: {}", agentId, ex.getMessage());
            return new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Connection error: " + ex.getMessage(), ex);
        }
        log.error("Extraction with agent {} failed", agentId, ex);
        return new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error: " + ex.getMessage(), ex);
    }
}
