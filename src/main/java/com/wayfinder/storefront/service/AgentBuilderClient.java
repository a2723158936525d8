package com.wayfinder.storefront.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.wayfinder.storefront.config.AgentBuilderProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP access to the agent builder: the streamed converse call, workflow runs and the agent lookup.
 * <p>
 * {@link #converse} hands back raw body chunks exactly as they arrive; framing is left to the caller.
 * No timeout or retry is applied here, callers decide both.
 */
@Service
public class AgentBuilderClient {

    private static final Logger log = LoggerFactory.getLogger(AgentBuilderClient.class);

    static final String CONVERSE_PATH = "/api/agent_builder/converse/async";
    static final String AGENT_PATH = "/api/agent_builder/agents/{agentId}";
    static final String WORKFLOW_PATH = "/api/workflows/run";

    private final AgentBuilderProperties properties;
    private final WebClient webClient;

    public AgentBuilderClient(AgentBuilderProperties properties, WebClient.Builder webClientBuilder) {
        this.properties = properties;
        WebClient.Builder builder = webClientBuilder.clone()
                .baseUrl(trimTrailingSlash(properties.getBaseUrl()))
                .defaultHeader("kbn-xsrf", "true");
        if (StringUtils.hasText(properties.getApiKey())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "ApiKey " + properties.getApiKey().trim());
        }
        this.webClient = builder.build();
    }

    public Flux<byte[]> converse(String input, String agentId) {
        String resolvedAgentId = resolveAgentId(agentId);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("input", input);
        payload.put("agent_id", resolvedAgentId);

        return Flux.defer(() -> {
            log.info("Agent converse request start agentId={}, inputChars={}", resolvedAgentId, input == null ? 0 : input.length());
            log.debug("Agent converse input: {}", LogSanitizer.maskText(input));
            return webClient.post()
                    .uri(CONVERSE_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(payload)
                    .exchangeToFlux(response -> {
                        if (response.statusCode().is2xxSuccessful()) {
                            return response.bodyToFlux(byte[].class);
                        }
                        int status = response.statusCode().value();
                        return response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMapMany(body -> {
                                    log.warn("Agent converse rejected status={}, agentId={}, body={}",
                                            status, resolvedAgentId, LogSanitizer.abbreviate(body, 500));
                                    return Flux.error(new AgentUpstreamException(status, body));
                                });
                    });
        });
    }

    /**
     * Runs a named workflow and returns its JSON result. Anything but 200 fails with {@link AgentUpstreamException}.
     */
    public Mono<JsonNode> runWorkflow(String workflowName, Map<String, Object> inputs) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("workflow_name", workflowName);
        payload.put("inputs", inputs);

        return Mono.defer(() -> {
            log.info("Workflow run start workflow={}", workflowName);
            return webClient.post()
                    .uri(WORKFLOW_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .header("x-elastic-internal-origin", "kibana")
                    .bodyValue(payload)
                    .exchangeToMono(response -> {
                        if (response.statusCode().value() == HttpStatus.OK.value()) {
                            return response.bodyToMono(JsonNode.class)
                                    .defaultIfEmpty(JsonNodeFactory.instance.objectNode());
                        }
                        int status = response.statusCode().value();
                        return response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> {
                                    log.warn("Workflow run rejected status={}, workflow={}, body={}",
                                            status, workflowName, LogSanitizer.abbreviate(body, 500));
                                    return Mono.error(new AgentUpstreamException(status, body));
                                });
                    });
        });
    }

    /**
     * @return whether the agent exists; errors only on transport failure or timeout
     */
    public Mono<Boolean> agentExists(String agentId) {
        return webClient.get()
                .uri(AGENT_PATH, agentId)
                .exchangeToMono(response -> response.releaseBody()
                        .thenReturn(response.statusCode().value() == 200))
                .timeout(Duration.ofMillis(properties.getStatusTimeoutMs()));
    }

    public String resolveAgentId(String agentId) {
        return StringUtils.hasText(agentId) ? agentId.trim() : properties.getDefaultAgentId();
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
