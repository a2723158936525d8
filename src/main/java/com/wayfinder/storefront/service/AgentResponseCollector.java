package com.wayfinder.storefront.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wayfinder.storefront.config.AgentBuilderProperties;
import com.wayfinder.storefront.stream.model.UpstreamEvent;
import com.wayfinder.storefront.stream.service.EventClassifier;
import com.wayfinder.storefront.stream.service.FrameDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Drains an agent conversation into its final answer text.
 * <p>
 * Text chunks append to the answer; a complete message (or a round's response message) replaces it.
 * Other events are ignored.
 */
@Component
public class AgentResponseCollector {

    private static final Logger log = LoggerFactory.getLogger(AgentResponseCollector.class);

    private final AgentBuilderClient agentBuilderClient;
    private final AgentBuilderProperties properties;
    private final ObjectMapper objectMapper;
    private final EventClassifier eventClassifier = new EventClassifier();

    public AgentResponseCollector(
            AgentBuilderClient agentBuilderClient,
            AgentBuilderProperties properties,
            ObjectMapper objectMapper
    ) {
        this.agentBuilderClient = agentBuilderClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public Mono<String> collect(String input, String agentId) {
        return Mono.defer(() -> {
            FrameDecoder decoder = new FrameDecoder(objectMapper);
            return agentBuilderClient.converse(input, agentId)
                    .concatMapIterable(decoder::feed)
                    .concatWith(Flux.defer(() -> Flux.fromIterable(decoder.finish())))
                    .concatMap(frame -> Mono.justOrEmpty(eventClassifier.classify(frame.payload())))
                    .reduce(new StringBuilder(), this::accumulate)
                    .map(StringBuilder::toString)
                    .timeout(Duration.ofMillis(properties.getExtractionTimeoutMs()))
                    .doOnNext(answer -> log.debug("Collected answer from agentId={} ({} chars)", agentId, answer.length()));
        });
    }

    private StringBuilder accumulate(StringBuilder answer, UpstreamEvent event) {
        if (event instanceof UpstreamEvent.TextChunk chunk) {
            answer.append(chunk.text());
        } else if (event instanceof UpstreamEvent.MessageComplete complete) {
            answer.setLength(0);
            answer.append(complete.content());
        } else if (event instanceof UpstreamEvent.UpstreamError error) {
            log.warn("Agent reported error while collecting answer: {}", error.message());
        }
        return answer;
    }
}
