package com.wayfinder.storefront.stream.service;

import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Writes pre-encoded SSE frames and flushes after each one so proxies and the browser see progress
 * (reasoning, tool calls) as it happens.
 */
@Component
public class SseFlushWriter {

    public Mono<Void> write(ServerHttpResponse response, Flux<String> frames) {
        response.getHeaders().setContentType(MediaType.TEXT_EVENT_STREAM);
        response.getHeaders().set("X-Accel-Buffering", "no");
        response.getHeaders().set("Cache-Control", "no-cache, no-transform");
        response.getHeaders().set("Connection", "keep-alive");

        return response.writeAndFlushWith(
                frames.map(frame -> frame.getBytes(StandardCharsets.UTF_8))
                        .map(response.bufferFactory()::wrap)
                        .map(Mono::just)
        );
    }
}
