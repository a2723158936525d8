package com.wayfinder.storefront.controller;

import com.wayfinder.storefront.model.api.ChatRequest;
import com.wayfinder.storefront.service.ChatSession;
import com.wayfinder.storefront.service.ChatStreamOrchestrator;
import com.wayfinder.storefront.stream.service.ChatEventEncoder;
import com.wayfinder.storefront.stream.service.SseFlushWriter;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api")
public class ChatController {

    private final ChatStreamOrchestrator chatStreamOrchestrator;
    private final ChatEventEncoder chatEventEncoder;
    private final SseFlushWriter sseFlushWriter;

    public ChatController(
            ChatStreamOrchestrator chatStreamOrchestrator,
            ChatEventEncoder chatEventEncoder,
            SseFlushWriter sseFlushWriter
    ) {
        this.chatStreamOrchestrator = chatStreamOrchestrator;
        this.chatEventEncoder = chatEventEncoder;
        this.sseFlushWriter = sseFlushWriter;
    }

    /**
     * Streams the chat as SSE. The JSON body wins when it carries a message or an image; otherwise the
     * legacy {@code message}/{@code user_id}/{@code agent_id} query parameters are used.
     */
    @PostMapping("/chat")
    public Mono<Void> chat(
            @RequestBody(required = false) ChatRequest body,
            @RequestParam(value = "message", required = false) String message,
            @RequestParam(value = "user_id", required = false) String userId,
            @RequestParam(value = "agent_id", required = false) String agentId,
            ServerHttpResponse response
    ) {
        ChatRequest request = hasInput(body) ? body : new ChatRequest(message, userId, agentId, null, null);
        ChatSession session = chatStreamOrchestrator.prepare(request);
        return sseFlushWriter.write(response, chatStreamOrchestrator.stream(session).map(chatEventEncoder::encode));
    }

    private boolean hasInput(ChatRequest body) {
        return body != null && (StringUtils.hasText(body.message()) || StringUtils.hasText(body.imageBase64()));
    }
}
