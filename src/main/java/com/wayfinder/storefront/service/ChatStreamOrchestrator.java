package com.wayfinder.storefront.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wayfinder.storefront.config.AgentBuilderProperties;
import com.wayfinder.storefront.model.api.ChatRequest;
import com.wayfinder.storefront.stream.model.ChatEvent;
import com.wayfinder.storefront.stream.model.ChatEventType;
import com.wayfinder.storefront.stream.model.UpstreamEvent;
import com.wayfinder.storefront.stream.model.UpstreamFrame;
import com.wayfinder.storefront.stream.service.EventClassifier;
import com.wayfinder.storefront.stream.service.FrameDecoder;
import com.wayfinder.storefront.stream.service.StepLedger;
import com.wayfinder.storefront.vision.VisionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Chat request pipeline: optional image analysis, then the agent builder stream relayed as client events.
 * <p>
 * Each request gets its own {@link ChatRun} (decoder, ledger, state), so nothing is shared between
 * concurrent requests. Every upstream frame produces at most one client event, emitted as soon as it is
 * decoded. A graceful end adds one {@code completion} event with the whole transcript; an upstream error
 * frame or a transport failure adds exactly one {@code error} event instead.
 */
@Service
public class ChatStreamOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ChatStreamOrchestrator.class);

    static final String DEFAULT_USER_ID = "user_new";

    private final AgentBuilderClient agentBuilderClient;
    private final PreprocessStage preprocessStage;
    private final AgentBuilderProperties properties;
    private final ObjectMapper objectMapper;
    private final EventClassifier eventClassifier = new EventClassifier();

    public ChatStreamOrchestrator(
            AgentBuilderClient agentBuilderClient,
            PreprocessStage preprocessStage,
            AgentBuilderProperties properties,
            ObjectMapper objectMapper
    ) {
        this.agentBuilderClient = agentBuilderClient;
        this.preprocessStage = preprocessStage;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Validates the request before any stream is opened.
     *
     * @throws IllegalArgumentException when neither a message nor an image is present
     */
    public ChatSession prepare(ChatRequest request) {
        if (request == null || (!StringUtils.hasText(request.message()) && !StringUtils.hasText(request.imageBase64()))) {
            throw new IllegalArgumentException("Message is required");
        }
        String userId = StringUtils.hasText(request.userId()) ? request.userId().trim() : DEFAULT_USER_ID;
        String agentId = agentBuilderClient.resolveAgentId(request.agentId());
        return new ChatSession(
                request.message() == null ? "" : request.message().trim(),
                userId,
                agentId,
                request.imageBase64(),
                VisionResult.fromJson(request.visionAnalysis())
        );
    }

    public Flux<ChatEvent> stream(ChatSession session) {
        return Flux.defer(() -> {
            ChatRun run = new ChatRun(session);
            long startNanos = System.nanoTime();
            log.info("Chat stream start agentId={}, userId={}, hasImage={}, cachedVision={}",
                    session.agentId(), session.userId(), session.hasImage(), session.cachedVision() != null);

            run.transition(ChatRunState.PREPROCESS);
            Flux<ChatEvent> preprocess = preprocessStage.run(session, run::attachVision);
            Flux<ChatEvent> streaming = Flux.defer(() -> streamUpstream(run));

            return preprocess.concatWith(streaming)
                    .doOnComplete(() -> log.info(
                            "Chat stream finished in {} ms state={}, conversationId={}, steps={}",
                            elapsedMs(startNanos), run.state(), run.conversationId(), run.ledger().size()
                    ))
                    .doOnCancel(() -> log.info(
                            "Chat stream cancelled by client after {} ms, conversationId={}",
                            elapsedMs(startNanos), run.conversationId()
                    ));
        });
    }

    private Flux<ChatEvent> streamUpstream(ChatRun run) {
        run.transition(ChatRunState.STREAMING);
        FrameDecoder decoder = new FrameDecoder(objectMapper);
        Flux<UpstreamFrame> frames = withDeadline(
                agentBuilderClient.converse(run.composeQuery(), run.session().agentId()),
                Duration.ofMillis(properties.getStreamTimeoutMs())
        )
                .concatMapIterable(decoder::feed)
                .concatWith(Flux.defer(() -> Flux.fromIterable(decoder.finish())));

        return frames
                .concatMapIterable(run::accept)
                .takeUntil(event -> event.type() == ChatEventType.ERROR)
                .concatWith(Flux.defer(() -> {
                    if (run.state() == ChatRunState.ERROR) {
                        run.transition(ChatRunState.COMPLETE);
                        return Flux.empty();
                    }
                    run.transition(ChatRunState.COMPLETE);
                    return Flux.just(ChatEvent.completion(run.conversationId(), run.ledger().snapshot()));
                }))
                .onErrorResume(ex -> {
                    run.transition(ChatRunState.ERROR);
                    ChatEvent error = toTransportError(ex);
                    run.transition(ChatRunState.COMPLETE);
                    return Flux.just(error);
                });
    }

    /**
     * Bounds the whole upstream call by a wall-clock deadline rather than by idle time between chunks.
     */
    private <T> Flux<T> withDeadline(Flux<T> source, Duration timeout) {
        return Flux.defer(() -> {
            long deadlineNanos = System.nanoTime() + timeout.toNanos();
            return source.timeout(
                    Mono.delay(timeout),
                    ignored -> Mono.delay(Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime())))
            );
        });
    }

    private ChatEvent toTransportError(Throwable ex) {
        if (ex instanceof TimeoutException) {
            log.warn("Agent stream timed out after {} ms", properties.getStreamTimeoutMs());
            return ChatEvent.error("Request timeout");
        }
        if (ex instanceof AgentUpstreamException upstream) {
            return ChatEvent.upstreamError(upstream.getMessage(), upstream.getStatus());
        }
        if (ex instanceof WebClientRequestException) {
            log.warn("Agent stream connection error: {}", ex.getMessage());
            return ChatEvent.error("Connection error: " + ex.getMessage());
        }
        log.error("Agent stream failed unexpectedly", ex);
        return ChatEvent.error("Unexpected error: " + ex.getMessage());
    }

    private long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    enum ChatRunState {
        START,
        PREPROCESS,
        STREAMING,
        ERROR,
        COMPLETE
    }

    /**
     * Mutable state of a single request; confined to that request's pipeline.
     */
    private final class ChatRun {

        private final ChatSession session;
        private final StepLedger ledger = new StepLedger();
        private ChatRunState state = ChatRunState.START;
        private VisionResult vision;
        private String conversationId = "";

        private ChatRun(ChatSession session) {
            this.session = session;
        }

        ChatSession session() {
            return session;
        }

        StepLedger ledger() {
            return ledger;
        }

        ChatRunState state() {
            return state;
        }

        String conversationId() {
            return conversationId;
        }

        void transition(ChatRunState next) {
            log.debug("Chat run state {} -> {}", state, next);
            state = next;
        }

        void attachVision(VisionResult result) {
            this.vision = result;
        }

        String composeQuery() {
            String visionContext = vision == null ? "" : vision.toContextPrefix();
            return visionContext + "[User ID: " + session.userId() + "] " + session.message();
        }

        List<ChatEvent> accept(UpstreamFrame frame) {
            Optional<UpstreamEvent> classified = eventClassifier.classify(frame.payload());
            if (classified.isEmpty()) {
                return List.of();
            }
            UpstreamEvent event = classified.get();
            log.debug("Upstream frame event={}, kind={}", frame.eventType(), event.kind());

            if (event instanceof UpstreamEvent.UpstreamError error) {
                log.warn("Agent builder reported error: {} (code={})", error.message(), error.code());
                transition(ChatRunState.ERROR);
                return List.of(ChatEvent.upstreamError(error.message(), error.code()));
            }
            if (event instanceof UpstreamEvent.ConversationStarted started) {
                conversationId = started.conversationId();
                return List.of(ChatEvent.conversationStarted(conversationId));
            }
            if (event instanceof UpstreamEvent.Reasoning reasoning) {
                if (reasoning.transientFlag()) {
                    return List.of();
                }
                ledger.recordReasoning(reasoning.text());
                return List.of(ChatEvent.reasoning(reasoning.text()));
            }
            if (event instanceof UpstreamEvent.ToolResult result) {
                if (!ledger.upsertToolResult(result.toolCallId(), result.results())) {
                    log.debug("Tool result for unknown call id {}, forwarding without ledger update", result.toolCallId());
                }
                return List.of(ChatEvent.toolResult(result.toolCallId(), result.results()));
            }
            if (event instanceof UpstreamEvent.ToolCall call) {
                if (ledger.upsertToolCall(call.toolCallId(), call.toolId(), call.params())) {
                    return List.of(ChatEvent.toolCall(call.toolCallId(), call.toolId(), call.params()));
                }
                return List.of();
            }
            if (event instanceof UpstreamEvent.TextChunk chunk) {
                return List.of(ChatEvent.messageChunk(chunk.text()));
            }
            if (event instanceof UpstreamEvent.MessageComplete complete) {
                return List.of(ChatEvent.messageComplete(complete.content()));
            }
            return List.of();
        }
    }
}
