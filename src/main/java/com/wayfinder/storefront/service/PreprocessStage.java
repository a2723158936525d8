package com.wayfinder.storefront.service;

import com.wayfinder.storefront.stream.model.ChatEvent;
import com.wayfinder.storefront.vision.InvalidImageException;
import com.wayfinder.storefront.vision.VisionResult;
import com.wayfinder.storefront.vision.VisionService;
import com.wayfinder.storefront.vision.VisionWarmingUpException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Optional image analysis ahead of the agent stream.
 * <p>
 * Never fails the chat: a vision error becomes a {@code vision_error} event and the request continues
 * without image context.
 */
@Component
public class PreprocessStage {

    private static final Logger log = LoggerFactory.getLogger(PreprocessStage.class);

    static final String WARMING_UP_MESSAGE =
            "The image model is warming up. Continuing without image analysis; try again in a minute.";
    static final String FAILED_MESSAGE = "Image analysis failed. Continuing without image context.";

    private final VisionService visionService;

    public PreprocessStage(VisionService visionService) {
        this.visionService = visionService;
    }

    /**
     * Emits the vision progress/result events for {@code session} and hands a successful analysis to
     * {@code visionSink} before completing.
     */
    public Flux<ChatEvent> run(ChatSession session, Consumer<VisionResult> visionSink) {
        if (session.cachedVision() != null) {
            log.info("Reusing client-supplied vision analysis ({} chars)", session.cachedVision().description().length());
            visionSink.accept(session.cachedVision());
            return Flux.just(analysisEvent(session.cachedVision(), true));
        }
        if (!session.hasImage()) {
            return Flux.empty();
        }
        if (!visionService.isConfigured()) {
            log.info("Image provided but vision is not configured, ignoring image");
            return Flux.empty();
        }
        Mono<ChatEvent> analysis = visionService.analyze(session.imageBase64())
                .doOnNext(visionSink)
                .map(result -> analysisEvent(result, false))
                .onErrorResume(ex -> Mono.just(toVisionError(ex)));
        return Flux.concat(Mono.just(ChatEvent.visionAnalyzing()), analysis);
    }

    private ChatEvent analysisEvent(VisionResult result, boolean cached) {
        Map<String, Object> data = result.toData();
        data.put("cached", cached);
        return ChatEvent.visionAnalysis(data);
    }

    private ChatEvent toVisionError(Throwable ex) {
        if (ex instanceof VisionWarmingUpException) {
            log.warn("Vision model warming up, proceeding without image context");
            return ChatEvent.visionError(WARMING_UP_MESSAGE, "warming_up");
        }
        if (ex instanceof InvalidImageException) {
            log.warn("Rejected image for analysis: {}", ex.getMessage());
            return ChatEvent.visionError(ex.getMessage(), "invalid_image");
        }
        log.warn("Vision analysis failed, proceeding without: {}: {}", ex.getClass().getSimpleName(), ex.getMessage());
        return ChatEvent.visionError(FAILED_MESSAGE, "failed");
    }
}
