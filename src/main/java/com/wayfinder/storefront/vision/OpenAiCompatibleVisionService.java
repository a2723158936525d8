package com.wayfinder.storefront.vision;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wayfinder.storefront.config.VisionProperties;
import com.wayfinder.storefront.service.JsonResponseExtractor;
import com.wayfinder.storefront.service.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Vision model behind an OpenAI-compatible {@code /chat/completions} endpoint (Jina VLM by default).
 * <p>
 * The image travels inline as a data URI next to the analysis prompt. Connect errors and timeouts are
 * retried once; HTTP errors are not. A 503, or an error body mentioning warming or loading, means the
 * model is cold.
 */
@Service
public class OpenAiCompatibleVisionService implements VisionService {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleVisionService.class);

    private static final String DEFAULT_MIME_TYPE = "image/jpeg";
    private static final double MEGABYTE = 1024.0 * 1024.0;
    private static final int LOG_BODY_LIMIT = 500;

    private final VisionProperties properties;
    private final JsonResponseExtractor jsonResponseExtractor;
    private final WebClient webClient;

    public OpenAiCompatibleVisionService(
            VisionProperties properties,
            WebClient.Builder webClientBuilder,
            JsonResponseExtractor jsonResponseExtractor
    ) {
        this.properties = properties;
        this.jsonResponseExtractor = jsonResponseExtractor;
        this.webClient = webClientBuilder.clone()
                .baseUrl(trimTrailingSlash(properties.getBaseUrl()))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public boolean isConfigured() {
        return properties.isConfigured();
    }

    @Override
    public Mono<VisionResult> analyze(String imageBase64) {
        return analyze(imageBase64, null);
    }

    @Override
    public Mono<VisionResult> analyze(String imageBase64, String prompt) {
        return Mono.defer(() -> {
            if (!isConfigured()) {
                return Mono.error(new VisionNotConfiguredException());
            }
            InlineImage image = toInlineImage(imageBase64);
            String analysisPrompt = StringUtils.hasText(prompt) ? prompt : properties.getPrompt();
            Map<String, Object> request = buildImageRequest(analysisPrompt, image);
            long startNanos = System.nanoTime();

            log.info("Vision analysis request start model={}, imageChars={}", properties.getModel(), image.base64().length());
            return complete(request, Duration.ofMillis(properties.getRequestTimeoutMs()))
                    .retryWhen(Retry.max(1)
                            .filter(this::isConnectionError)
                            .doBeforeRetry(signal -> log.warn(
                                    "Vision analysis attempt failed ({}), retrying",
                                    signal.failure().getClass().getSimpleName()
                            ))
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .map(this::toResult)
                    .doOnNext(result -> log.info(
                            "Vision analysis complete in {} ms ({} chars, structured={})",
                            elapsedMs(startNanos),
                            result.description().length(),
                            result.isStructured()
                    ));
        });
    }

    @Override
    public Mono<WarmStatus> warm() {
        if (!isConfigured()) {
            return Mono.just(WarmStatus.UNAVAILABLE);
        }
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("model", properties.getModel());
        request.put("messages", List.of(Map.of("role", "user", "content", "ping")));
        request.put("max_tokens", 1);
        return complete(request, Duration.ofMillis(properties.getWarmTimeoutMs()))
                .map(ignored -> WarmStatus.WARM)
                .onErrorResume(VisionWarmingUpException.class, ex -> Mono.just(WarmStatus.WARMING))
                .onErrorResume(TimeoutException.class, ex -> Mono.just(WarmStatus.WARMING))
                .onErrorResume(ex -> {
                    log.warn("Vision warm-up ping failed: {}", ex.getMessage());
                    return Mono.just(WarmStatus.UNAVAILABLE);
                });
    }

    private Mono<JsonNode> complete(Map<String, Object> request, Duration timeout) {
        return webClient.post()
                .uri("/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .exchangeToMono(response -> {
                    if (response.statusCode().is2xxSuccessful()) {
                        return response.bodyToMono(JsonNode.class);
                    }
                    int status = response.statusCode().value();
                    return response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(body -> Mono.error(toStatusError(status, body)));
                })
                .timeout(timeout);
    }

    private VisionException toStatusError(int status, String body) {
        log.error("Vision API error: {} - {}", status, LogSanitizer.abbreviate(body, LOG_BODY_LIMIT));
        String normalized = body == null ? "" : body.toLowerCase(Locale.ROOT);
        if (status == 503 || normalized.contains("warming") || normalized.contains("loading")) {
            return new VisionWarmingUpException("Vision model is warming up (HTTP " + status + ")");
        }
        return new VisionException("Vision API error: " + status);
    }

    private VisionResult toResult(JsonNode response) {
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || !StringUtils.hasText(content.asText())) {
            throw new VisionException("Vision API returned no content");
        }
        String text = content.asText().trim();
        ObjectNode parsed = jsonResponseExtractor.extract(text, List.of("description", "product_type"), null);
        VisionResult structured = VisionResult.fromJson(parsed);
        if (structured != null && StringUtils.hasText(structured.description())) {
            return structured;
        }
        return VisionResult.ofDescription(text);
    }

    private Map<String, Object> buildImageRequest(String prompt, InlineImage image) {
        Map<String, Object> imageUrl = Map.of("url", "data:" + image.mimeType() + ";base64," + image.base64());
        List<Map<String, Object>> content = List.of(
                Map.of("type", "text", "text", prompt),
                Map.of("type", "image_url", "image_url", imageUrl)
        );
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("model", properties.getModel());
        request.put("messages", List.of(Map.of("role", "user", "content", content)));
        request.put("max_tokens", properties.getMaxTokens());
        return request;
    }

    InlineImage toInlineImage(String imageBase64) {
        if (!StringUtils.hasText(imageBase64)) {
            throw new InvalidImageException("Image data is empty");
        }
        String value = imageBase64.trim();
        String mimeType = DEFAULT_MIME_TYPE;
        if (value.startsWith("data:")) {
            int comma = value.indexOf(',');
            if (comma < 0) {
                throw new InvalidImageException("Malformed image data URI");
            }
            String header = value.substring("data:".length(), comma);
            int separator = header.indexOf(';');
            String declared = separator >= 0 ? header.substring(0, separator) : header;
            if (declared.startsWith("image/")) {
                mimeType = declared;
            }
            value = value.substring(comma + 1).trim();
        }
        if (value.isEmpty()) {
            throw new InvalidImageException("Image data is empty");
        }
        long approximateBytes = value.length() * 3L / 4L;
        if (approximateBytes > properties.getMaxImageBytes()) {
            throw new InvalidImageException(String.format(
                    Locale.ROOT,
                    "Image too large (%.1fMB). Maximum is %.0fMB.",
                    approximateBytes / MEGABYTE,
                    properties.getMaxImageBytes() / MEGABYTE
            ));
        }
        return new InlineImage(mimeType, value);
    }

    private boolean isConnectionError(Throwable throwable) {
        return throwable instanceof WebClientRequestException || throwable instanceof TimeoutException;
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    private long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    record InlineImage(String mimeType, String base64) {
    }
}
