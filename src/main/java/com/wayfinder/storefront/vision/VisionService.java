package com.wayfinder.storefront.vision;

import reactor.core.publisher.Mono;

/**
 * Image analysis collaborator. Failures surface as {@link VisionException} subtypes so callers can tell
 * "not configured", "warming up" and "bad image" apart from other errors.
 */
public interface VisionService {

    boolean isConfigured();

    Mono<VisionResult> analyze(String imageBase64);

    Mono<VisionResult> analyze(String imageBase64, String prompt);

    /**
     * Sends a minimal request to wake a model that scales to zero.
     */
    Mono<WarmStatus> warm();
}
