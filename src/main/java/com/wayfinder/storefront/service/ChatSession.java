package com.wayfinder.storefront.service;

import com.wayfinder.storefront.vision.VisionResult;
import org.springframework.util.StringUtils;

/**
 * Validated input of one chat request.
 *
 * @param cachedVision analysis the client already holds for this image, reused instead of a new call
 */
public record ChatSession(
        String message,
        String userId,
        String agentId,
        String imageBase64,
        VisionResult cachedVision
) {

    public ChatSession {
        message = message == null ? "" : message;
    }

    public boolean hasImage() {
        return StringUtils.hasText(imageBase64);
    }
}
