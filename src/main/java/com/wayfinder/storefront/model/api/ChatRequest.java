package com.wayfinder.storefront.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Chat body. {@code visionAnalysis} carries a previous turn's analysis so the image is not re-analyzed.
 */
public record ChatRequest(
        String message,
        @JsonProperty("user_id")
        String userId,
        @JsonProperty("agent_id")
        String agentId,
        @JsonProperty("image_base64")
        String imageBase64,
        @JsonProperty("vision_analysis")
        JsonNode visionAnalysis
) {
}
