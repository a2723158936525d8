package com.wayfinder.storefront.model.api;

public record VisionAnalyzeResponse(
        String description,
        boolean success
) {
}
