package com.wayfinder.storefront.model.api;

public record VisionWarmResponse(
        String status
) {
}
