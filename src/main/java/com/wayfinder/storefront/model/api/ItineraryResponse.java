package com.wayfinder.storefront.model.api;

import com.fasterxml.jackson.databind.JsonNode;

public record ItineraryResponse(
        JsonNode days
) {
}
