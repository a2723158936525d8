package com.wayfinder.storefront.model.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Trip details pulled from a free-text message; each field is {@code null} when not mentioned.
 */
public record TripContextResponse(
        JsonNode destination,
        JsonNode dates,
        JsonNode activity
) {
}
