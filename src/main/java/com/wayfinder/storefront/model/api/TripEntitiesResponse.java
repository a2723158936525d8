package com.wayfinder.storefront.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public record TripEntitiesResponse(
        JsonNode products,
        JsonNode itinerary,
        @JsonProperty("safety_notes") JsonNode safetyNotes,
        JsonNode weather
) {
}
