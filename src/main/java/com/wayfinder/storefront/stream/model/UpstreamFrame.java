package com.wayfinder.storefront.stream.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * One decoded unit of the agent builder stream: the most recent {@code event:} type and the JSON object
 * carried by a {@code data:} line.
 */
public record UpstreamFrame(String eventType, ObjectNode payload) {

    public UpstreamFrame {
        eventType = eventType == null ? "" : eventType;
        Objects.requireNonNull(payload, "payload must not be null");
    }
}
