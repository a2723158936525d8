package com.wayfinder.storefront.stream.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wayfinder.storefront.stream.model.ChatEvent;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Renders a {@link ChatEvent} as one server-sent event frame: {@code data: {"type":..,"data":..}\n\n}.
 * Stateless.
 */
@Component
public class ChatEventEncoder {

    private static final String DATA_PREFIX = "data: ";
    private static final String FRAME_TERMINATOR = "\n\n";

    private final ObjectMapper objectMapper;

    public ChatEventEncoder(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public String encode(ChatEvent event) {
        try {
            return DATA_PREFIX + objectMapper.writeValueAsString(event.toEnvelope()) + FRAME_TERMINATOR;
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to encode chat event " + event.type().value(), ex);
        }
    }
}
