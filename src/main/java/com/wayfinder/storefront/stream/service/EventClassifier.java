package com.wayfinder.storefront.stream.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.wayfinder.storefront.stream.model.UpstreamEvent;

import java.util.Optional;

/**
 * Maps one decoded agent builder payload to a single {@link UpstreamEvent}.
 * <p>
 * Frame shapes overlap (a tool result also carries {@code tool_call_id}), so the checks run in a fixed
 * order and the first match wins:
 * <ol>
 *     <li>top-level {@code error}: upstream error; an {@code error} field inside the envelope is payload</li>
 *     <li>{@code conversation_id}</li>
 *     <li>{@code reasoning}</li>
 *     <li>{@code results} together with {@code tool_call_id}: tool result</li>
 *     <li>{@code tool_call_id}: tool call, dropped when {@code tool_id} is missing (progress ping)</li>
 *     <li>{@code text_chunk}</li>
 *     <li>{@code message_content}</li>
 *     <li>{@code round.response.message}: complete message</li>
 * </ol>
 * Payloads matching none of these are dropped.
 */
public final class EventClassifier {

    private static final String DATA_ENVELOPE = "data";

    public Optional<UpstreamEvent> classify(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            return Optional.empty();
        }
        JsonNode data = unwrap(raw);

        JsonNode error = raw.get("error");
        if (error != null) {
            return Optional.of(toUpstreamError(error));
        }
        if (data.has("conversation_id")) {
            return Optional.of(new UpstreamEvent.ConversationStarted(text(data.get("conversation_id"))));
        }
        if (data.has("reasoning")) {
            boolean transientFlag = data.path("transient").asBoolean(false);
            return Optional.of(new UpstreamEvent.Reasoning(text(data.get("reasoning")), transientFlag));
        }
        if (data.has("results") && data.has("tool_call_id")) {
            return Optional.of(new UpstreamEvent.ToolResult(text(data.get("tool_call_id")), data.get("results")));
        }
        if (data.has("tool_call_id")) {
            String toolId = text(data.get("tool_id"));
            if (toolId.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(new UpstreamEvent.ToolCall(text(data.get("tool_call_id")), toolId, data.get("params")));
        }
        if (data.has("text_chunk")) {
            return Optional.of(new UpstreamEvent.TextChunk(text(data.get("text_chunk"))));
        }
        if (data.has("message_content")) {
            return Optional.of(new UpstreamEvent.MessageComplete(text(data.get("message_content"))));
        }
        if (data.has("round")) {
            JsonNode message = data.path("round").path("response").path("message");
            if (message.isMissingNode()) {
                return Optional.empty();
            }
            return Optional.of(new UpstreamEvent.MessageComplete(text(message)));
        }
        return Optional.empty();
    }

    private JsonNode unwrap(JsonNode raw) {
        JsonNode nested = raw.get(DATA_ENVELOPE);
        return nested != null && nested.isObject() ? nested : raw;
    }

    private UpstreamEvent.UpstreamError toUpstreamError(JsonNode error) {
        if (error.isObject()) {
            JsonNode code = error.get("code");
            return new UpstreamEvent.UpstreamError(
                    text(error.get("message")),
                    code == null || code.isNull() ? null : code
            );
        }
        return new UpstreamEvent.UpstreamError(text(error), null);
    }

    private String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "";
        }
        if (node.isTextual()) {
            return node.asText();
        }
        return node.toString();
    }
}
