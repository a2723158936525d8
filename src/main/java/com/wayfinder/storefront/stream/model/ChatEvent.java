package com.wayfinder.storefront.stream.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Client-facing stream event, rendered on the wire as {@code {"type": ..., "data": {...}}}.
 */
public record ChatEvent(ChatEventType type, Map<String, Object> data) {

    public ChatEvent {
        Objects.requireNonNull(type, "type must not be null");
        data = data == null ? Map.of() : data;
    }

    public Map<String, Object> toEnvelope() {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("type", type.value());
        envelope.put("data", data);
        return envelope;
    }

    public static ChatEvent visionAnalyzing() {
        return new ChatEvent(ChatEventType.VISION_ANALYZING, Map.of("message", "Analyzing image..."));
    }

    public static ChatEvent visionAnalysis(Map<String, Object> analysis) {
        return new ChatEvent(ChatEventType.VISION_ANALYSIS, analysis);
    }

    public static ChatEvent visionError(String message, String reason) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", message);
        data.put("reason", reason);
        return new ChatEvent(ChatEventType.VISION_ERROR, data);
    }

    public static ChatEvent conversationStarted(String conversationId) {
        return new ChatEvent(ChatEventType.CONVERSATION_STARTED, Map.of("conversation_id", conversationId));
    }

    public static ChatEvent reasoning(String text) {
        return new ChatEvent(ChatEventType.REASONING, Map.of("reasoning", text));
    }

    public static ChatEvent toolCall(String toolCallId, String toolId, JsonNode params) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("tool_call_id", toolCallId);
        data.put("tool_id", toolId);
        data.put("params", params);
        return new ChatEvent(ChatEventType.TOOL_CALL, data);
    }

    public static ChatEvent toolResult(String toolCallId, JsonNode results) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("tool_call_id", toolCallId);
        data.put("results", results);
        return new ChatEvent(ChatEventType.TOOL_RESULT, data);
    }

    public static ChatEvent messageChunk(String textChunk) {
        return new ChatEvent(ChatEventType.MESSAGE_CHUNK, Map.of("text_chunk", textChunk));
    }

    public static ChatEvent messageComplete(String content) {
        return new ChatEvent(ChatEventType.MESSAGE_COMPLETE, Map.of("message_content", content));
    }

    public static ChatEvent completion(String conversationId, List<Step> steps) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("conversation_id", conversationId == null ? "" : conversationId);
        data.put("steps", steps.stream().map(Step::toData).toList());
        return new ChatEvent(ChatEventType.COMPLETION, data);
    }

    public static ChatEvent error(String message) {
        return new ChatEvent(ChatEventType.ERROR, Map.of("error", message));
    }

    /**
     * Error relayed from the agent builder; {@code code} is kept even when null so clients see the key.
     */
    public static ChatEvent upstreamError(String message, Object code) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", message);
        data.put("code", code);
        return new ChatEvent(ChatEventType.ERROR, data);
    }
}
