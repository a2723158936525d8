package com.wayfinder.storefront.stream.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;

public sealed interface UpstreamEvent permits
        UpstreamEvent.ConversationStarted,
        UpstreamEvent.Reasoning,
        UpstreamEvent.ToolCall,
        UpstreamEvent.ToolResult,
        UpstreamEvent.TextChunk,
        UpstreamEvent.MessageComplete,
        UpstreamEvent.UpstreamError {

    UpstreamEventKind kind();

    record ConversationStarted(String conversationId) implements UpstreamEvent {
        public ConversationStarted {
            Objects.requireNonNull(conversationId, "conversationId must not be null");
        }

        @Override
        public UpstreamEventKind kind() {
            return UpstreamEventKind.CONVERSATION_ID;
        }
    }

    /**
     * @param transientFlag set when the agent marks the note as filler ("Consulting my tools")
     */
    record Reasoning(String text, boolean transientFlag) implements UpstreamEvent {
        public Reasoning {
            text = text == null ? "" : text;
        }

        @Override
        public UpstreamEventKind kind() {
            return UpstreamEventKind.REASONING;
        }
    }

    record ToolCall(String toolCallId, String toolId, JsonNode params) implements UpstreamEvent {
        public ToolCall {
            Objects.requireNonNull(toolCallId, "toolCallId must not be null");
            Objects.requireNonNull(toolId, "toolId must not be null");
            if (params == null || params.isNull() || params.isMissingNode()) {
                params = JsonNodeFactory.instance.objectNode();
            }
        }

        @Override
        public UpstreamEventKind kind() {
            return UpstreamEventKind.TOOL_CALL;
        }
    }

    record ToolResult(String toolCallId, JsonNode results) implements UpstreamEvent {
        public ToolResult {
            Objects.requireNonNull(toolCallId, "toolCallId must not be null");
            if (results == null || results.isMissingNode()) {
                results = JsonNodeFactory.instance.arrayNode();
            }
        }

        @Override
        public UpstreamEventKind kind() {
            return UpstreamEventKind.TOOL_RESULT;
        }
    }

    record TextChunk(String text) implements UpstreamEvent {
        public TextChunk {
            text = text == null ? "" : text;
        }

        @Override
        public UpstreamEventKind kind() {
            return UpstreamEventKind.TEXT_CHUNK;
        }
    }

    record MessageComplete(String content) implements UpstreamEvent {
        public MessageComplete {
            content = content == null ? "" : content;
        }

        @Override
        public UpstreamEventKind kind() {
            return UpstreamEventKind.MESSAGE_COMPLETE;
        }
    }

    /**
     * @param code upstream error code as sent (number or string), null when absent
     */
    record UpstreamError(String message, JsonNode code) implements UpstreamEvent {
        public UpstreamError {
            message = message == null || message.isBlank() ? "Unknown error" : message;
        }

        @Override
        public UpstreamEventKind kind() {
            return UpstreamEventKind.UPSTREAM_ERROR;
        }
    }
}
