package com.wayfinder.storefront.stream.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Transcript entry kept for the final {@code completion} event.
 */
public sealed interface Step permits Step.ReasoningStep, Step.ToolCallStep {

    Map<String, Object> toData();

    record ReasoningStep(String text) implements Step {
        public ReasoningStep {
            text = text == null ? "" : text;
        }

        @Override
        public Map<String, Object> toData() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("type", "reasoning");
            data.put("reasoning", text);
            return data;
        }
    }

    /**
     * Params and results stay mutable until the owning ledger sees the matching result frame.
     */
    final class ToolCallStep implements Step {

        private final String toolCallId;
        private final String toolId;
        private JsonNode params;
        private JsonNode results;

        public ToolCallStep(String toolCallId, String toolId, JsonNode params) {
            this.toolCallId = Objects.requireNonNull(toolCallId, "toolCallId must not be null");
            this.toolId = toolId;
            this.params = params == null ? JsonNodeFactory.instance.objectNode() : params;
            this.results = JsonNodeFactory.instance.arrayNode();
        }

        public String toolCallId() {
            return toolCallId;
        }

        public String toolId() {
            return toolId;
        }

        public JsonNode params() {
            return params;
        }

        public JsonNode results() {
            return results;
        }

        public void replaceParams(JsonNode params) {
            this.params = params;
        }

        public void replaceResults(JsonNode results) {
            this.results = results == null ? JsonNodeFactory.instance.arrayNode() : results;
        }

        @Override
        public Map<String, Object> toData() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("type", "tool_call");
            data.put("tool_call_id", toolCallId);
            data.put("tool_id", toolId);
            data.put("params", params);
            data.put("results", results);
            return data;
        }

        @Override
        public String toString() {
            return "ToolCallStep[toolCallId=" + toolCallId + ", toolId=" + toolId + "]";
        }
    }
}
