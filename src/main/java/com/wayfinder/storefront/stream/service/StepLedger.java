package com.wayfinder.storefront.stream.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.wayfinder.storefront.stream.model.Step;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered transcript of one chat request: reasoning notes and tool calls in first-seen order, with tool
 * calls indexed by call id so later frames update the existing step instead of adding a duplicate.
 * <p>
 * Owned by a single request pipeline; not thread-safe.
 */
public final class StepLedger {

    private final List<Step> steps = new ArrayList<>();
    private final Map<String, Step.ToolCallStep> toolCallsById = new HashMap<>();

    public void recordReasoning(String text) {
        steps.add(new Step.ReasoningStep(text));
    }

    /**
     * @return true only when this call id was recorded for the first time
     */
    public boolean upsertToolCall(String toolCallId, String toolId, JsonNode params) {
        Step.ToolCallStep existing = toolCallsById.get(toolCallId);
        if (existing != null) {
            if (hasParams(params)) {
                existing.replaceParams(params);
            }
            return false;
        }
        // a call first seen without params is not recorded; its later frames are treated as new
        if (!hasParams(params)) {
            return false;
        }
        Step.ToolCallStep step = new Step.ToolCallStep(toolCallId, toolId, params);
        steps.add(step);
        toolCallsById.put(toolCallId, step);
        return true;
    }

    /**
     * @return false when no tool call with this id has been recorded; the ledger is left unchanged
     */
    public boolean upsertToolResult(String toolCallId, JsonNode results) {
        Step.ToolCallStep existing = toolCallsById.get(toolCallId);
        if (existing == null) {
            return false;
        }
        existing.replaceResults(results);
        return true;
    }

    public List<Step> snapshot() {
        return List.copyOf(steps);
    }

    public int size() {
        return steps.size();
    }

    long toolCallCount() {
        return toolCallsById.size();
    }

    private boolean hasParams(JsonNode params) {
        if (params == null || params.isNull() || params.isMissingNode()) {
            return false;
        }
        if (params.isContainerNode()) {
            return params.size() > 0;
        }
        if (params.isTextual()) {
            return !params.asText().isEmpty();
        }
        return true;
    }
}
