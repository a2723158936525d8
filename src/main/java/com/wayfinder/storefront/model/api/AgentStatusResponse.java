package com.wayfinder.storefront.model.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentStatusResponse(
        boolean exists,
        @JsonProperty("agent_id")
        String agentId,
        String error
) {

    public static AgentStatusResponse found(String agentId, boolean exists) {
        return new AgentStatusResponse(exists, agentId, null);
    }

    public static AgentStatusResponse failed(String agentId, String error) {
        return new AgentStatusResponse(false, agentId, error);
    }
}
