package com.wayfinder.storefront.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "wayfinder.agent-builder")
public class AgentBuilderProperties {

    private String baseUrl = "http://kubernetes-vm:30001";
    private String apiKey;
    private String defaultAgentId = "wayfinder-search-agent";
    private long streamTimeoutMs = 300_000;
    private long extractionTimeoutMs = 30_000;
    private long statusTimeoutMs = 10_000;
    private long workflowTimeoutMs = 60_000;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getDefaultAgentId() {
        return defaultAgentId;
    }

    public void setDefaultAgentId(String defaultAgentId) {
        this.defaultAgentId = defaultAgentId;
    }

    public long getStreamTimeoutMs() {
        return streamTimeoutMs;
    }

    public void setStreamTimeoutMs(long streamTimeoutMs) {
        this.streamTimeoutMs = streamTimeoutMs;
    }

    public long getExtractionTimeoutMs() {
        return extractionTimeoutMs;
    }

    public void setExtractionTimeoutMs(long extractionTimeoutMs) {
        this.extractionTimeoutMs = extractionTimeoutMs;
    }

    public long getStatusTimeoutMs() {
        return statusTimeoutMs;
    }

    public void setStatusTimeoutMs(long statusTimeoutMs) {
        this.statusTimeoutMs = statusTimeoutMs;
    }

    public long getWorkflowTimeoutMs() {
        return workflowTimeoutMs;
    }

    public void setWorkflowTimeoutMs(long workflowTimeoutMs) {
        this.workflowTimeoutMs = workflowTimeoutMs;
    }
}
