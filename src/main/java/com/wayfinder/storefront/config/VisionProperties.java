package com.wayfinder.storefront.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "wayfinder.vision")
public class VisionProperties {

    public static final String DEFAULT_PROMPT = "Identify the outdoor product or gear in this image for a catalog search. "
            + "Respond with JSON only, using the keys description, product_type, category, subcategory and key_terms "
            + "(a list of short search terms). Describe terrain or conditions in the description when no product is visible.";

    private String baseUrl = "https://api-beta-vlm.jina.ai/v1";
    private String apiKey;
    private String model = "jina-vlm";
    private long maxImageBytes = 4L * 1024 * 1024;
    private long requestTimeoutMs = 120_000;
    private long warmTimeoutMs = 15_000;
    private int maxTokens = 500;
    private String prompt = DEFAULT_PROMPT;

    public boolean isConfigured() {
        return StringUtils.hasText(apiKey) && StringUtils.hasText(baseUrl);
    }

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

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public long getMaxImageBytes() {
        return maxImageBytes;
    }

    public void setMaxImageBytes(long maxImageBytes) {
        this.maxImageBytes = maxImageBytes;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public long getWarmTimeoutMs() {
        return warmTimeoutMs;
    }

    public void setWarmTimeoutMs(long warmTimeoutMs) {
        this.warmTimeoutMs = warmTimeoutMs;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public String getPrompt() {
        return prompt;
    }

    public void setPrompt(String prompt) {
        this.prompt = StringUtils.hasText(prompt) ? prompt : DEFAULT_PROMPT;
    }
}
