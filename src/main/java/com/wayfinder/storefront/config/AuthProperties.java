package com.wayfinder.storefront.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

/**
 * Shared API key guarding {@code /api/**}. A blank key disables the check for local development.
 */
@ConfigurationProperties(prefix = "wayfinder.auth")
public class AuthProperties {

    private String apiKey;

    public boolean isEnabled() {
        return StringUtils.hasText(apiKey);
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }
}
