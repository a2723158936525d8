package com.wayfinder.storefront.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Browser access for the storefront UI. Workshop hosts are generated per participant, so origins default to any.
 */
@ConfigurationProperties(prefix = "wayfinder.cors")
public class CorsProperties {

    private List<String> allowedOriginPatterns = new ArrayList<>(List.of("*"));
    private boolean allowCredentials;
    private Duration maxAge = Duration.ofHours(1);

    public List<String> getAllowedOriginPatterns() {
        return allowedOriginPatterns;
    }

    public void setAllowedOriginPatterns(List<String> allowedOriginPatterns) {
        this.allowedOriginPatterns = allowedOriginPatterns;
    }

    public boolean isAllowCredentials() {
        return allowCredentials;
    }

    public void setAllowCredentials(boolean allowCredentials) {
        this.allowCredentials = allowCredentials;
    }

    public Duration getMaxAge() {
        return maxAge;
    }

    public void setMaxAge(Duration maxAge) {
        this.maxAge = maxAge;
    }
}
