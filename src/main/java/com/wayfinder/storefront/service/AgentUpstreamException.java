package com.wayfinder.storefront.service;

/**
 * Agent builder answered with a non-2xx status before streaming started.
 */
public class AgentUpstreamException extends RuntimeException {

    private final int status;
    private final String body;

    public AgentUpstreamException(int status, String body) {
        super("Agent Builder API error: " + (body == null || body.isBlank() ? "HTTP " + status : body));
        this.status = status;
        this.body = body == null ? "" : body;
    }

    public int getStatus() {
        return status;
    }

    String getBody() {
        return body;
    }
}
