package com.wayfinder.storefront.security;

import com.wayfinder.storefront.config.AuthProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

@Component
public class ApiKeyAuthWebFilter implements WebFilter {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyAuthWebFilter.class);

    public static final String API_KEY_HEADER = "X-Api-Key";

    private static final String PROTECTED_PREFIX = "/api";
    private static final byte[] UNAUTHORIZED_BODY =
            "{\"detail\":\"Invalid or missing API key\"}".getBytes(StandardCharsets.UTF_8);

    private final AuthProperties authProperties;

    public ApiKeyAuthWebFilter(AuthProperties authProperties) {
        this.authProperties = authProperties;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!authProperties.isEnabled()) {
            return chain.filter(exchange);
        }

        String path = exchange.getRequest().getPath().value();
        if (!StringUtils.hasText(path) || !isProtected(path)) {
            return chain.filter(exchange);
        }

        if (HttpMethod.OPTIONS.equals(exchange.getRequest().getMethod())) {
            return chain.filter(exchange);
        }

        String provided = exchange.getRequest().getHeaders().getFirst(API_KEY_HEADER);
        if (!matches(provided)) {
            log.warn("Rejected request to {}: invalid or missing API key", path);
            return writeUnauthorized(exchange);
        }
        return chain.filter(exchange);
    }

    private boolean isProtected(String path) {
        return path.equals(PROTECTED_PREFIX) || path.startsWith(PROTECTED_PREFIX + "/");
    }

    private boolean matches(String provided) {
        if (provided == null) {
            return false;
        }
        byte[] expected = authProperties.getApiKey().getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, provided.getBytes(StandardCharsets.UTF_8));
    }

    private Mono<Void> writeUnauthorized(ServerWebExchange exchange) {
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        return exchange.getResponse().writeWith(Mono.just(exchange.getResponse().bufferFactory().wrap(UNAUTHORIZED_BODY)));
    }
}
