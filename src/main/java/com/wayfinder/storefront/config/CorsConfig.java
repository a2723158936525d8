package com.wayfinder.storefront.config;

import com.wayfinder.storefront.security.ApiKeyAuthWebFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.util.StringUtils;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

import java.util.List;

/**
 * CORS for the storefront routes only. The UI issues GET and POST with JSON bodies and the shared API key header;
 * anything else is refused at preflight.
 */
@Configuration
public class CorsConfig {

    static final List<String> STOREFRONT_ROUTES = List.of("/api/**", "/health");

    @Bean
    public CorsWebFilter corsWebFilter(CorsProperties properties) {
        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOriginPatterns(properties.getAllowedOriginPatterns().stream()
                .filter(StringUtils::hasText)
                .map(String::trim)
                .toList());
        configuration.setAllowedMethods(List.of(HttpMethod.GET.name(), HttpMethod.POST.name(), HttpMethod.OPTIONS.name()));
        configuration.setAllowedHeaders(List.of(
                HttpHeaders.CONTENT_TYPE,
                HttpHeaders.ACCEPT,
                HttpHeaders.CACHE_CONTROL,
                ApiKeyAuthWebFilter.API_KEY_HEADER
        ));
        configuration.setAllowCredentials(properties.isAllowCredentials());
        configuration.setMaxAge(properties.getMaxAge());

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        STOREFRONT_ROUTES.forEach(route -> source.registerCorsConfiguration(route, configuration));
        return new CorsWebFilter(source);
    }
}
