package com.wayfinder.storefront.service;

import java.util.regex.Pattern;

/**
 * Masks credentials and shortens inline images before request or response text reaches the logs.
 * Stateless.
 */
public final class LogSanitizer {

    private static final Pattern JSON_SECRET_VALUE_PATTERN = Pattern.compile(
            "(?i)(\"(?:authorization|api[_-]?key|access[_-]?token|token|secret|password)\"\\s*:\\s*)\"([^\"]*)\""
    );
    private static final Pattern AUTH_TOKEN_PATTERN = Pattern.compile("(?i)((?:Bearer|ApiKey)\\s+)[A-Za-z0-9._\\-+/=]+");
    private static final Pattern INLINE_IMAGE_PATTERN = Pattern.compile("(data:image/[A-Za-z0-9.+-]+;base64,)[A-Za-z0-9+/=]{64,}");

    private LogSanitizer() {
    }

    public static String maskText(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String masked = JSON_SECRET_VALUE_PATTERN.matcher(text).replaceAll("$1\"***\"");
        masked = AUTH_TOKEN_PATTERN.matcher(masked).replaceAll("$1***");
        return INLINE_IMAGE_PATTERN.matcher(masked).replaceAll("$1<omitted>");
    }

    public static String abbreviate(String text, int maxLength) {
        String masked = maskText(text);
        if (masked.length() <= maxLength) {
            return masked;
        }
        return masked.substring(0, Math.max(0, maxLength)) + "...(" + masked.length() + " chars)";
    }
}
