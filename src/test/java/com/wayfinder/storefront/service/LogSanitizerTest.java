package com.wayfinder.storefront.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldMaskJsonSecretsAndAuthorizationTokens() {
        String masked = LogSanitizer.maskText(
                "{\"api_key\":\"abc123\",\"user\":\"ann\"} Authorization: ApiKey c2VjcmV0 and Bearer jina_xyz"
        );

        assertThat(masked)
                .contains("\"api_key\":\"***\"")
                .contains("\"user\":\"ann\"")
                .contains("ApiKey ***")
                .contains("Bearer ***")
                .doesNotContain("abc123")
                .doesNotContain("c2VjcmV0")
                .doesNotContain("jina_xyz");
    }

    @Test
    void shouldOmitInlineImageData() {
        String image = "data:image/png;base64," + "A".repeat(200);

        assertThat(LogSanitizer.maskText("{\"url\":\"" + image + "\"}"))
                .isEqualTo("{\"url\":\"data:image/png;base64,<omitted>\"}");
    }

    @Test
    void abbreviateShouldTruncateLongText() {
        assertThat(LogSanitizer.abbreviate("short", 10)).isEqualTo("short");
        assertThat(LogSanitizer.abbreviate("0123456789abc", 4)).isEqualTo("0123...(13 chars)");
        assertThat(LogSanitizer.maskText(null)).isEmpty();
    }
}
