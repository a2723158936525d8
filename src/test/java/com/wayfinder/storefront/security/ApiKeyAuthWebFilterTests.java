package com.wayfinder.storefront.security;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.test.web.reactive.server.WebTestClient;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.MOCK,
        properties = {
                "wayfinder.auth.api-key=workshop-secret",
                "wayfinder.vision.api-key=",
                "wayfinder.agent-builder.base-url=http://127.0.0.1:9"
        }
)
@AutoConfigureWebTestClient
class ApiKeyAuthWebFilterTests {

    @Autowired
    private WebTestClient webTestClient;

    @Test
    void shouldRejectApiRequestWithoutKey() {
        webTestClient.post()
                .uri("/api/vision/warm")
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.detail").isEqualTo("Invalid or missing API key");
    }

    @Test
    void shouldRejectApiRequestWithWrongKey() {
        webTestClient.post()
                .uri("/api/vision/warm")
                .header(ApiKeyAuthWebFilter.API_KEY_HEADER, "workshop-secreT")
                .exchange()
                .expectStatus().isUnauthorized();
    }

    @Test
    void shouldAllowApiRequestWithMatchingKey() {
        webTestClient.post()
                .uri("/api/vision/warm")
                .header(ApiKeyAuthWebFilter.API_KEY_HEADER, "workshop-secret")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("unavailable");
    }

    @Test
    void shouldLeaveHealthOpen() {
        webTestClient.get()
                .uri("/health")
                .exchange()
                .expectStatus().isOk();
    }

    @Test
    void shouldLetPreflightThrough() {
        webTestClient.options()
                .uri("http://localhost/api/chat")
                .header(HttpHeaders.ORIGIN, "https://workshop.example.com")
                .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, HttpMethod.POST.name())
                .header(HttpHeaders.ACCESS_CONTROL_REQUEST_HEADERS, "content-type, x-api-key")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "https://workshop.example.com")
                .expectHeader().valueMatches(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS, "(?i).*x-api-key.*")
                .expectHeader().valueEquals(HttpHeaders.ACCESS_CONTROL_MAX_AGE, "3600");
    }

    @Test
    void shouldRefusePreflightForMethodTheStorefrontDoesNotServe() {
        webTestClient.options()
                .uri("http://localhost/api/chat")
                .header(HttpHeaders.ORIGIN, "https://workshop.example.com")
                .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, HttpMethod.DELETE.name())
                .exchange()
                .expectStatus().isForbidden();
    }
}
