package dev.kappalib.service;

import dev.kappalib.config.ResilienceConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class TurnstileServiceTest {

    private final ResilienceConfig resilience = new ResilienceConfig(10, 10, 30, 30, 3, 10);

    private static WebClient.Builder stubbedBuilder(HttpStatus status, String body, AtomicInteger calls) {
        return WebClient.builder().exchangeFunction(request -> {
            calls.incrementAndGet();
            return Mono.just(ClientResponse.create(status)
                    .header("Content-Type", "application/json")
                    .body(body)
                    .build());
        });
    }

    private TurnstileService service(HttpStatus status, String body, AtomicInteger calls, boolean enabled) {
        return new TurnstileService(stubbedBuilder(status, body, calls), resilience,
                "profile-secret", "comments-secret", enabled);
    }

    @Nested
    @DisplayName("verify")
    class Verify {

        @Test
        @DisplayName("Should complete when Turnstile reports success")
        void shouldAcceptValidToken() {
            AtomicInteger calls = new AtomicInteger();
            TurnstileService turnstile = service(HttpStatus.OK, "{\"success\":true,\"error-codes\":[]}", calls, true);

            StepVerifier.create(turnstile.verify("token", TurnstileService.Scope.PROFILE))
                    .verifyComplete();
            assertThat(calls).hasValue(1);
        }

        @Test
        @DisplayName("Should fail when Turnstile rejects the token")
        void shouldRejectInvalidToken() {
            TurnstileService turnstile = service(HttpStatus.OK,
                    "{\"success\":false,\"error-codes\":[\"invalid-input-response\"]}", new AtomicInteger(), true);

            StepVerifier.create(turnstile.verify("token", TurnstileService.Scope.COMMENTS))
                    .expectError(TurnstileService.TurnstileException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should fail closed when the verifier is unreachable")
        void shouldFailClosedOnUpstreamError() {
            TurnstileService turnstile = service(HttpStatus.SERVICE_UNAVAILABLE, "{}", new AtomicInteger(), true);

            StepVerifier.create(turnstile.verify("token", TurnstileService.Scope.PROFILE))
                    .expectError(TurnstileService.TurnstileException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should reject a missing token without calling out")
        void shouldRejectMissingToken() {
            AtomicInteger calls = new AtomicInteger();
            TurnstileService turnstile = service(HttpStatus.OK, "{\"success\":true}", calls, true);

            StepVerifier.create(turnstile.verify(" ", TurnstileService.Scope.PROFILE))
                    .expectError(TurnstileService.TurnstileException.class)
                    .verify();
            assertThat(calls).hasValue(0);
        }

        @Test
        @DisplayName("Should reject when the scope has no secret configured")
        void shouldRejectWithoutSecret() {
            AtomicInteger calls = new AtomicInteger();
            TurnstileService turnstile = new TurnstileService(
                    stubbedBuilder(HttpStatus.OK, "{\"success\":true}", calls), resilience, "profile-secret", "", true);

            StepVerifier.create(turnstile.verify("token", TurnstileService.Scope.COMMENTS))
                    .expectError(TurnstileService.TurnstileException.class)
                    .verify();
            assertThat(calls).hasValue(0);
        }

        @Test
        @DisplayName("Should skip verification entirely when disabled")
        void shouldSkipWhenDisabled() {
            AtomicInteger calls = new AtomicInteger();
            TurnstileService turnstile = service(HttpStatus.OK, "{\"success\":false}", calls, false);

            StepVerifier.create(turnstile.verify(null, TurnstileService.Scope.COMMENTS))
                    .verifyComplete();
            assertThat(calls).hasValue(0);
        }
    }
}
