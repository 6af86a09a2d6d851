package dev.kappalib.service;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.kappalib.config.ResilienceConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Verifies Cloudflare Turnstile tokens. Profiles and comments use separate site keys,
 * so each {@link Scope} carries its own secret.
 * <p>
 * Verification fails closed: a missing secret, a transport error or an open circuit
 * all reject the token.
 * </p>
 */
@Service
@Slf4j
public class TurnstileService {

    private static final String VERIFY_URL = "https://challenges.cloudflare.com/turnstile/v0/siteverify";

    public enum Scope {
        PROFILE,
        COMMENTS
    }

    private final WebClient webClient;
    private final String profileSecret;
    private final String commentsSecret;
    private final boolean enabled;
    private final Duration timeout;
    private final CircuitBreaker circuitBreaker;

    public TurnstileService(
            WebClient.Builder webClientBuilder,
            ResilienceConfig resilienceConfig,
            @Value("${app.turnstile.profile-secret:}") String profileSecret,
            @Value("${app.turnstile.comments-secret:}") String commentsSecret,
            @Value("${app.turnstile.enabled:true}") boolean enabled) {
        this.webClient = webClientBuilder.clone().baseUrl(VERIFY_URL).build();
        this.profileSecret = profileSecret;
        this.commentsSecret = commentsSecret;
        this.enabled = enabled;
        this.timeout = resilienceConfig.getCaptchaTimeout();

        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(60))
                .slidingWindowSize(5)
                .minimumNumberOfCalls(5)
                .build();
        this.circuitBreaker = CircuitBreaker.of("turnstile-verify", cbConfig);
        log.info("Turnstile verifier initialised (enabled={}, profileSecret={}, commentsSecret={})",
                enabled, !profileSecret.isBlank(), !commentsSecret.isBlank());
    }

    /**
     * @return Mono that completes if the token is valid, errors with {@link TurnstileException} otherwise
     */
    public Mono<Void> verify(String token, Scope scope) {
        if (!enabled) {
            log.debug("Turnstile verification is disabled, skipping");
            return Mono.empty();
        }

        String secret = scope == Scope.PROFILE ? profileSecret : commentsSecret;
        if (secret == null || secret.isBlank()) {
            log.warn("Turnstile secret for {} is not configured", scope);
            return Mono.error(new TurnstileException("Turnstile secret not configured"));
        }
        if (token == null || token.isBlank()) {
            log.warn("Turnstile token is missing for {}", scope);
            return Mono.error(new TurnstileException("Turnstile token missing"));
        }

        return webClient.post()
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData("secret", secret).with("response", token))
                .retrieve()
                .bodyToMono(TurnstileResponse.class)
                .timeout(timeout)
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .flatMap(response -> {
                    if (!response.success()) {
                        log.warn("Turnstile rejected token for {}: errors={}", scope, response.errorCodes());
                        return Mono.<Void>error(new TurnstileException("Turnstile verification failed"));
                    }
                    log.debug("Turnstile verified for {}", scope);
                    return Mono.<Void>empty();
                })
                .onErrorResume(TurnstileException.class, Mono::error)
                .onErrorResume(ex -> {
                    log.error("Turnstile verification error for {}: {}", scope, ex.getMessage());
                    return Mono.error(new TurnstileException("Turnstile verification unavailable"));
                })
                .then();
    }

    /**
     * Response from the Turnstile siteverify endpoint.
     */
    record TurnstileResponse(boolean success, List<String> errorCodes) {

        @JsonCreator
        TurnstileResponse(
                @JsonProperty("success") boolean success,
                @JsonProperty("error-codes") List<String> errorCodes) {
            this.success = success;
            this.errorCodes = errorCodes;
        }
    }

    /**
     * Thrown when a Turnstile token cannot be verified.
     */
    public static class TurnstileException extends RuntimeException {
        public TurnstileException(String message) {
            super(message);
        }
    }
}
