package dev.kappalib.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Timeouts for every outbound dependency and the retry policy for moderation delivery.
 *
 * <pre>
 * return profileRepository.findById(id)
 *         .timeout(resilience.getDatabaseTimeout());
 * </pre>
 */
@Component
@Getter
@Slf4j
public class ResilienceConfig {

    private final Duration databaseTimeout;
    private final Duration captchaTimeout;
    private final Duration storageTimeout;
    private final Duration telegramTimeout;
    private final int moderationRetryMaxAttempts;
    private final Duration moderationRetryMinBackoff;

    public ResilienceConfig(
            @Value("${resilience.database.timeout-seconds:10}") int databaseTimeoutSeconds,
            @Value("${resilience.captcha.timeout-seconds:10}") int captchaTimeoutSeconds,
            @Value("${resilience.storage.timeout-seconds:30}") int storageTimeoutSeconds,
            @Value("${resilience.telegram.timeout-seconds:30}") int telegramTimeoutSeconds,
            @Value("${resilience.moderation.retry-max-attempts:3}") int moderationRetryMaxAttempts,
            @Value("${resilience.moderation.retry-min-backoff-ms:500}") int moderationRetryMinBackoffMs
    ) {
        this.databaseTimeout = Duration.ofSeconds(databaseTimeoutSeconds);
        this.captchaTimeout = Duration.ofSeconds(captchaTimeoutSeconds);
        this.storageTimeout = Duration.ofSeconds(storageTimeoutSeconds);
        this.telegramTimeout = Duration.ofSeconds(telegramTimeoutSeconds);
        this.moderationRetryMaxAttempts = moderationRetryMaxAttempts;
        this.moderationRetryMinBackoff = Duration.ofMillis(moderationRetryMinBackoffMs);
        log.info("Resilience configuration initialized (db={}s, captcha={}s, storage={}s, telegram={}s)",
                databaseTimeoutSeconds, captchaTimeoutSeconds, storageTimeoutSeconds, telegramTimeoutSeconds);
    }

    /**
     * Retry for chat API delivery: exponential backoff with jitter, transport failures only (the cause chain is inspected).
     */
    public RetryBackoffSpec moderationRetry() {
        return Retry.backoff(moderationRetryMaxAttempts, moderationRetryMinBackoff)
                .jitter(0.5)
                .filter(this::isRetryableException)
                .doBeforeRetry(signal -> log.warn("Retrying moderation delivery, attempt {}/{}: {}",
                        signal.totalRetries() + 1,
                        moderationRetryMaxAttempts,
                        signal.failure().getMessage()));
    }

    boolean isRetryableException(Throwable throwable) {
        for (Throwable current = throwable; current != null; current = current.getCause()) {
            if (current instanceof TimeoutException || isTransientMessage(current.getMessage())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isTransientMessage(String message) {
        if (message == null) return false;

        String lowerMessage = message.toLowerCase(Locale.ROOT);
        return lowerMessage.contains("connection")
                || lowerMessage.contains("timeout")
                || lowerMessage.contains("temporarily unavailable")
                || lowerMessage.contains("too many requests");
    }
}
