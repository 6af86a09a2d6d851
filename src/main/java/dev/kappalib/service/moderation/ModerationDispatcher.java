package dev.kappalib.service.moderation;

import dev.kappalib.config.ResilienceConfig;
import dev.kappalib.dto.CommentResponse;
import dev.kappalib.metrics.KappalibMetrics;
import dev.kappalib.repository.CommentRepository;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Locale;

/**
 * Delivers new comments to the moderation chat in the background.
 * <p>
 * Delivery runs on a dedicated scheduler with its own deadline and retry budget. It is
 * subscribed on submission, so a cancelled or completed HTTP request never cancels it.
 * </p>
 */
@Service
@Slf4j
public class ModerationDispatcher {

    public enum DeliveryResult {
        DELIVERED,
        REJECTED,
        SKIPPED,
        FAILED
    }

    private final TelegramClient telegramClient;
    private final TelegramMessageFormatter formatter;
    private final CommentRepository commentRepository;
    private final ResilienceConfig resilience;
    private final KappalibMetrics metrics;
    private final Scheduler scheduler;

    @Autowired
    public ModerationDispatcher(TelegramClient telegramClient,
                                TelegramMessageFormatter formatter,
                                CommentRepository commentRepository,
                                ResilienceConfig resilience,
                                KappalibMetrics metrics) {
        this(telegramClient, formatter, commentRepository, resilience, metrics,
                Schedulers.newBoundedElastic(4, 1000, "moderation"));
    }

    ModerationDispatcher(TelegramClient telegramClient,
                         TelegramMessageFormatter formatter,
                         CommentRepository commentRepository,
                         ResilienceConfig resilience,
                         KappalibMetrics metrics,
                         Scheduler scheduler) {
        this.telegramClient = telegramClient;
        this.formatter = formatter;
        this.commentRepository = commentRepository;
        this.resilience = resilience;
        this.metrics = metrics;
        this.scheduler = scheduler;
    }

    /**
     * Start delivering the comment and return immediately.
     *
     * @return the outcome of the delivery; subscribing to it does not start a second delivery
     */
    public Mono<DeliveryResult> submit(CommentResponse comment) {
        Mono<DeliveryResult> delivery = deliver(comment)
                .subscribeOn(scheduler)
                .doOnNext(result -> metrics.incrementModerationDelivery(result.name().toLowerCase(Locale.ROOT)))
                .cache();
        delivery.subscribe(
                result -> log.debug("Moderation delivery for {} finished: {}", comment.getId(), result),
                error -> log.error("Moderation delivery for {} errored: {}", comment.getId(), error.getMessage()));
        return delivery;
    }

    Mono<DeliveryResult> deliver(CommentResponse comment) {
        if (!telegramClient.isConfigured()) {
            log.warn("Telegram credentials not set, skipping moderation message for {}", comment.getId());
            return Mono.just(DeliveryResult.SKIPPED);
        }

        String text = formatter.formatNewComment(
                comment.getUserDisplayName(), comment.getChapterId(), comment.getContentHtml());
        Duration deadline = resilience.getTelegramTimeout();

        return Mono.defer(() -> telegramClient.sendMessage(text, formatter.moderationKeyboard(comment.getId())))
                .retryWhen(resilience.moderationRetry())
                .timeout(deadline)
                .flatMap(messageId -> commentRepository.updateTelegramMessageId(comment.getId(), messageId)
                        .timeout(resilience.getDatabaseTimeout())
                        .thenReturn(DeliveryResult.DELIVERED))
                .defaultIfEmpty(DeliveryResult.REJECTED)
                .onErrorResume(ex -> {
                    log.error("Failed to send moderation message for {}: {}", comment.getId(), ex.getMessage());
                    return Mono.just(DeliveryResult.FAILED);
                });
    }

    @PreDestroy
    public void shutdown() {
        scheduler.dispose();
    }
}
