package dev.kappalib.service.moderation;

import dev.kappalib.config.ResilienceConfig;
import dev.kappalib.dto.CommentResponse;
import dev.kappalib.exception.UpstreamServiceException;
import dev.kappalib.metrics.KappalibMetrics;
import dev.kappalib.repository.CommentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ModerationDispatcherTest {

    @Mock
    private TelegramClient telegramClient;

    @Mock
    private CommentRepository commentRepository;

    @Mock
    private KappalibMetrics metrics;

    private ModerationDispatcher dispatcher;

    private final CommentResponse comment = CommentResponse.builder()
            .id("cmt_1")
            .chapterId("chp_1")
            .userDisplayName("Тихий Ёж")
            .contentHtml("<p>привет</p>")
            .status("pending")
            .build();

    @BeforeEach
    void setUp() {
        dispatcher = new ModerationDispatcher(telegramClient, new TelegramMessageFormatter(), commentRepository,
                new ResilienceConfig(10, 10, 30, 30, 3, 10), metrics, Schedulers.immediate());
    }

    @Test
    @DisplayName("Should skip delivery when the bot is not configured")
    void skipsWhenUnconfigured() {
        when(telegramClient.isConfigured()).thenReturn(false);

        StepVerifier.create(dispatcher.submit(comment))
                .expectNext(ModerationDispatcher.DeliveryResult.SKIPPED)
                .verifyComplete();
        verify(telegramClient, never()).sendMessage(anyString(), anyMap());
        verify(metrics).incrementModerationDelivery("skipped");
    }

    @Test
    @DisplayName("Should store the message id after delivery")
    void storesMessageId() {
        when(telegramClient.isConfigured()).thenReturn(true);
        when(telegramClient.sendMessage(anyString(), anyMap())).thenReturn(Mono.just(77L));
        when(commentRepository.updateTelegramMessageId("cmt_1", 77L)).thenReturn(Mono.just(1));

        StepVerifier.create(dispatcher.submit(comment))
                .expectNext(ModerationDispatcher.DeliveryResult.DELIVERED)
                .verifyComplete();
    }

    @Test
    @DisplayName("Should deliver once even when the result is subscribed again")
    void deliversOnce() {
        when(telegramClient.isConfigured()).thenReturn(true);
        when(telegramClient.sendMessage(anyString(), anyMap())).thenReturn(Mono.just(77L));
        when(commentRepository.updateTelegramMessageId("cmt_1", 77L)).thenReturn(Mono.just(1));

        Mono<ModerationDispatcher.DeliveryResult> result = dispatcher.submit(comment);
        result.block(Duration.ofSeconds(5));
        result.block(Duration.ofSeconds(5));

        verify(telegramClient, times(1)).sendMessage(anyString(), anyMap());
    }

    @Test
    @DisplayName("Rejected message should not touch the comment")
    void rejectedMessage() {
        when(telegramClient.isConfigured()).thenReturn(true);
        when(telegramClient.sendMessage(anyString(), anyMap())).thenReturn(Mono.empty());

        StepVerifier.create(dispatcher.submit(comment))
                .expectNext(ModerationDispatcher.DeliveryResult.REJECTED)
                .verifyComplete();
        verify(commentRepository, never()).updateTelegramMessageId(anyString(), anyLong());
    }

    @Test
    @DisplayName("Transient failure should be retried")
    void retriesTransientFailure() {
        AtomicInteger calls = new AtomicInteger();
        when(telegramClient.isConfigured()).thenReturn(true);
        when(telegramClient.sendMessage(anyString(), anyMap())).thenAnswer(inv -> calls.incrementAndGet() == 1
                ? Mono.error(new UpstreamServiceException("telegram", "sendMessage failed",
                        new IOException("Connection reset by peer")))
                : Mono.just(78L));
        when(commentRepository.updateTelegramMessageId("cmt_1", 78L)).thenReturn(Mono.just(1));

        StepVerifier.create(dispatcher.submit(comment))
                .expectNext(ModerationDispatcher.DeliveryResult.DELIVERED)
                .verifyComplete();
    }

    @Test
    @DisplayName("Permanent failure should end as FAILED without retries")
    void permanentFailure() {
        when(telegramClient.isConfigured()).thenReturn(true);
        when(telegramClient.sendMessage(anyString(), anyMap()))
                .thenReturn(Mono.error(new IllegalStateException("Bad Request: chat not found")));

        StepVerifier.create(dispatcher.submit(comment))
                .expectNext(ModerationDispatcher.DeliveryResult.FAILED)
                .verifyComplete();
        verify(telegramClient, times(1)).sendMessage(anyString(), anyMap());
        verify(metrics).incrementModerationDelivery("failed");
    }
}
