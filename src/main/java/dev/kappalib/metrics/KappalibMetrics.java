package dev.kappalib.metrics;

import dev.kappalib.entity.CommentStatus;
import dev.kappalib.repository.CommentRepository;
import dev.kappalib.repository.ProfileRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicLong;

@Component
@RequiredArgsConstructor
@Slf4j
public class KappalibMetrics {

    private final MeterRegistry meterRegistry;
    private final ProfileRepository profileRepository;
    private final CommentRepository commentRepository;

    private final AtomicLong totalProfiles = new AtomicLong(0);
    private final AtomicLong pendingComments = new AtomicLong(0);

    private Counter profileCreatedCounter;
    private Counter profileDeletedCounter;
    private Counter commentCreatedCounter;

    @PostConstruct
    public void init() {
        Gauge.builder("kappalib.profiles.total", totalProfiles, AtomicLong::get)
                .description("Total number of reader profiles")
                .register(meterRegistry);

        Gauge.builder("kappalib.comments.pending", pendingComments, AtomicLong::get)
                .description("Comments waiting for moderation")
                .tag("status", "pending")
                .register(meterRegistry);

        profileCreatedCounter = meterRegistry.counter("kappalib.profiles.created");
        profileDeletedCounter = meterRegistry.counter("kappalib.profiles.deleted");
        commentCreatedCounter = meterRegistry.counter("kappalib.comments.created");
    }

    @Scheduled(fixedRateString = "${scheduling.metrics-update-ms:60000}", initialDelayString = "${scheduling.initial-delay-ms:30000}")
    public void updateMetrics() {
        Mono.zip(
                profileRepository.count().onErrorReturn(0L),
                commentRepository.countByStatus(CommentStatus.PENDING.dbValue()).onErrorReturn(0L)
        ).subscribe(
                tuple -> {
                    totalProfiles.set(tuple.getT1());
                    pendingComments.set(tuple.getT2());
                },
                error -> log.warn("Failed to update metrics: {}", error.getMessage())
        );
    }

    public void incrementProfileCreated() {
        profileCreatedCounter.increment();
    }

    public void incrementProfileDeleted() {
        profileDeletedCounter.increment();
    }

    public void incrementCommentCreated() {
        commentCreatedCounter.increment();
    }

    public void incrementCommentModerated(String status) {
        meterRegistry.counter("kappalib.comments.moderated", "status", status).increment();
    }

    public void incrementModerationDelivery(String result) {
        meterRegistry.counter("kappalib.moderation.delivery", "result", result).increment();
    }
}
