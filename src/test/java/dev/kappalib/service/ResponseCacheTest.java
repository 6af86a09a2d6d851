package dev.kappalib.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private ResponseCache cache;

    @BeforeEach
    void setUp() {
        cache = new ResponseCache(100, nanos::get);
    }

    @Test
    @DisplayName("Should serve the cached value within the TTL")
    void shouldServeFromCache() {
        AtomicInteger loads = new AtomicInteger();

        for (int i = 0; i < 3; i++) {
            StepVerifier.create(cache.getOrFetch("novel:1", Duration.ofMinutes(10),
                            () -> Mono.fromCallable(() -> "v" + loads.incrementAndGet())))
                    .expectNext("v1")
                    .verifyComplete();
        }
        assertThat(loads).hasValue(1);
    }

    @Test
    @DisplayName("Should reload after the entry's own TTL elapses")
    void shouldExpirePerEntry() {
        AtomicInteger loads = new AtomicInteger();
        cache.getOrFetch("short", Duration.ofMinutes(5), () -> Mono.just("a")).block();
        cache.getOrFetch("long", Duration.ofHours(1), () -> Mono.fromCallable(() -> "b" + loads.incrementAndGet())).block();

        nanos.addAndGet(Duration.ofMinutes(6).toNanos());

        StepVerifier.create(cache.getOrFetch("short", Duration.ofMinutes(5), () -> Mono.just("a2")))
                .expectNext("a2")
                .verifyComplete();
        StepVerifier.create(cache.getOrFetch("long", Duration.ofHours(1), () -> Mono.just("unused")))
                .expectNext("b1")
                .verifyComplete();
    }

    @Test
    @DisplayName("Should not cache loader errors or empty results")
    void shouldNotCacheFailures() {
        StepVerifier.create(cache.getOrFetch("k", Duration.ofMinutes(1),
                        () -> Mono.<String>error(new IllegalStateException("db down"))))
                .expectError(IllegalStateException.class)
                .verify();
        StepVerifier.create(cache.getOrFetch("k", Duration.ofMinutes(1), Mono::<String>empty))
                .verifyComplete();

        assertThat(cache.size()).isZero();

        StepVerifier.create(cache.getOrFetch("k", Duration.ofMinutes(1), () -> Mono.just("ok")))
                .expectNext("ok")
                .verifyComplete();
    }

    @Test
    @DisplayName("Invalidate should force a reload")
    void invalidateShouldForceReload() {
        cache.getOrFetch("k", Duration.ofMinutes(1), () -> Mono.just("old")).block();
        cache.invalidate("k");

        StepVerifier.create(cache.getOrFetch("k", Duration.ofMinutes(1), () -> Mono.just("new")))
                .expectNext("new")
                .verifyComplete();
    }
}
