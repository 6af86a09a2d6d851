package dev.kappalib.health;

import io.r2dbc.spi.ConnectionFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Reactive health indicator for the PostgreSQL database behind R2DBC.
 */
@Component("db")
@RequiredArgsConstructor
@Slf4j
public class DatabaseHealthIndicator implements ReactiveHealthIndicator {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final DatabaseClient databaseClient;
    private final ConnectionFactory connectionFactory;

    @Override
    public Mono<Health> health() {
        return databaseClient.sql("SELECT 1")
                .fetch()
                .first()
                .map(result -> Health.up()
                        .withDetail("database", "PostgreSQL")
                        .withDetail("connectionFactory", connectionFactory.getMetadata().getName())
                        .build())
                .defaultIfEmpty(Health.unknown().withDetail("database", "PostgreSQL").build())
                .timeout(TIMEOUT)
                .onErrorResume(this::buildDownHealth);
    }

    private Mono<Health> buildDownHealth(Throwable ex) {
        log.error("Database health check failed: {}", ex.getMessage());
        return Mono.just(Health.down()
                .withDetail("database", "PostgreSQL")
                .withDetail("error", ex.getClass().getSimpleName())
                .build());
    }
}
