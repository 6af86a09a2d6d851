package dev.kappalib.controller;

import dev.kappalib.dto.SitemapItem;
import dev.kappalib.dto.StatusResponse;
import dev.kappalib.service.NovelService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Status", description = "Liveness and crawler data")
@Slf4j
public class StatusController {

    private static final Duration DB_CHECK_TIMEOUT = Duration.ofSeconds(5);

    private final R2dbcEntityTemplate r2dbcTemplate;
    private final NovelService novelService;

    @GetMapping
    @Operation(summary = "Service status", description = "Reports whether the database answers a trivial query")
    public Mono<StatusResponse> getStatus() {
        return r2dbcTemplate.getDatabaseClient()
                .sql("SELECT 1")
                .fetch()
                .first()
                .timeout(DB_CHECK_TIMEOUT)
                .map(row -> new StatusResponse("ok", "connected"))
                .defaultIfEmpty(new StatusResponse("ok", "disconnected"))
                // Don't expose internal error details
                .onErrorResume(ex -> {
                    log.error("Database status check failed: {}", ex.getMessage());
                    return Mono.just(new StatusResponse("ok", "disconnected"));
                });
    }

    @GetMapping("/sitemap-data")
    @Operation(summary = "Sitemap data", description = "Id and creation time of every novel")
    public Mono<List<SitemapItem>> getSitemapData() {
        return novelService.getSitemapData();
    }
}
