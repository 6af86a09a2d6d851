package dev.kappalib.controller;

import dev.kappalib.dto.SitemapItem;
import dev.kappalib.dto.StatusResponse;
import dev.kappalib.service.NovelService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.FetchSpec;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StatusControllerTest {

    @Mock
    private R2dbcEntityTemplate r2dbcTemplate;

    @Mock
    private NovelService novelService;

    @InjectMocks
    private StatusController controller;

    @SuppressWarnings("unchecked")
    private void mockDatabase(Mono<Map<String, Object>> result) {
        DatabaseClient dbClient = mock(DatabaseClient.class);
        DatabaseClient.GenericExecuteSpec executeSpec = mock(DatabaseClient.GenericExecuteSpec.class);
        FetchSpec<Map<String, Object>> fetchSpec = mock(FetchSpec.class);

        when(r2dbcTemplate.getDatabaseClient()).thenReturn(dbClient);
        when(dbClient.sql("SELECT 1")).thenReturn(executeSpec);
        when(executeSpec.fetch()).thenReturn(fetchSpec);
        when(fetchSpec.first()).thenReturn(result);
    }

    @Nested
    @DisplayName("GET /api")
    class GetStatus {

        @Test
        @DisplayName("Should report connected when the database answers")
        void connected() {
            mockDatabase(Mono.just(Map.of("?column?", 1)));

            StepVerifier.create(controller.getStatus())
                    .expectNext(new StatusResponse("ok", "connected"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should report disconnected without leaking the error")
        void disconnected() {
            mockDatabase(Mono.error(new IllegalStateException("Connection refused: db:5432")));

            StepVerifier.create(controller.getStatus())
                    .expectNext(new StatusResponse("ok", "disconnected"))
                    .verifyComplete();
        }
    }

    @Test
    @DisplayName("GET /api/sitemap-data should return every novel")
    void sitemapData() {
        when(novelService.getSitemapData()).thenReturn(Mono.just(List.of(
                new SitemapItem("nvl_1", OffsetDateTime.parse("2024-05-01T12:00:00Z")))));

        StepVerifier.create(controller.getSitemapData())
                .assertNext(items -> assertThat(items).extracting(SitemapItem::id).containsExactly("nvl_1"))
                .verifyComplete();
    }
}
