package dev.kappalib.repository;

import dev.kappalib.dto.ChapterResponse;
import io.r2dbc.spi.Row;
import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;

@Repository
@RequiredArgsConstructor
public class ChapterQueryRepository {

    private final R2dbcEntityTemplate r2dbcTemplate;

    private static final String FIND_WITH_SOURCE =
            "SELECT c.id, c.novel_id, c.chapter_num, c.title, c.title_en, c.content, c.created_at, " +
            "s.name AS source_name, s.logo_url AS source_logo_url " +
            "FROM chapters c LEFT JOIN sources s ON c.source_id = s.id " +
            "WHERE c.id = :id";

    public Mono<ChapterResponse> findWithSource(String id) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(FIND_WITH_SOURCE)
                .bind("id", id)
                .map((row, meta) -> mapRow(row))
                .one();
    }

    private static ChapterResponse mapRow(Row row) {
        String sourceName = row.get("source_name", String.class);
        return ChapterResponse.builder()
                .id(row.get("id", String.class))
                .novelId(row.get("novel_id", String.class))
                .chapterNum(row.get("chapter_num", Integer.class))
                .title(row.get("title", String.class))
                .titleEn(row.get("title_en", String.class))
                .content(row.get("content", String.class))
                .createdAt(row.get("created_at", OffsetDateTime.class))
                .source(sourceName != null
                        ? new ChapterResponse.SourceInfo(sourceName, row.get("source_logo_url", String.class))
                        : null)
                .build();
    }
}
