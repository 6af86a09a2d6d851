package dev.kappalib.repository;

import dev.kappalib.dto.ChapterSummary;
import dev.kappalib.entity.Chapter;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface ChapterRepository extends ReactiveCrudRepository<Chapter, String> {

    @Query("SELECT id, chapter_num, title, title_en FROM chapters WHERE novel_id = :novelId ORDER BY chapter_num ASC")
    Flux<ChapterSummary> findSummariesByNovelId(String novelId);
}
