package dev.kappalib.service;

import dev.kappalib.config.ResilienceConfig;
import dev.kappalib.dto.ChapterResponse;
import dev.kappalib.dto.ChaptersListResponse;
import dev.kappalib.exception.ResourceNotFoundException;
import dev.kappalib.repository.ChapterQueryRepository;
import dev.kappalib.repository.ChapterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;

@Service
@RequiredArgsConstructor
@Slf4j
public class ChapterService {

    static final Duration CHAPTER_TTL = Duration.ofMinutes(30);
    static final Duration CHAPTERS_LIST_TTL = Duration.ofMinutes(5);

    private final ChapterRepository chapterRepository;
    private final ChapterQueryRepository chapterQueryRepository;
    private final ResponseCache responseCache;
    private final ResilienceConfig resilience;

    /**
     * Chapter list of a novel ordered by chapter number. An unknown novel gives an empty list.
     */
    public Mono<ChaptersListResponse> getChapters(String novelId) {
        return responseCache.getOrFetch("chapters:" + novelId, CHAPTERS_LIST_TTL,
                () -> chapterRepository.findSummariesByNovelId(novelId)
                        .collectList()
                        .map(chapters -> ChaptersListResponse.of(novelId, chapters))
                        .timeout(resilience.getDatabaseTimeout())
                        .doOnError(e -> log.error("Failed to fetch chapters for novel {}: {}", novelId, e.getMessage())));
    }

    public Mono<ChapterResponse> getChapter(String id) {
        return responseCache.getOrFetch("chapter:" + id, CHAPTER_TTL,
                        () -> chapterQueryRepository.findWithSource(id)
                                .timeout(resilience.getDatabaseTimeout()))
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Chapter", "id", id)));
    }

    /**
     * Uncached existence check used before accepting a comment.
     */
    public Mono<Boolean> exists(String id) {
        return chapterRepository.existsById(id)
                .timeout(resilience.getDatabaseTimeout());
    }
}
