package dev.kappalib.service;

import dev.kappalib.config.ResilienceConfig;
import dev.kappalib.dto.NovelResponse;
import dev.kappalib.dto.NovelsPage;
import dev.kappalib.dto.SitemapItem;
import dev.kappalib.exception.ResourceNotFoundException;
import dev.kappalib.repository.NovelQueryRepository;
import dev.kappalib.repository.NovelRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class NovelService {

    public static final int PAGE_SIZE = 12;
    public static final int SEARCH_LIMIT = 20;
    public static final int MAX_QUERY_LENGTH = 50;

    static final Duration NOVEL_TTL = Duration.ofMinutes(10);
    static final Duration NOVELS_PAGE_TTL = Duration.ofMinutes(5);
    static final Duration SITEMAP_TTL = Duration.ofHours(1);

    private final NovelRepository novelRepository;
    private final NovelQueryRepository novelQueryRepository;
    private final ResponseCache responseCache;
    private final ResilienceConfig resilience;

    public Mono<NovelResponse> getNovel(String id) {
        return responseCache.getOrFetch("novel:" + id, NOVEL_TTL,
                        () -> novelRepository.findById(id)
                                .map(NovelResponse::from)
                                .timeout(resilience.getDatabaseTimeout()))
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Novel", "id", id)));
    }

    /**
     * One catalog page. Unknown sort keys fall back to {@code oldest}; a page past the end
     * yields an empty list with the real totals.
     */
    public Mono<NovelsPage> getNovels(int page, String sort) {
        String sortKey = NovelQueryRepository.normalizeSort(sort);
        int offset = (page - 1) * PAGE_SIZE;
        String key = "novels:page:" + page + ":sort:" + sortKey;

        return responseCache.getOrFetch(key, NOVELS_PAGE_TTL, () -> novelRepository.count()
                .flatMap(total -> {
                    if (offset >= total) {
                        return Mono.just(NovelsPage.of(List.of(), page, PAGE_SIZE, total));
                    }
                    return novelQueryRepository.findPage(sortKey, PAGE_SIZE, offset)
                            .map(NovelResponse::from)
                            .collectList()
                            .map(novels -> NovelsPage.of(novels, page, PAGE_SIZE, total));
                })
                .timeout(resilience.getDatabaseTimeout())
                .doOnError(e -> log.error("Failed to load novels page {} (sort={}): {}", page, sortKey, e.getMessage())));
    }

    /**
     * Trigram fuzzy search over title, English title and author. Not cached.
     */
    public Mono<List<NovelResponse>> searchNovels(String query) {
        String trimmed = query == null ? "" : query.trim();
        if (trimmed.isEmpty()) {
            return Mono.just(List.of());
        }
        if (trimmed.length() > MAX_QUERY_LENGTH) {
            return Mono.error(new IllegalArgumentException("error.search_query_too_long"));
        }
        return novelQueryRepository.search(trimmed, SEARCH_LIMIT)
                .map(NovelResponse::from)
                .collectList()
                .timeout(resilience.getDatabaseTimeout())
                .doOnError(e -> log.error("Novel search failed: {}", e.getMessage()));
    }

    public Mono<List<SitemapItem>> getSitemapData() {
        return responseCache.getOrFetch("sitemap_data", SITEMAP_TTL,
                () -> novelRepository.findSitemapItems()
                        .collectList()
                        .timeout(resilience.getDatabaseTimeout()));
    }
}
