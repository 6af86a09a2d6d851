package dev.kappalib.controller;

import dev.kappalib.dto.ChaptersListResponse;
import dev.kappalib.dto.NovelResponse;
import dev.kappalib.dto.NovelSearchResponse;
import dev.kappalib.dto.NovelsPage;
import dev.kappalib.service.ChapterService;
import dev.kappalib.service.NovelService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/novels")
@RequiredArgsConstructor
@Validated
@Tag(name = "Novels", description = "Novel catalog and search")
@Slf4j
public class NovelController {

    private final NovelService novelService;
    private final ChapterService chapterService;

    @GetMapping
    @Operation(summary = "List novels", description = "Returns a page of 12 novels in the requested sort order")
    public Mono<NovelsPage> getNovels(
            @RequestParam(defaultValue = "1") @Min(1) @Max(9999)
            @Parameter(description = "Page number, starting at 1") int page,
            @RequestParam(required = false)
            @Parameter(description = "newest, oldest, large, small, alphabet or created") String sort) {
        log.debug("Fetching novels page={}, sort={}", page, sort);
        return novelService.getNovels(page, sort);
    }

    @GetMapping("/search")
    @Operation(summary = "Search novels", description = "Fuzzy search over titles and authors, top 20 results")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Search completed"),
            @ApiResponse(responseCode = "400", description = "Query missing or too long")
    })
    public Mono<NovelSearchResponse> search(
            @RequestParam("q")
            @Size(max = 50, message = "error.search_query_too_long")
            @Parameter(description = "Search query") String query) {
        return novelService.searchNovels(query)
                .map(novels -> new NovelSearchResponse(novels, query));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get novel by id")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Novel found"),
            @ApiResponse(responseCode = "404", description = "Novel not found")
    })
    public Mono<NovelResponse> getNovel(
            @PathVariable @Size(max = 20) @Parameter(description = "Novel id") String id) {
        return novelService.getNovel(id);
    }

    @GetMapping("/{id}/chapters")
    @Operation(summary = "List chapters of a novel", description = "Chapter summaries ordered by chapter number")
    public Mono<ChaptersListResponse> getChapters(
            @PathVariable @Size(max = 20) @Parameter(description = "Novel id") String id) {
        return chapterService.getChapters(id);
    }
}
