package dev.kappalib.controller;

import dev.kappalib.dto.ChapterResponse;
import dev.kappalib.service.ChapterService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/chapters")
@RequiredArgsConstructor
@Validated
@Tag(name = "Chapters", description = "Chapter reading")
public class ChapterController {

    private final ChapterService chapterService;

    @GetMapping("/{id}")
    @Operation(summary = "Get chapter by id", description = "Full chapter text with optional source attribution")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Chapter found"),
            @ApiResponse(responseCode = "404", description = "Chapter not found")
    })
    public Mono<ChapterResponse> getChapter(
            @PathVariable @Size(max = 20) @Parameter(description = "Chapter id") String id) {
        return chapterService.getChapter(id);
    }
}
