package dev.kappalib.controller;

import dev.kappalib.dto.CommentRequest;
import dev.kappalib.dto.CommentResponse;
import dev.kappalib.dto.CommentsPage;
import dev.kappalib.service.CommentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/chapters/{chapterId}/comments")
@RequiredArgsConstructor
@Validated
@Tag(name = "Comments", description = "Chapter comments")
@Slf4j
public class CommentController {

    private final CommentService commentService;

    @GetMapping
    @Operation(summary = "Get approved comments for chapter", description = "Returns a page of 12 approved comments, newest first")
    public Mono<CommentsPage> getComments(
            @PathVariable @Size(max = 20) @Parameter(description = "Chapter id") String chapterId,
            @RequestParam(defaultValue = "1") @Min(1) @Max(9999) @Parameter(description = "Page number") int page) {
        log.debug("Fetching comments for chapter={}, page={}", chapterId, page);
        return commentService.listApproved(chapterId, page);
    }

    @PostMapping
    @Operation(summary = "Create a comment", description = "Stores the comment as pending and sends it to moderation")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Comment accepted for moderation"),
            @ApiResponse(responseCode = "400", description = "Invalid content or captcha"),
            @ApiResponse(responseCode = "403", description = "Invalid profile credentials"),
            @ApiResponse(responseCode = "404", description = "Chapter not found"),
            @ApiResponse(responseCode = "429", description = "Comment cooldown active")
    })
    public Mono<CommentResponse> createComment(
            @PathVariable @Size(max = 20) @Parameter(description = "Chapter id") String chapterId,
            @RequestHeader(value = ProfileController.PROFILE_ID_HEADER, required = false) String profileId,
            @RequestHeader(value = ProfileController.SECRET_TOKEN_HEADER, required = false) String secretToken,
            @Valid @RequestBody CommentRequest request) {
        log.info("Creating comment for chapter={}", chapterId);
        return commentService.create(profileId, secretToken, chapterId, request);
    }
}
