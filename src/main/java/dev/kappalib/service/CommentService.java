package dev.kappalib.service;

import dev.kappalib.config.ResilienceConfig;
import dev.kappalib.dto.CommentRequest;
import dev.kappalib.dto.CommentResponse;
import dev.kappalib.dto.CommentsPage;
import dev.kappalib.entity.Comment;
import dev.kappalib.entity.CommentStatus;
import dev.kappalib.entity.Profile;
import dev.kappalib.exception.DuplicateResourceException;
import dev.kappalib.exception.RateLimitedException;
import dev.kappalib.exception.ResourceNotFoundException;
import dev.kappalib.metrics.KappalibMetrics;
import dev.kappalib.repository.CommentQueryRepository;
import dev.kappalib.repository.CommentRepository;
import dev.kappalib.repository.ProfileRepository;
import dev.kappalib.service.moderation.ModerationDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Comment submission and the public read side. New comments are stored as pending and
 * become visible only after a moderator approves them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommentService {

    public static final int PAGE_SIZE = 12;
    public static final int MAX_CONTENT_LENGTH = 1000;
    static final int MAX_INSERT_ATTEMPTS = 5;

    private final CommentRepository commentRepository;
    private final CommentQueryRepository commentQueryRepository;
    private final ProfileRepository profileRepository;
    private final ProfileService profileService;
    private final SecretGenerator secretGenerator;
    private final ChapterService chapterService;
    private final TurnstileService turnstileService;
    private final MarkdownService markdownService;
    private final HtmlSanitizerService htmlSanitizerService;
    private final CommentCooldown commentCooldown;
    private final ModerationDispatcher moderationDispatcher;
    private final ResilienceConfig resilience;
    private final KappalibMetrics metrics;
    private final Clock clock;

    /**
     * Validate, render and store a comment, then hand it to moderation.
     * Checks run in a fixed order: content length, author cooldown, captcha,
     * chapter existence, credentials.
     */
    public Mono<CommentResponse> create(String profileId, String secretToken, String chapterId, CommentRequest request) {
        String content = request.getContent();
        int length = content == null ? 0 : content.codePointCount(0, content.length());
        if (length == 0 || length > MAX_CONTENT_LENGTH || content.isBlank()) {
            return Mono.error(new IllegalArgumentException("error.comment_length"));
        }

        CommentCooldown.Reservation slot = commentCooldown.tryReserve(profileId);
        if (!slot.granted()) {
            Duration wait = slot.retryAfter();
            log.debug("Comment cooldown active for {} ({} ms left)", profileId, wait.toMillis());
            return Mono.error(new RateLimitedException("error.comment_cooldown", wait));
        }

        return turnstileService.verify(request.getTurnstileToken(), TurnstileService.Scope.COMMENTS)
                .then(Mono.defer(() -> chapterService.exists(chapterId)))
                .flatMap(exists -> exists
                        ? profileService.authenticate(profileId, secretToken)
                        : Mono.<Void>error(new ResourceNotFoundException("Chapter", "id", chapterId)))
                .then(Mono.fromCallable(() -> renderNonEmpty(content)))
                .flatMap(html -> insertPending(profileId, chapterId, html))
                // Nothing was stored, so the author may retry at once
                .doOnError(ex -> commentCooldown.release(slot))
                .flatMap(this::withAuthor)
                .doOnNext(comment -> {
                    metrics.incrementCommentCreated();
                    log.info("Comment created: {} by user {}", comment.getId(), profileId);
                    moderationDispatcher.submit(comment);
                });
    }

    private String renderNonEmpty(String markdown) {
        String html = render(markdown);
        if (html.isEmpty()) {
            throw new IllegalArgumentException("error.comment_length");
        }
        return html;
    }

    String render(String markdown) {
        return htmlSanitizerService.sanitizeComment(markdownService.renderToHtml(markdown)).trim();
    }

    private Mono<Comment> insertPending(String profileId, String chapterId, String html) {
        return Mono.defer(() -> commentRepository.save(Comment.builder()
                        .id(secretGenerator.newId(SecretGenerator.COMMENT_ID_PREFIX))
                        .chapterId(chapterId)
                        .userId(profileId)
                        .contentHtml(html)
                        .status(CommentStatus.PENDING.dbValue())
                        .createdAt(now())
                        .build()))
                .timeout(resilience.getDatabaseTimeout())
                .retryWhen(Retry.max(MAX_INSERT_ATTEMPTS - 1).filter(DuplicateKeyException.class::isInstance))
                .onErrorMap(Exceptions::isRetryExhausted,
                        ex -> new DuplicateResourceException("Could not allocate a unique comment id"))
                .doOnError(ex -> log.error("Failed to create comment on chapter {}: {}", chapterId, ex.getMessage()));
    }

    private Mono<CommentResponse> withAuthor(Comment comment) {
        return profileRepository.findById(comment.getUserId())
                .timeout(resilience.getDatabaseTimeout())
                .map(author -> toResponse(comment, author))
                .defaultIfEmpty(toResponse(comment, null));
    }

    private static CommentResponse toResponse(Comment comment, Profile author) {
        return CommentResponse.builder()
                .id(comment.getId())
                .chapterId(comment.getChapterId())
                .userId(comment.getUserId())
                .contentHtml(comment.getContentHtml())
                .status(comment.getStatus())
                .createdAt(comment.getCreatedAt())
                .userDisplayName(author != null ? author.getDisplayName() : null)
                .userAvatarSeed(author != null ? author.getAvatarSeed() : null)
                .userHasCustomAvatar(author != null ? author.isHasCustomAvatar() : null)
                .build();
    }

    /**
     * Approved comments of a chapter, newest first, twelve per page.
     */
    public Mono<CommentsPage> listApproved(String chapterId, int page) {
        int offset = (page - 1) * PAGE_SIZE;
        return commentRepository.countApprovedByChapterId(chapterId)
                .flatMap(total -> {
                    if (total == 0) {
                        return Mono.just(CommentsPage.empty(page, PAGE_SIZE));
                    }
                    return commentQueryRepository.findApprovedWithAuthor(chapterId, PAGE_SIZE, offset)
                            .collectList()
                            .map(comments -> CommentsPage.of(comments, page, PAGE_SIZE, total));
                })
                .timeout(resilience.getDatabaseTimeout())
                .doOnError(ex -> log.error("Failed to fetch comments for chapter {}: {}", chapterId, ex.getMessage()));
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
    }
}
