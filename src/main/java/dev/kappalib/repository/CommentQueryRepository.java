package dev.kappalib.repository;

import dev.kappalib.dto.CommentResponse;
import io.r2dbc.spi.Row;
import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.OffsetDateTime;

/**
 * Comment reads joined with their author's public profile fields.
 */
@Repository
@RequiredArgsConstructor
public class CommentQueryRepository {

    private final R2dbcEntityTemplate r2dbcTemplate;

    private static final String FIND_APPROVED_WITH_AUTHOR =
            "SELECT c.id, c.chapter_id, c.user_id, c.content_html, c.status, c.created_at, " +
            "u.display_name, u.avatar_seed, u.has_custom_avatar " +
            "FROM comments c JOIN users u ON c.user_id = u.id " +
            "WHERE c.chapter_id = :chapterId AND c.status = 'approved' " +
            "ORDER BY c.created_at DESC LIMIT :limit OFFSET :offset";

    public Flux<CommentResponse> findApprovedWithAuthor(String chapterId, int limit, int offset) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(FIND_APPROVED_WITH_AUTHOR)
                .bind("chapterId", chapterId)
                .bind("limit", limit)
                .bind("offset", offset)
                .map((row, meta) -> mapRow(row))
                .all();
    }

    private static CommentResponse mapRow(Row row) {
        return CommentResponse.builder()
                .id(row.get("id", String.class))
                .chapterId(row.get("chapter_id", String.class))
                .userId(row.get("user_id", String.class))
                .contentHtml(row.get("content_html", String.class))
                .status(row.get("status", String.class))
                .createdAt(row.get("created_at", OffsetDateTime.class))
                .userDisplayName(row.get("display_name", String.class))
                .userAvatarSeed(row.get("avatar_seed", String.class))
                .userHasCustomAvatar(row.get("has_custom_avatar", Boolean.class))
                .build();
    }
}
