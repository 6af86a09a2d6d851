package dev.kappalib.repository;

import dev.kappalib.entity.Comment;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface CommentRepository extends ReactiveCrudRepository<Comment, String> {

    @Query("SELECT COUNT(*) FROM comments WHERE chapter_id = :chapterId AND status = 'approved'")
    Mono<Long> countApprovedByChapterId(String chapterId);

    @Query("SELECT COUNT(*) FROM comments WHERE status = :status")
    Mono<Long> countByStatus(String status);

    /**
     * Moves a pending comment to its final status. Approved and rejected comments are left alone,
     * so the result is 0 for those as well as for unknown ids.
     */
    @Modifying
    @Query("UPDATE comments SET status = :status WHERE id = :id AND status = 'pending'")
    Mono<Integer> updateStatus(String id, String status);

    @Modifying
    @Query("UPDATE comments SET telegram_message_id = :messageId WHERE id = :id")
    Mono<Integer> updateTelegramMessageId(String id, long messageId);
}
