package dev.kappalib.service.moderation;

import dev.kappalib.config.ResilienceConfig;
import dev.kappalib.dto.TelegramUpdate;
import dev.kappalib.metrics.KappalibMetrics;
import dev.kappalib.repository.CommentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Applies approve/reject decisions coming back from the moderation chat.
 * Anything that is not a well-formed decision is ignored, and chat API failures
 * after the status change are only logged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModerationService {

    static final String ALREADY_MODERATED_TEXT = "Комментарий уже обработан";

    private final CommentRepository commentRepository;
    private final TelegramClient telegramClient;
    private final ResilienceConfig resilience;
    private final KappalibMetrics metrics;

    public Mono<Void> handleCallback(TelegramUpdate update) {
        if (update == null || update.callbackQuery() == null || update.callbackQuery().message() == null) {
            return Mono.empty();
        }
        TelegramUpdate.CallbackQuery callback = update.callbackQuery();
        String data = callback.data() == null ? "" : callback.data();
        String[] parts = data.split(":", 2);
        if (parts.length != 2) {
            log.debug("Ignoring callback with malformed data");
            return Mono.empty();
        }

        Optional<ModerationAction> action = ModerationAction.fromKey(parts[0]);
        if (action.isEmpty()) {
            log.debug("Ignoring unknown moderation action '{}'", parts[0]);
            return Mono.empty();
        }
        return apply(action.get(), parts[1], callback);
    }

    private Mono<Void> apply(ModerationAction action, String commentId, TelegramUpdate.CallbackQuery callback) {
        String status = action.targetStatus().dbValue();
        TelegramUpdate.Message message = callback.message();

        return commentRepository.updateStatus(commentId, status)
                .timeout(resilience.getDatabaseTimeout())
                .flatMap(updated -> {
                    if (updated == 0) {
                        // Decisions are final: a repeated or late press never flips the status
                        log.warn("Comment {} is already moderated or does not exist", commentId);
                        return answer(callback, ALREADY_MODERATED_TEXT);
                    }
                    log.info("Comment {} status updated to {}", commentId, status);
                    metrics.incrementCommentModerated(status);
                    return editAndAnswer(action, message, callback);
                })
                .onErrorResume(ex -> {
                    log.error("Failed to update comment {} via webhook: {}", commentId, ex.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<Void> editAndAnswer(ModerationAction action, TelegramUpdate.Message message,
                                     TelegramUpdate.CallbackQuery callback) {
        String chatId = message.chat() != null ? String.valueOf(message.chat().id()) : telegramClient.getChatId();
        String originalText = message.text() == null ? "" : message.text();
        String newText = originalText + "\n\n" + action.statusText();

        Mono<Void> edit = telegramClient.editMessageText(chatId, message.messageId(), newText)
                .onErrorResume(ex -> {
                    log.error("Failed to edit moderation message {}: {}", message.messageId(), ex.getMessage());
                    return Mono.empty();
                });
        return edit.then(answer(callback, action.statusText()));
    }

    private Mono<Void> answer(TelegramUpdate.CallbackQuery callback, String text) {
        return telegramClient.answerCallbackQuery(callback.id(), text)
                .onErrorResume(ex -> {
                    log.error("Failed to answer callback query: {}", ex.getMessage());
                    return Mono.empty();
                });
    }
}
