package dev.kappalib.service.moderation;

import dev.kappalib.entity.CommentStatus;

import java.util.Optional;

/**
 * Inline-button actions of the moderation chat, encoded as {@code action:commentId}.
 */
public enum ModerationAction {

    APPROVE("approve", CommentStatus.APPROVED, "✅ Подтверждено"),
    REJECT("reject", CommentStatus.REJECTED, "❌ Отклонено");

    private final String key;
    private final CommentStatus targetStatus;
    private final String statusText;

    ModerationAction(String key, CommentStatus targetStatus, String statusText) {
        this.key = key;
        this.targetStatus = targetStatus;
        this.statusText = statusText;
    }

    public CommentStatus targetStatus() {
        return targetStatus;
    }

    /** Suffix appended to the moderated message. */
    public String statusText() {
        return statusText;
    }

    public String callbackData(String commentId) {
        return key + ":" + commentId;
    }

    public static Optional<ModerationAction> fromKey(String key) {
        for (ModerationAction action : values()) {
            if (action.key.equals(key)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
