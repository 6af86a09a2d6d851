package dev.kappalib.entity;

import java.util.Locale;

/**
 * Moderation state of a comment. Stored lowercase in {@code comments.status}.
 */
public enum CommentStatus {
    PENDING,
    APPROVED,
    REJECTED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
