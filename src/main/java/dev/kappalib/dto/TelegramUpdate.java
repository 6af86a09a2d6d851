package dev.kappalib.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The subset of a Telegram bot update the moderation webhook reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TelegramUpdate(CallbackQuery callbackQuery) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CallbackQuery(String id, String data, Message message) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Message(long messageId, String text, Chat chat) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Chat(long id) {
    }
}
