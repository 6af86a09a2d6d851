package dev.kappalib.controller;

import dev.kappalib.dto.TelegramUpdate;
import dev.kappalib.exception.ForbiddenException;
import dev.kappalib.service.moderation.ModerationService;
import dev.kappalib.service.moderation.TelegramClient;
import dev.kappalib.util.DigestUtils;
import io.swagger.v3.oas.annotations.Hidden;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Receives moderation button presses from the bot. Always answers 200 once the secret
 * matches, otherwise the chat API keeps redelivering the update.
 */
@Hidden
@RestController
@RequiredArgsConstructor
@Slf4j
public class TelegramWebhookController {

    static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";

    private final ModerationService moderationService;
    private final TelegramClient telegramClient;

    @PostMapping("/api/webhook/telegram")
    public Mono<Void> handleUpdate(
            @RequestHeader(value = SECRET_HEADER, required = false) String secret,
            @RequestBody(required = false) TelegramUpdate update) {
        String expected = telegramClient.getWebhookSecret();
        if (expected != null && !expected.isBlank() && !DigestUtils.constantTimeEquals(expected, secret)) {
            log.warn("Rejected webhook call with invalid secret");
            return Mono.error(new ForbiddenException("error.invalid_webhook_secret"));
        }
        return moderationService.handleCallback(update)
                .onErrorResume(ex -> {
                    log.error("Moderation callback failed: {}", ex.getMessage());
                    return Mono.empty();
                });
    }
}
