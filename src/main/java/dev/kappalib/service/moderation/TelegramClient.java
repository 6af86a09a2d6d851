package dev.kappalib.service.moderation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.kappalib.config.ResilienceConfig;
import dev.kappalib.exception.UpstreamServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Minimal Telegram Bot API client for the moderation chat.
 * The bot token is part of the request path, so request URLs are never logged.
 */
@Component
@Slf4j
public class TelegramClient {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final WebClient webClient;
    private final String botToken;
    private final String chatId;
    private final String webhookSecret;
    private final Duration timeout;

    public TelegramClient(
            WebClient.Builder webClientBuilder,
            ResilienceConfig resilienceConfig,
            @Value("${app.telegram.api-url:https://api.telegram.org}") String apiUrl,
            @Value("${app.telegram.bot-token:}") String botToken,
            @Value("${app.telegram.chat-id:}") String chatId,
            @Value("${app.telegram.webhook-secret:}") String webhookSecret) {
        this.webClient = webClientBuilder.clone().baseUrl(apiUrl).build();
        this.botToken = botToken;
        this.chatId = chatId;
        this.webhookSecret = webhookSecret;
        this.timeout = resilienceConfig.getTelegramTimeout();
        log.info("Telegram client initialised (configured={}, webhookSecret={})",
                isConfigured(), !webhookSecret.isBlank());
    }

    public boolean isConfigured() {
        return !botToken.isBlank() && !chatId.isBlank();
    }

    public String getChatId() {
        return chatId;
    }

    public String getWebhookSecret() {
        return webhookSecret;
    }

    /**
     * Post an HTML message with an inline keyboard to the moderation chat.
     *
     * @return the message id, or empty when Telegram answered {@code ok=false}
     */
    public Mono<Long> sendMessage(String text, Map<String, Object> replyMarkup) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("chat_id", chatId);
        form.add("text", text);
        form.add("parse_mode", "HTML");
        form.add("reply_markup", toJson(replyMarkup));

        return call("sendMessage", form)
                .flatMap(response -> {
                    if (!response.path("ok").asBoolean(false)) {
                        log.warn("Telegram sendMessage rejected: {}", response.path("description").asText(""));
                        return Mono.empty();
                    }
                    return Mono.just(response.path("result").path("message_id").asLong());
                });
    }

    public Mono<Void> editMessageText(String targetChatId, long messageId, String text) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("chat_id", targetChatId);
        form.add("message_id", String.valueOf(messageId));
        form.add("text", text);
        return call("editMessageText", form).then();
    }

    public Mono<Void> answerCallbackQuery(String callbackQueryId, String text) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("callback_query_id", callbackQueryId);
        form.add("text", text);
        return call("answerCallbackQuery", form).then();
    }

    private Mono<JsonNode> call(String method, MultiValueMap<String, String> form) {
        return webClient.post()
                .uri("/bot{token}/{method}", botToken, method)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(form))
                .exchangeToMono(response -> response.bodyToMono(JsonNode.class))
                .timeout(timeout)
                .onErrorMap(ex -> !(ex instanceof UpstreamServiceException),
                        ex -> new UpstreamServiceException("telegram", method + " failed: " + ex.getMessage(), ex));
    }

    private static String toJson(Map<String, Object> value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize reply markup", e);
        }
    }
}
