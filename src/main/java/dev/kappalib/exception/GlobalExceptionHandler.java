package dev.kappalib.exception;

import dev.kappalib.config.LocaleConstants;
import dev.kappalib.service.TurnstileService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private static final Pattern PACKAGE_REF = Pattern.compile("([a-z]+\\.)+[A-Z][a-zA-Z0-9]+");
    private static final Pattern SQL_KEYWORDS = Pattern.compile("(?i)(SELECT|INSERT|UPDATE|DELETE|FROM|WHERE|JOIN)\\s+");

    private final MessageSource messageSource;

    @ExceptionHandler(ResourceNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Mono<ErrorResponse> handleResourceNotFound(ResourceNotFoundException ex, ServerWebExchange exchange) {
        log.warn("Resource not found: {} ({}={})", ex.getResource(), ex.getField(), ex.getValue());
        return Mono.just(build(exchange, HttpStatus.NOT_FOUND, "error.not_found", ex.getMessage()));
    }

    @ExceptionHandler(ForbiddenException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Mono<ErrorResponse> handleForbidden(ForbiddenException ex, ServerWebExchange exchange) {
        log.warn("Forbidden: {}", ex.getMessage());
        return Mono.just(build(exchange, HttpStatus.FORBIDDEN, "error.forbidden", ex.getMessage()));
    }

    @ExceptionHandler(RateLimitedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleRateLimited(RateLimitedException ex, ServerWebExchange exchange) {
        log.warn("Rate limited: {}", ex.getMessage());
        return Mono.just(ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(1, ex.getRetryAfter().toSeconds())))
                .body(build(exchange, HttpStatus.TOO_MANY_REQUESTS, "error.rate_limit_exceeded", ex.getMessage())));
    }

    @ExceptionHandler(TurnstileService.TurnstileException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleCaptcha(TurnstileService.TurnstileException ex, ServerWebExchange exchange) {
        log.warn("Captcha verification failed: {}", ex.getMessage());
        return Mono.just(build(exchange, HttpStatus.BAD_REQUEST, "error.captcha_failed", "error.captcha_retry"));
    }

    @ExceptionHandler(UnsupportedImageException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleUnsupportedImage(UnsupportedImageException ex, ServerWebExchange exchange) {
        log.warn("Rejected avatar image: {}", ex.getMessage());
        return Mono.just(build(exchange, HttpStatus.BAD_REQUEST, "error.bad_request", "error.unsupported_image"));
    }

    @ExceptionHandler(UpstreamServiceException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Mono<ErrorResponse> handleUpstream(UpstreamServiceException ex, ServerWebExchange exchange) {
        log.error("Upstream service '{}' failed: {}", ex.getService(), ex.getMessage());
        return Mono.just(build(exchange, HttpStatus.BAD_GATEWAY, "error.bad_gateway", "error.upstream_unavailable"));
    }

    @ExceptionHandler(DuplicateResourceException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Mono<ErrorResponse> handleDuplicateResource(DuplicateResourceException ex, ServerWebExchange exchange) {
        log.error("Duplicate resource: {}", ex.getMessage());
        return Mono.just(build(exchange, HttpStatus.CONFLICT, "error.conflict", "error.try_again"));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleValidationErrors(WebExchangeBindException ex, ServerWebExchange exchange) {
        Locale locale = resolveLocale(exchange);
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toUnmodifiableMap(
                        FieldError::getField,
                        fieldError -> fieldError.getDefaultMessage() != null
                                ? msg(locale, fieldError.getDefaultMessage())
                                : msg(locale, "error.invalid_value"),
                        (existing, duplicate) -> existing
                ));

        log.warn("Validation failed: {}", errors);
        ErrorResponse response = build(exchange, HttpStatus.BAD_REQUEST, "error.validation_failed", "error.invalid_request_data");
        response.setValidationErrors(errors);
        return Mono.just(response);
    }

    @ExceptionHandler(jakarta.validation.ConstraintViolationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleConstraintViolation(
            jakarta.validation.ConstraintViolationException ex, ServerWebExchange exchange) {
        Locale locale = resolveLocale(exchange);
        Map<String, String> errors = new HashMap<>();
        ex.getConstraintViolations().forEach(violation -> {
            String path = violation.getPropertyPath().toString();
            String field = path.contains(".") ? path.substring(path.lastIndexOf('.') + 1) : path;
            errors.put(field, msg(locale, violation.getMessage()));
        });

        log.warn("Constraint violations: {}", errors);
        ErrorResponse response = build(exchange, HttpStatus.BAD_REQUEST, "error.validation_failed", "error.invalid_request_params");
        response.setValidationErrors(errors);
        return Mono.just(response);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex, ServerWebExchange exchange) {
        log.warn("Invalid argument: {}", ex.getMessage());
        Locale locale = resolveLocale(exchange);
        // Services throw i18n keys; anything else is sanitized before it reaches the client
        String translated = msg(locale, ex.getMessage());
        String safeMessage = translated.equals(ex.getMessage())
                ? sanitizeErrorMessage(ex.getMessage(), locale)
                : translated;
        return Mono.just(ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error(msg(locale, "error.bad_request"))
                .message(safeMessage)
                .path(exchange.getRequest().getPath().value())
                .build());
    }

    @ExceptionHandler(ServerWebInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleServerWebInputException(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("Bad request input: {}", ex.getMessage());
        return Mono.just(build(exchange, HttpStatus.BAD_REQUEST, "error.bad_request", "error.invalid_request"));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatusException(
            ResponseStatusException ex, ServerWebExchange exchange) {
        log.warn("Response status exception: {} - {}", ex.getStatusCode(), ex.getReason());
        HttpStatusCode statusCode = ex.getStatusCode();
        HttpStatus status = HttpStatus.resolve(statusCode.value());
        if (status == null) status = HttpStatus.INTERNAL_SERVER_ERROR;
        String errorKey = statusToKey(status);
        String messageKey = ex.getReason() != null ? ex.getReason() : errorKey;
        return Mono.just(ResponseEntity.status(status).body(build(exchange, status, errorKey, messageKey)));
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Mono<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error: ", ex);
        return Mono.just(build(exchange, HttpStatus.INTERNAL_SERVER_ERROR,
                "error.internal_server_error", "error.unexpected_error"));
    }

    private ErrorResponse build(ServerWebExchange exchange, HttpStatus status, String errorKey, String messageKey) {
        Locale locale = resolveLocale(exchange);
        return ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(msg(locale, errorKey))
                .message(msg(locale, messageKey))
                .path(exchange.getRequest().getPath().value())
                .build();
    }

    /**
     * Resolve locale from the Accept-Language header.
     */
    private Locale resolveLocale(ServerWebExchange exchange) {
        String acceptLanguage = exchange.getRequest().getHeaders().getFirst(HttpHeaders.ACCEPT_LANGUAGE);
        if (acceptLanguage != null && !acceptLanguage.isBlank()) {
            try {
                List<Locale.LanguageRange> ranges = Locale.LanguageRange.parse(acceptLanguage);
                Locale matched = Locale.lookup(ranges, LocaleConstants.SUPPORTED_LOCALES);
                if (matched != null) {
                    return matched;
                }
            } catch (IllegalArgumentException e) {
                log.trace("Malformed Accept-Language header: {}", acceptLanguage);
            }
        }
        return LocaleConstants.DEFAULT_LOCALE;
    }

    private String msg(Locale locale, String code, Object... args) {
        return messageSource.getMessage(code, args, code, locale);
    }

    private String sanitizeErrorMessage(String message, Locale locale) {
        if (message == null || message.isBlank()) {
            return msg(locale, "error.invalid_request");
        }
        String sanitized = PACKAGE_REF.matcher(message).replaceAll("[class]");
        sanitized = SQL_KEYWORDS.matcher(sanitized).replaceAll("[query] ");
        if (sanitized.length() > 200) {
            sanitized = sanitized.substring(0, 200) + "...";
        }
        return sanitized;
    }

    private String statusToKey(HttpStatus status) {
        return switch (status) {
            case NOT_FOUND -> "error.not_found";
            case FORBIDDEN -> "error.forbidden";
            case CONFLICT -> "error.conflict";
            case BAD_REQUEST -> "error.bad_request";
            case TOO_MANY_REQUESTS -> "error.rate_limit_exceeded";
            default -> "error.internal_server_error";
        };
    }
}
