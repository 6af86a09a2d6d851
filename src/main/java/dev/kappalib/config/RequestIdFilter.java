package dev.kappalib.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every exchange with a request id. An id supplied by the reverse proxy in
 * {@code X-Request-ID} is reused when well-formed; otherwise a fresh one is minted.
 * The id is echoed on the response and stored in the Reactor context.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class RequestIdFilter implements WebFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String REQUEST_ID_CONTEXT_KEY = "requestId";

    private static final int MAX_ID_LENGTH = 64;
    private static final Pattern VALID_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_]+$");

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String supplied = exchange.getRequest().getHeaders().getFirst(REQUEST_ID_HEADER);
        String requestId = sanitizeId(supplied);
        if (requestId == null) {
            if (supplied != null && !supplied.isBlank()) {
                log.debug("Ignoring malformed upstream request id");
            }
            requestId = UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        }
        String correlationId = sanitizeId(exchange.getRequest().getHeaders().getFirst(CORRELATION_ID_HEADER));
        if (correlationId == null) {
            correlationId = requestId;
        }

        ServerHttpRequest request = exchange.getRequest().mutate()
                .header(REQUEST_ID_HEADER, requestId)
                .header(CORRELATION_ID_HEADER, correlationId)
                .build();
        ServerWebExchange mutated = exchange.mutate().request(request).build();
        mutated.getResponse().getHeaders().set(REQUEST_ID_HEADER, requestId);
        mutated.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        return chain.filter(mutated)
                .contextWrite(Context.of(
                        REQUEST_ID_CONTEXT_KEY, requestId,
                        "correlationId", correlationId));
    }

    /**
     * Returns null if the value is blank, too long, or contains characters outside [A-Za-z0-9_-].
     */
    static String sanitizeId(String value) {
        if (value == null || value.isBlank()) return null;
        if (value.length() > MAX_ID_LENGTH) return null;
        if (!VALID_ID_PATTERN.matcher(value).matches()) return null;
        return value;
    }
}
