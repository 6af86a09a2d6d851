package dev.kappalib.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Adds a public Cache-Control header to successful GET responses of the read API.
 * Profile responses carry per-user data and are never marked cacheable.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@Slf4j
public class HttpCacheFilter implements WebFilter {

    private static final String API_PREFIX = "/api";
    private static final String PROFILE_PREFIX = "/api/profile";

    private final boolean enabled;
    private final String cacheControl;

    public HttpCacheFilter(@Value("${app.http-cache.enabled:true}") boolean enabled,
                           @Value("${app.http-cache.max-age-seconds:300}") int maxAgeSeconds) {
        this.enabled = enabled;
        this.cacheControl = "public, max-age=" + maxAgeSeconds;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!enabled || !HttpMethod.GET.equals(exchange.getRequest().getMethod())) {
            return chain.filter(exchange);
        }

        String path = exchange.getRequest().getPath().value();
        if (!isCacheable(path)) {
            return chain.filter(exchange);
        }

        // Headers must be set before the body is flushed, doOnSuccess would be too late
        exchange.getResponse().beforeCommit(() -> {
            addCacheHeaders(exchange);
            return Mono.empty();
        });
        return chain.filter(exchange);
    }

    static boolean isCacheable(String path) {
        boolean api = path.equals(API_PREFIX) || path.startsWith(API_PREFIX + "/");
        boolean profile = path.equals(PROFILE_PREFIX) || path.startsWith(PROFILE_PREFIX + "/");
        return api && !profile;
    }

    private void addCacheHeaders(ServerWebExchange exchange) {
        HttpStatusCode status = exchange.getResponse().getStatusCode();
        if (status != null && !status.is2xxSuccessful()) {
            return;
        }
        try {
            HttpHeaders headers = exchange.getResponse().getHeaders();
            if (!headers.containsKey(HttpHeaders.CACHE_CONTROL)) {
                headers.setCacheControl(cacheControl);
            }
        } catch (UnsupportedOperationException e) {
            log.trace("Could not add cache headers, response already committed");
        }
    }
}
