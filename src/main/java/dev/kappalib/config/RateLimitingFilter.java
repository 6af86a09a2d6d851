package dev.kappalib.config;

import dev.kappalib.util.DigestUtils;
import dev.kappalib.util.IpAddressExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Per-IP token bucket limiter. API paths and page paths are tracked in separate tables
 * with their own rates. Callers presenting the configured service token are never limited.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 5)
@Slf4j
public class RateLimitingFilter implements WebFilter {

    static final String SERVICE_TOKEN_HEADER = "X-Service-Token";
    static final int MAX_VISITORS = 9999;

    private static final Duration IDLE_EVICTION = Duration.ofMinutes(5);
    private static final Duration FULL_TABLE_EVICTION = Duration.ofMinutes(1);
    private static final byte[] TOO_MANY_REQUESTS_BODY =
            "{\"error\":\"Too many requests\"}".getBytes(StandardCharsets.UTF_8);

    private final VisitorTable apiVisitors;
    private final VisitorTable webVisitors;
    private final String serviceToken;
    private final LongSupplier nanoClock;

    @Autowired
    public RateLimitingFilter(
            @Value("${app.rate-limit.api.per-second:3}") double apiRate,
            @Value("${app.rate-limit.api.burst:9}") int apiBurst,
            @Value("${app.rate-limit.web.per-second:10}") double webRate,
            @Value("${app.rate-limit.web.burst:20}") int webBurst,
            @Value("${app.service-token:}") String serviceToken) {
        this(apiRate, apiBurst, webRate, webBurst, serviceToken, System::nanoTime);
    }

    RateLimitingFilter(double apiRate, int apiBurst, double webRate, int webBurst,
                       String serviceToken, LongSupplier nanoClock) {
        this.apiVisitors = new VisitorTable(apiRate, apiBurst);
        this.webVisitors = new VisitorTable(webRate, webBurst);
        this.serviceToken = serviceToken;
        this.nanoClock = nanoClock;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();

        // Skip rate limiting for actuator health endpoints
        if (path.startsWith("/actuator/health")) {
            return chain.filter(exchange);
        }

        if (hasValidServiceToken(exchange)) {
            return chain.filter(exchange);
        }

        String clientIp = IpAddressExtractor.extractClientIp(exchange);
        VisitorTable table = isApiPath(path) ? apiVisitors : webVisitors;
        if (table.tryAcquire(clientIp, nanoClock.getAsLong())) {
            return chain.filter(exchange);
        }

        log.warn("Rate limit exceeded for IP: {}, path: {}", clientIp, path);
        exchange.getResponse().setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
        HttpHeaders headers = exchange.getResponse().getHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, "1");
        headers.setContentType(MediaType.APPLICATION_JSON);
        DataBuffer buffer = exchange.getResponse().bufferFactory().wrap(TOO_MANY_REQUESTS_BODY);
        return exchange.getResponse().writeWith(Mono.just(buffer));
    }

    /**
     * Drops visitors that have been idle for five minutes.
     */
    @Scheduled(fixedRate = 120_000, initialDelay = 120_000)
    public void cleanupIdleVisitors() {
        long now = nanoClock.getAsLong();
        int removed = apiVisitors.evictIdle(now, IDLE_EVICTION) + webVisitors.evictIdle(now, IDLE_EVICTION);
        if (removed > 0) {
            log.debug("Evicted {} idle rate limit entries", removed);
        }
    }

    int trackedVisitors() {
        return apiVisitors.visitors.size() + webVisitors.visitors.size();
    }

    private boolean hasValidServiceToken(ServerWebExchange exchange) {
        if (serviceToken == null || serviceToken.isBlank()) {
            return false;
        }
        String provided = exchange.getRequest().getHeaders().getFirst(SERVICE_TOKEN_HEADER);
        return DigestUtils.constantTimeEquals(serviceToken, provided);
    }

    private static boolean isApiPath(String path) {
        return path.equals("/api") || path.startsWith("/api/");
    }

    private static final class VisitorTable {

        private final ConcurrentHashMap<String, TokenBucket> visitors = new ConcurrentHashMap<>();
        private final double ratePerSecond;
        private final int burst;
        // Shared by every caller once the table is full
        private final TokenBucket overflow = new TokenBucket(1, 1, 0);

        VisitorTable(double ratePerSecond, int burst) {
            this.ratePerSecond = ratePerSecond;
            this.burst = burst;
        }

        boolean tryAcquire(String ip, long now) {
            TokenBucket bucket = visitors.get(ip);
            if (bucket == null) {
                if (visitors.size() >= MAX_VISITORS) {
                    evictIdle(now, FULL_TABLE_EVICTION);
                    if (visitors.size() >= MAX_VISITORS) {
                        return overflow.tryAcquire(now);
                    }
                }
                bucket = visitors.computeIfAbsent(ip, key -> new TokenBucket(ratePerSecond, burst, now));
            }
            return bucket.tryAcquire(now);
        }

        int evictIdle(long now, Duration idle) {
            int before = visitors.size();
            long idleNanos = idle.toNanos();
            visitors.values().removeIf(bucket -> now - bucket.lastSeen() > idleNanos);
            return before - visitors.size();
        }
    }

    /**
     * Classic token bucket starting full. Refill is computed lazily on each acquire.
     */
    private static final class TokenBucket {

        private final double ratePerNano;
        private final double capacity;
        private double tokens;
        private long lastRefill;
        private volatile long lastSeen;

        TokenBucket(double ratePerSecond, int capacity, long now) {
            this.ratePerNano = ratePerSecond / 1_000_000_000d;
            this.capacity = capacity;
            this.tokens = capacity;
            this.lastRefill = now;
            this.lastSeen = now;
        }

        synchronized boolean tryAcquire(long now) {
            lastSeen = now;
            long elapsed = Math.max(0, now - lastRefill);
            tokens = Math.min(capacity, tokens + elapsed * ratePerNano);
            lastRefill = now;
            if (tokens >= 1) {
                tokens -= 1;
                return true;
            }
            return false;
        }

        long lastSeen() {
            return lastSeen;
        }
    }
}
