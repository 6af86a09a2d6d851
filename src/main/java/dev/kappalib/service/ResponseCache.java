package dev.kappalib.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Process-local read cache for catalog responses. Every entry carries its own TTL.
 * <p>
 * Loader errors and empty results are not cached. Two concurrent misses on the same
 * key may both run the loader; the last write wins.
 * </p>
 */
@Service
@Slf4j
public class ResponseCache {

    private final Cache<String, CachedValue> cache;

    @Autowired
    public ResponseCache(@Value("${app.cache.max-entries:10000}") long maxEntries) {
        this(maxEntries, Ticker.systemTicker());
    }

    ResponseCache(long maxEntries, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new PerEntryExpiry())
                .ticker(ticker)
                .build();
    }

    /**
     * Return the cached value for {@code key}, or subscribe to {@code loader} and cache its
     * value for {@code ttl}.
     */
    @SuppressWarnings("unchecked")
    public <T> Mono<T> getOrFetch(String key, Duration ttl, Supplier<Mono<T>> loader) {
        return Mono.defer(() -> {
            CachedValue cached = cache.getIfPresent(key);
            if (cached != null) {
                log.trace("Cache hit for key: {}", key);
                return Mono.just((T) cached.value());
            }
            log.trace("Cache miss for key: {}", key);
            return loader.get()
                    .doOnNext(value -> cache.put(key, new CachedValue(value, ttl)));
        });
    }

    public void invalidate(String key) {
        cache.invalidate(key);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private record CachedValue(Object value, Duration ttl) {
    }

    private static final class PerEntryExpiry implements Expiry<String, CachedValue> {

        @Override
        public long expireAfterCreate(String key, CachedValue value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CachedValue value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, CachedValue value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
