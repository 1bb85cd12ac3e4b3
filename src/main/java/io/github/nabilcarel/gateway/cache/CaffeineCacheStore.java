package io.github.nabilcarel.gateway.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.github.nabilcarel.gateway.model.cache.CacheEntry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * In-process store backed by Caffeine with a TTL per entry.
 */
@Slf4j
public class CaffeineCacheStore implements CacheStore {

    private final Cache<String, TimedEntry> cache;

    public CaffeineCacheStore(long maxEntries) {
        this(maxEntries, Ticker.systemTicker());
    }

    public CaffeineCacheStore(long maxEntries, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new PerEntryExpiry())
                .ticker(ticker)
                .build();
    }

    @Override
    public Mono<CacheEntry> get(String key) {
        return Mono.fromSupplier(() -> {
            TimedEntry timed = cache.getIfPresent(key);
            return timed == null ? null : timed.entry;
        });
    }

    @Override
    public Mono<Void> set(String key, CacheEntry entry, Duration ttl) {
        return Mono.fromRunnable(() -> {
            cache.put(key, new TimedEntry(entry, ttl.toNanos()));
            log.debug("Cached {} for {}", key, ttl);
        });
    }

    @Override
    public Mono<Boolean> remove(String key) {
        return Mono.fromSupplier(() -> cache.asMap().remove(key) != null);
    }

    @Override
    public Mono<Void> clear() {
        return Mono.fromRunnable(cache::invalidateAll);
    }

    @Override
    public String getProviderName() {
        return "memory";
    }

    private static final class TimedEntry {
        private final CacheEntry entry;
        private final long ttlNanos;

        private TimedEntry(CacheEntry entry, long ttlNanos) {
            this.entry = entry;
            this.ttlNanos = ttlNanos;
        }
    }

    private static final class PerEntryExpiry implements Expiry<String, TimedEntry> {
        @Override
        public long expireAfterCreate(String key, TimedEntry value, long currentTime) {
            return value.ttlNanos;
        }

        @Override
        public long expireAfterUpdate(String key, TimedEntry value, long currentTime, long currentDuration) {
            return value.ttlNanos;
        }

        @Override
        public long expireAfterRead(String key, TimedEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
