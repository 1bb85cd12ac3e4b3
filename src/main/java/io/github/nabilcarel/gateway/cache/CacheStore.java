package io.github.nabilcarel.gateway.cache;

import io.github.nabilcarel.gateway.model.cache.CacheEntry;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Key/value store for memoized backend responses. {@link #get} completes empty on a miss.
 */
public interface CacheStore {

    Mono<CacheEntry> get(String key);

    Mono<Void> set(String key, CacheEntry entry, Duration ttl);

    Mono<Boolean> remove(String key);

    Mono<Void> clear();

    /**
     * Short provider name reported by the health endpoint.
     */
    String getProviderName();
}
