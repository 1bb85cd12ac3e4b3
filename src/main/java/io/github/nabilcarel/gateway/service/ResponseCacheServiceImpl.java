package io.github.nabilcarel.gateway.service;

import io.github.nabilcarel.gateway.cache.CacheStore;
import io.github.nabilcarel.gateway.config.GatewayProperties;
import io.github.nabilcarel.gateway.lock.DistributedLock;
import io.github.nabilcarel.gateway.lock.LockHandle;
import io.github.nabilcarel.gateway.model.backend.BackendResponse;
import io.github.nabilcarel.gateway.model.cache.CacheEntry;
import io.github.nabilcarel.gateway.model.cache.CacheOutcome;
import io.github.nabilcarel.gateway.model.cache.CachedResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

@Service
@RequiredArgsConstructor
@Slf4j
public class ResponseCacheServiceImpl implements ResponseCacheService {

    private final CacheStore cacheStore;
    private final DistributedLock distributedLock;
    private final CacheTtlPolicy ttlPolicy;
    private final GatewayProperties properties;

    @Override
    public Mono<CachedResponse> handleCacheableGet(String cacheKey, String lockKey, String endpointName,
                                                   Supplier<Mono<BackendResponse>> recompute) {
        if (!properties.getCache().isEnabled()) {
            return Mono.defer(recompute).map(response -> CachedResponse.of(response, CacheOutcome.BYPASS));
        }
        return lookup(cacheKey)
                .doOnNext(entry -> log.debug("Cache hit for {}", cacheKey))
                .map(CachedResponse::of)
                .switchIfEmpty(Mono.defer(() -> computeUnderLock(cacheKey, lockKey, endpointName, recompute)));
    }

    @Override
    public Mono<Void> clear() {
        return cacheStore.clear().doOnSuccess(ignored -> log.info("Response cache cleared"));
    }

    private Mono<CachedResponse> computeUnderLock(String cacheKey, String lockKey, String endpointName,
                                                  Supplier<Mono<BackendResponse>> recompute) {
        GatewayProperties.Lock lock = properties.getCache().getLock();
        return distributedLock.tryAcquire(lockKey, lock.getLeaseTime(), lock.getMaxWait(), lock.getPollInterval())
                .map(Optional::of)
                .onErrorResume(ex -> {
                    log.warn("Lock backend failed for {}: {}", lockKey, ex.getMessage());
                    return Mono.just(Optional.<LockHandle>empty());
                })
                .defaultIfEmpty(Optional.<LockHandle>empty())
                .flatMap(handle -> {
                    if (handle.isEmpty()) {
                        log.warn("Could not acquire {} within {}, serving uncached", lockKey, lock.getMaxWait());
                        return Mono.defer(recompute)
                                .map(response -> CachedResponse.of(response, CacheOutcome.BYPASS));
                    }
                    return Mono.usingWhen(Mono.just(handle.get()),
                            held -> populate(cacheKey, endpointName, recompute),
                            LockHandle::release);
                });
    }

    private Mono<CachedResponse> populate(String cacheKey, String endpointName,
                                          Supplier<Mono<BackendResponse>> recompute) {
        return lookup(cacheKey)
                .doOnNext(entry -> log.debug("Cache filled for {} while waiting for the lock", cacheKey))
                .map(CachedResponse::of)
                .switchIfEmpty(Mono.defer(recompute)
                        .flatMap(response -> store(cacheKey, endpointName, response)
                                .thenReturn(CachedResponse.of(response, CacheOutcome.MISS))));
    }

    private Mono<Void> store(String cacheKey, String endpointName, BackendResponse response) {
        if (!response.isSuccessful() || !ttlPolicy.isCacheable(response.getContentType())) {
            return Mono.empty();
        }
        Duration ttl = ttlPolicy.resolveTtl(response.getHeaders(), endpointName);
        if (ttl.isZero() || ttl.isNegative()) {
            return Mono.empty();
        }
        return cacheStore.set(cacheKey, CacheEntry.from(response), ttl)
                .onErrorResume(ex -> {
                    log.warn("Cache write failed for {}: {}", cacheKey, ex.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<CacheEntry> lookup(String cacheKey) {
        return cacheStore.get(cacheKey)
                .onErrorResume(ex -> {
                    log.warn("Cache lookup failed for {}: {}", cacheKey, ex.getMessage());
                    return Mono.empty();
                });
    }
}
