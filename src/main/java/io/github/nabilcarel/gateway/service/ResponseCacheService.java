package io.github.nabilcarel.gateway.service;

import io.github.nabilcarel.gateway.model.backend.BackendResponse;
import io.github.nabilcarel.gateway.model.cache.CachedResponse;
import reactor.core.publisher.Mono;

import java.util.function.Supplier;

public interface ResponseCacheService {

    /**
     * Serves {@code cacheKey} from the cache, or computes it once under {@code lockKey}
     * while concurrent callers for the same key wait for the result.
     *
     * @param recompute produces the backend response; subscribed at most once per call
     */
    Mono<CachedResponse> handleCacheableGet(String cacheKey, String lockKey, String endpointName,
                                            Supplier<Mono<BackendResponse>> recompute);

    Mono<Void> clear();
}
