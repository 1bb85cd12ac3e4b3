package io.github.nabilcarel.gateway.model.cache;

public enum CacheOutcome {
    /** Served from the cache store. */
    HIT,
    /** Computed by the backend and considered for caching. */
    MISS,
    /** Computed by the backend without touching the cache. */
    BYPASS
}
