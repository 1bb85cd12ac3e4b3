package io.github.nabilcarel.gateway.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.nabilcarel.gateway.model.cache.CacheEntry;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBucketReactive;
import org.redisson.api.RedissonReactiveClient;
import org.redisson.client.codec.StringCodec;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Store shared by every gateway instance. Entries are kept as JSON strings under
 * {@code <prefix>cache:<key>} with a Redis-side expiry.
 */
@Slf4j
public class RedisCacheStore implements CacheStore {

    private final RedissonReactiveClient client;
    private final ObjectMapper mapper;
    private final String keyPrefix;

    public RedisCacheStore(RedissonReactiveClient client, ObjectMapper mapper, String keyPrefix) {
        this.client = client;
        this.mapper = mapper;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    @Override
    public Mono<CacheEntry> get(String key) {
        return bucket(key).get()
                .flatMap(json -> Mono.fromCallable(() -> mapper.readValue(json, CacheEntry.class)));
    }

    @Override
    public Mono<Void> set(String key, CacheEntry entry, Duration ttl) {
        return Mono.fromCallable(() -> mapper.writeValueAsString(entry))
                .flatMap(json -> bucket(key).set(json, ttl.toMillis(), TimeUnit.MILLISECONDS))
                .doOnSuccess(ignored -> log.debug("Cached {} in Redis for {}", key, ttl));
    }

    @Override
    public Mono<Boolean> remove(String key) {
        return bucket(key).delete();
    }

    @Override
    public Mono<Void> clear() {
        return client.getKeys().deleteByPattern(keyPrefix + "cache:*")
                .doOnNext(count -> log.info("Removed {} cached responses from Redis", count))
                .then();
    }

    @Override
    public String getProviderName() {
        return "redis";
    }

    private RBucketReactive<String> bucket(String key) {
        return client.getBucket(keyPrefix + "cache:" + key, StringCodec.INSTANCE);
    }
}
