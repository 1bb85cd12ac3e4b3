package io.github.nabilcarel.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.nabilcarel.gateway.cache.RedisCacheStore;
import io.github.nabilcarel.gateway.model.cache.CacheEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RBucketReactive;
import org.redisson.api.RKeysReactive;
import org.redisson.api.RedissonReactiveClient;
import org.redisson.client.codec.Codec;
import org.redisson.client.codec.StringCodec;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisCacheStoreTest {

    @Mock
    private RedissonReactiveClient client;

    @Mock
    private RBucketReactive<String> bucket;

    @Mock
    private RKeysReactive keys;

    private final ObjectMapper mapper = new ObjectMapper();
    private RedisCacheStore store;

    @BeforeEach
    void setUp() {
        store = new RedisCacheStore(client, mapper, "gateway:");
    }

    private static CacheEntry entry() {
        return CacheEntry.builder()
                .statusCode(200)
                .contentType("application/json")
                .headers(Map.of("ETag", "\"v1\""))
                .body("{\"a\":1}".getBytes(StandardCharsets.UTF_8))
                .build();
    }

    @Test
    void testSet_storesJsonWithTtl() throws Exception {
        when(client.<String>getBucket(anyString(), any(Codec.class))).thenReturn(bucket);
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        when(bucket.set(json.capture(), anyLong(), any(TimeUnit.class))).thenReturn(Mono.empty());

        store.set("proxy:prod:Customers::", entry(), Duration.ofSeconds(60)).block();

        verify(client).getBucket("gateway:cache:proxy:prod:Customers::", StringCodec.INSTANCE);
        verify(bucket).set(anyString(), eq(60_000L), eq(TimeUnit.MILLISECONDS));
        CacheEntry written = mapper.readValue(json.getValue(), CacheEntry.class);
        assertThat(written.getStatusCode()).isEqualTo(200);
        assertThat(written.getHeaders()).containsEntry("ETag", "\"v1\"");
    }

    @Test
    void testGet_readsJson() throws Exception {
        when(client.<String>getBucket(anyString(), any(Codec.class))).thenReturn(bucket);
        when(bucket.get()).thenReturn(Mono.just(mapper.writeValueAsString(entry())));

        CacheEntry cached = store.get("k").block();

        assertThat(cached).isNotNull();
        assertThat(new String(cached.getBody(), StandardCharsets.UTF_8)).isEqualTo("{\"a\":1}");
        assertThat(cached.getContentType()).isEqualTo("application/json");
    }

    @Test
    void testGet_missCompletesEmpty() {
        when(client.<String>getBucket(anyString(), any(Codec.class))).thenReturn(bucket);
        when(bucket.get()).thenReturn(Mono.empty());

        assertThat(store.get("k").block()).isNull();
    }

    @Test
    void testGet_corruptEntryFails() {
        when(client.<String>getBucket(anyString(), any(Codec.class))).thenReturn(bucket);
        when(bucket.get()).thenReturn(Mono.just("not json"));

        assertThatThrownBy(() -> store.get("k").block()).isNotNull();
    }

    @Test
    void testClear_deletesPrefixedCacheKeysOnly() {
        when(client.getKeys()).thenReturn(keys);
        when(keys.deleteByPattern("gateway:cache:*")).thenReturn(Mono.just(3L));

        store.clear().block();

        verify(keys).deleteByPattern("gateway:cache:*");
        assertThat(store.getProviderName()).isEqualTo("redis");
    }
}
