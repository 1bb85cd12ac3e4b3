package io.github.nabilcarel.gateway;

import io.github.nabilcarel.gateway.cache.CaffeineCacheStore;
import io.github.nabilcarel.gateway.model.cache.CacheEntry;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.*;

class CaffeineCacheStoreTest {

    private final AtomicLong nanos = new AtomicLong();
    private final CaffeineCacheStore store = new CaffeineCacheStore(100, nanos::get);

    private static CacheEntry entry(String body) {
        return CacheEntry.builder()
                .statusCode(200)
                .contentType("application/json")
                .body(body.getBytes(StandardCharsets.UTF_8))
                .build();
    }

    @Test
    void testGet_missCompletesEmpty() {
        assertThat(store.get("absent").block()).isNull();
    }

    @Test
    void testSet_thenGet() {
        store.set("k", entry("{}"), Duration.ofMinutes(1)).block();

        CacheEntry cached = store.get("k").block();

        assertThat(cached).isNotNull();
        assertThat(cached.getStatusCode()).isEqualTo(200);
        assertThat(new String(cached.getBody(), StandardCharsets.UTF_8)).isEqualTo("{}");
    }

    @Test
    void testSet_entriesExpireIndividually() {
        store.set("short", entry("a"), Duration.ofSeconds(10)).block();
        store.set("long", entry("b"), Duration.ofSeconds(60)).block();

        nanos.addAndGet(Duration.ofSeconds(30).toNanos());

        assertThat(store.get("short").block()).isNull();
        assertThat(store.get("long").block()).isNotNull();
    }

    @Test
    void testSet_overwriteResetsTtl() {
        store.set("k", entry("a"), Duration.ofSeconds(10)).block();
        nanos.addAndGet(Duration.ofSeconds(8).toNanos());
        store.set("k", entry("b"), Duration.ofSeconds(10)).block();
        nanos.addAndGet(Duration.ofSeconds(8).toNanos());

        assertThat(new String(store.get("k").block().getBody(), StandardCharsets.UTF_8)).isEqualTo("b");
    }

    @Test
    void testRemove() {
        store.set("k", entry("a"), Duration.ofMinutes(1)).block();

        assertThat(store.remove("k").block()).isTrue();
        assertThat(store.remove("k").block()).isFalse();
        assertThat(store.get("k").block()).isNull();
    }

    @Test
    void testClear() {
        store.set("a", entry("a"), Duration.ofMinutes(1)).block();
        store.set("b", entry("b"), Duration.ofMinutes(1)).block();

        store.clear().block();

        assertThat(store.get("a").block()).isNull();
        assertThat(store.get("b").block()).isNull();
        assertThat(store.getProviderName()).isEqualTo("memory");
    }
}
