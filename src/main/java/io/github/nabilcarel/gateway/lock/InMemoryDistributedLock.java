package io.github.nabilcarel.gateway.lock;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.LongSupplier;

/**
 * Lease table for a single gateway instance.
 */
public class InMemoryDistributedLock extends PollingDistributedLock {

    private final ConcurrentMap<String, Lease> leases = new ConcurrentHashMap<>();
    private final LongSupplier nanoClock;

    public InMemoryDistributedLock() {
        this(System::nanoTime);
    }

    public InMemoryDistributedLock(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
    }

    @Override
    protected Mono<Boolean> attempt(String key, String token, Duration leaseTime) {
        return Mono.fromSupplier(() -> {
            long now = nanoClock.getAsLong();
            Lease candidate = new Lease(token, now + leaseTime.toNanos());
            Lease holder = leases.compute(key, (k, existing) ->
                    existing == null || existing.isExpired(now) ? candidate : existing);
            return holder == candidate;
        });
    }

    @Override
    protected Mono<Boolean> release(String key, String token) {
        return Mono.fromSupplier(() -> {
            boolean[] removed = new boolean[1];
            leases.computeIfPresent(key, (k, lease) -> {
                if (lease.token.equals(token)) {
                    removed[0] = true;
                    return null;
                }
                return lease;
            });
            return removed[0];
        });
    }

    public boolean isHeld(String key) {
        Lease lease = leases.get(key);
        return lease != null && !lease.isExpired(nanoClock.getAsLong());
    }

    private static final class Lease {
        private final String token;
        private final long expiresAt;

        private Lease(String token, long expiresAt) {
            this.token = token;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(long now) {
            return now - expiresAt >= 0;
        }
    }
}
