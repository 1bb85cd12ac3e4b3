package io.github.nabilcarel.gateway.lock;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lease-based lock acquired by repeated set-if-absent attempts. Each acquisition carries
 * a random token so that only its holder can release it.
 */
@Slf4j
public abstract class PollingDistributedLock implements DistributedLock {

    @Override
    public Mono<LockHandle> tryAcquire(String key, Duration leaseTime, Duration maxWait, Duration pollInterval) {
        return Mono.defer(() -> {
            String token = UUID.randomUUID().toString();
            long deadline = System.nanoTime() + maxWait.toNanos();
            return Mono.defer(() -> attempt(key, token, leaseTime))
                    .filter(Boolean::booleanValue)
                    .repeatWhenEmpty(attempts -> attempts
                            .takeWhile(i -> System.nanoTime() < deadline)
                            .concatMap(i -> Mono.delay(pollInterval)))
                    .map(acquired -> (LockHandle) new LeaseHandle(key, token))
                    .doOnNext(handle -> log.debug("Acquired lock {}", key));
        });
    }

    /**
     * Sets {@code key} to {@code token} if nobody holds it.
     */
    protected abstract Mono<Boolean> attempt(String key, String token, Duration leaseTime);

    /**
     * Removes {@code key} if it still holds {@code token}.
     */
    protected abstract Mono<Boolean> release(String key, String token);

    private final class LeaseHandle implements LockHandle {
        private final String key;
        private final String token;
        private final AtomicBoolean released = new AtomicBoolean();

        private LeaseHandle(String key, String token) {
            this.key = key;
            this.token = token;
        }

        @Override
        public String getKey() {
            return key;
        }

        @Override
        public Mono<Void> release() {
            return Mono.defer(() -> {
                if (!released.compareAndSet(false, true)) {
                    return Mono.empty();
                }
                return PollingDistributedLock.this.release(key, token)
                        .doOnNext(removed -> {
                            if (!removed) {
                                log.warn("Lock {} expired before it was released", key);
                            }
                        })
                        .onErrorResume(ex -> {
                            log.warn("Failed to release lock {}: {}", key, ex.getMessage());
                            return Mono.empty();
                        })
                        .then();
            });
        }
    }
}
