package io.github.nabilcarel.gateway.lock;

import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLockReactive;
import org.redisson.api.RedissonReactiveClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lock shared across gateway instances, backed by a Redisson {@link RLockReactive}.
 * <p>
 * Every acquisition uses its own lock owner id instead of the calling thread, because
 * a reactive pipeline may release the lock on a different thread than the one that
 * took it. Redisson waits for the lock through pub/sub notifications, so the poll
 * interval is not used here.
 */
@Slf4j
public class RedisDistributedLock implements DistributedLock {

    private final RedissonReactiveClient client;
    private final String keyPrefix;

    public RedisDistributedLock(RedissonReactiveClient client, String keyPrefix) {
        this.client = client;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    @Override
    public Mono<LockHandle> tryAcquire(String key, Duration leaseTime, Duration maxWait, Duration pollInterval) {
        return Mono.defer(() -> {
            RLockReactive lock = client.getLock(keyPrefix + key);
            long ownerId = ThreadLocalRandom.current().nextLong();
            return lock.tryLock(maxWait.toMillis(), leaseTime.toMillis(), TimeUnit.MILLISECONDS, ownerId)
                    .filter(Boolean::booleanValue)
                    .map(acquired -> (LockHandle) new RedissonLockHandle(key, lock, ownerId))
                    .doOnNext(handle -> log.debug("Acquired lock {}", key));
        });
    }

    private static final class RedissonLockHandle implements LockHandle {
        private final String key;
        private final RLockReactive lock;
        private final long ownerId;
        private final AtomicBoolean released = new AtomicBoolean();

        private RedissonLockHandle(String key, RLockReactive lock, long ownerId) {
            this.key = key;
            this.lock = lock;
            this.ownerId = ownerId;
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
                // unlock fails with IllegalMonitorStateException once the lease has expired
                return lock.unlock(ownerId)
                        .onErrorResume(ex -> {
                            log.warn("Failed to release lock {}: {}", key, ex.getMessage());
                            return Mono.empty();
                        });
            });
        }
    }
}
