package io.github.nabilcarel.gateway.lock;

import reactor.core.publisher.Mono;

import java.time.Duration;

public interface DistributedLock {

    /**
     * Tries to take the lock, polling every {@code pollInterval} for at most {@code maxWait}.
     * The lease expires by itself after {@code leaseTime} if it is never released.
     *
     * @return the held lock, or an empty Mono when it could not be taken in time
     */
    Mono<LockHandle> tryAcquire(String key, Duration leaseTime, Duration maxWait, Duration pollInterval);
}
