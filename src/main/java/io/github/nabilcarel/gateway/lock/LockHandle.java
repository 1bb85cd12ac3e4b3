package io.github.nabilcarel.gateway.lock;

import reactor.core.publisher.Mono;

/**
 * An exclusively held lease. {@link #release()} takes effect once; later calls complete without effect.
 */
public interface LockHandle {

    String getKey();

    Mono<Void> release();
}
