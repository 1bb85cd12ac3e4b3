package io.github.nabilcarel.gateway.service;

import io.github.nabilcarel.gateway.model.backend.BackendRequest;
import io.github.nabilcarel.gateway.model.backend.BackendResponse;
import reactor.core.publisher.Mono;

/**
 * Issues one HTTP request to a backend. Any status code is a successful emission;
 * connection failures and timeouts are signalled as
 * {@link io.github.nabilcarel.gateway.exception.BackendTransportException}.
 */
public interface BackendInvoker {
    Mono<BackendResponse> invoke(BackendRequest request);
}
