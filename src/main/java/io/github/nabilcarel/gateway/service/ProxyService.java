package io.github.nabilcarel.gateway.service;

import io.github.nabilcarel.gateway.model.ProxyRequest;
import io.github.nabilcarel.gateway.model.cache.CachedResponse;
import reactor.core.publisher.Mono;

public interface ProxyService {
    Mono<CachedResponse> forward(ProxyRequest request);
}
