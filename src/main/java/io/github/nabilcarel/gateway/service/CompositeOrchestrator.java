package io.github.nabilcarel.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.nabilcarel.gateway.model.composite.CompositeDefinition;
import io.github.nabilcarel.gateway.model.context.RequestMetadata;
import io.github.nabilcarel.gateway.model.response.CompositeResult;
import reactor.core.publisher.Mono;

public interface CompositeOrchestrator {

    /**
     * Runs the steps of {@code definition} one after another against {@code requestBody}.
     * Step failures are reported in the returned result, never as an error signal.
     */
    Mono<CompositeResult> execute(CompositeDefinition definition, JsonNode requestBody, String environment,
                                  RequestMetadata metadata);

    int getActiveExecutions();
}
