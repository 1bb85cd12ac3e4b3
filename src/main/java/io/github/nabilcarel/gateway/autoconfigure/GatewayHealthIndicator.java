package io.github.nabilcarel.gateway.autoconfigure;

import io.github.nabilcarel.gateway.cache.CacheStore;
import io.github.nabilcarel.gateway.config.EndpointDirectory;
import io.github.nabilcarel.gateway.service.CompositeOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnClass(HealthIndicator.class)
@RequiredArgsConstructor
public class GatewayHealthIndicator implements HealthIndicator {
    private final EndpointDirectory endpointDirectory;
    private final CompositeOrchestrator orchestrator;
    private final CacheStore cacheStore;

    @Override
    public Health health() {
        return Health.up()
                .withDetail("availableEndpoints", endpointDirectory.getAvailableEndpoints().size())
                .withDetail("activeCompositeExecutions", orchestrator.getActiveExecutions())
                .withDetail("cacheProvider", cacheStore.getProviderName())
                .build();
    }
}
