package io.github.nabilcarel.gateway.model;

import io.github.nabilcarel.gateway.model.composite.CompositeDefinition;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Set;

/**
 * A named backend exposed by the gateway. Instances are immutable and replaced
 * wholesale when the endpoint directory reloads.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class EndpointDefinition {

    private final String name;

    /**
     * Backend base URL. Blank for composite endpoints.
     */
    private final String url;

    @Builder.Default
    private final Set<String> allowedMethods = Set.of();

    @Builder.Default
    private final EndpointType type = EndpointType.STANDARD;

    private final boolean isPrivate;

    /**
     * Environments this endpoint may be called in. Null or empty means all.
     */
    private final Set<String> allowedEnvironments;

    private final CompositeDefinition compositeConfig;

    /**
     * Endpoint-specific cache TTL, used when the backend sends no max-age.
     */
    private final Duration cacheDuration;

    public boolean isComposite() {
        return type == EndpointType.COMPOSITE && compositeConfig != null;
    }

    public boolean allowsMethod(String method) {
        return method != null && allowedMethods.stream().anyMatch(m -> m.equalsIgnoreCase(method));
    }

    public boolean allowsEnvironment(String environment) {
        if (allowedEnvironments == null || allowedEnvironments.isEmpty()) {
            return true;
        }
        return allowedEnvironments.stream().anyMatch(e -> e.equalsIgnoreCase(environment));
    }
}
