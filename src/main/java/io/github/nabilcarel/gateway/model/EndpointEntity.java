package io.github.nabilcarel.gateway.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.nabilcarel.gateway.model.composite.CompositeDefinition;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk shape of an endpoint's {@code entity.json}. Property names are matched case-insensitively.
 */
@Getter
@Setter
@NoArgsConstructor
public class EndpointEntity {
    private String url;
    private List<String> methods = new ArrayList<>();
    private EndpointType type;

    @JsonProperty("isPrivate")
    private boolean privateEndpoint;

    private List<String> allowedEnvironments = new ArrayList<>();
    private CompositeDefinition compositeConfig;
    private Long cacheDurationSeconds;
}
