package io.github.nabilcarel.gateway.model.composite;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One backend call inside a composite definition.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class CompositeStep {
    private String name;

    /**
     * Name of the endpoint this step calls.
     */
    private String endpoint;

    @Builder.Default
    private String method = "POST";

    /**
     * Single predecessor step.
     */
    @Setter(AccessLevel.NONE)
    private String dependsOn;

    /**
     * Every name given for dependsOn when it was written as a list.
     * More than one entry makes the definition invalid.
     */
    @JsonIgnore
    @Builder.Default
    private List<String> declaredDependencies = new ArrayList<>();

    @JsonProperty("isArray")
    private boolean array;

    private String arrayProperty;

    private String sourceProperty;

    @Builder.Default
    private Map<String, String> templateTransformations = new LinkedHashMap<>();

    @JsonSetter("dependsOn")
    public void readDependsOn(JsonNode node) {
        declaredDependencies = new ArrayList<>();
        if (node == null || node.isNull()) {
            dependsOn = null;
        } else if (node.isArray()) {
            node.forEach(element -> declaredDependencies.add(element.asText()));
            dependsOn = declaredDependencies.isEmpty() ? null : declaredDependencies.get(0);
        } else {
            dependsOn = node.asText();
            declaredDependencies.add(dependsOn);
        }
    }

    public Map<String, String> getTemplateTransformations() {
        return templateTransformations == null ? Collections.emptyMap() : templateTransformations;
    }
}
