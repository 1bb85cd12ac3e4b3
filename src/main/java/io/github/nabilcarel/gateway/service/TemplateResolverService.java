package io.github.nabilcarel.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.nabilcarel.gateway.model.composite.CompositeStep;
import io.github.nabilcarel.gateway.model.context.ExecutionContext;

public interface TemplateResolverService {

    /**
     * Evaluates one transformation expression for {@code stepName}.
     */
    JsonNode resolve(String expression, String stepName, ExecutionContext context);

    /**
     * Writes every template transformation of {@code step} into {@code target}.
     */
    void applyTransformations(ObjectNode target, CompositeStep step, ExecutionContext context);
}
