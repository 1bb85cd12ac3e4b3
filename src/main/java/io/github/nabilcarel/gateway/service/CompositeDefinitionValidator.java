package io.github.nabilcarel.gateway.service;

import io.github.nabilcarel.gateway.model.composite.CompositeDefinition;

import java.util.List;

public interface CompositeDefinitionValidator {

    /**
     * @return every problem found; empty when the definition can be executed
     */
    List<String> validate(CompositeDefinition definition);
}
