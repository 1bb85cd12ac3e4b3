package io.github.nabilcarel.gateway.service;

import io.github.nabilcarel.gateway.config.GatewayProperties;
import io.github.nabilcarel.gateway.model.composite.CompositeDefinition;
import io.github.nabilcarel.gateway.model.composite.CompositeStep;
import io.github.nabilcarel.gateway.util.Patterns;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

@Component
@RequiredArgsConstructor
@Slf4j
public class CompositeDefinitionValidatorImpl implements CompositeDefinitionValidator {

    private static final Set<String> VALID_METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE");

    private final GatewayProperties properties;

    @Override
    public List<String> validate(CompositeDefinition definition) {
        List<String> errors = new ArrayList<>();
        if (definition == null || definition.getSteps() == null || definition.getSteps().isEmpty()) {
            errors.add("Composite definition has no steps");
            return errors;
        }

        Map<String, String> dependencyGraph = new HashMap<>();
        for (CompositeStep step : definition.getSteps()) {
            if (!StringUtils.hasText(step.getName())) {
                addError(errors, "Step without a name in composite '" + definition.getName() + "'");
                continue;
            }
            if (dependencyGraph.containsKey(step.getName())) {
                addError(errors, "Duplicate step name found: " + step.getName());
                continue;
            }
            dependencyGraph.put(step.getName(), step.getDependsOn());
        }

        for (CompositeStep step : definition.getSteps()) {
            errors.addAll(validateStep(step, dependencyGraph));
        }

        errors.addAll(validateDependencies(dependencyGraph));

        if (errors.isEmpty()) {
            for (CompositeStep step : definition.getSteps()) {
                errors.addAll(validateReferences(step, dependencyGraph));
            }
        }
        return errors;
    }

    private List<String> validateStep(CompositeStep step, Map<String, String> dependencyGraph) {
        List<String> errors = new ArrayList<>();
        String name = step.getName();

        if (!StringUtils.hasText(step.getEndpoint())) {
            addError(errors, "Step '" + name + "' has no endpoint");
        }

        if (step.getMethod() == null || !VALID_METHODS.contains(step.getMethod().toUpperCase())) {
            addError(errors, "Invalid HTTP method '" + step.getMethod() + "' for step '" + name + "'");
        }

        if (step.getDeclaredDependencies() != null && step.getDeclaredDependencies().size() > 1) {
            addError(errors, "Step '" + name + "' depends on " + step.getDeclaredDependencies()
                    + " but a step may depend on at most one other step");
        }

        String dependency = step.getDependsOn();
        if (dependency != null) {
            if (dependency.equals(name)) {
                addError(errors, "Step '" + name + "' depends on itself");
            } else if (!dependencyGraph.containsKey(dependency)) {
                addError(errors, "Missing dependency reference: '" + dependency + "' for step: " + name);
            }
        }

        if (!step.isArray() && StringUtils.hasText(step.getArrayProperty())) {
            addError(errors, "Step '" + name + "' names an arrayProperty but is not an array step");
        }
        return errors;
    }

    private List<String> validateDependencies(Map<String, String> dependencyGraph) {
        List<String> errors = new ArrayList<>();
        int maxDepth = properties.getComposite().getMaxDepth();

        for (String stepName : dependencyGraph.keySet()) {
            Set<String> path = new LinkedHashSet<>();
            String current = stepName;
            while (current != null && dependencyGraph.containsKey(current)) {
                if (!path.add(current)) {
                    addError(errors, "Circular dependency detected in path: " + path);
                    break;
                }
                current = dependencyGraph.get(current);
            }
            if (path.size() - 1 > maxDepth) {
                addError(errors, "Maximum dependency depth exceeded for step '" + stepName
                        + "': current=" + (path.size() - 1) + " maxDepth=" + maxDepth);
            }
        }
        return errors;
    }

    /**
     * A step may only read results of steps in its own dependsOn chain.
     */
    private List<String> validateReferences(CompositeStep step, Map<String, String> dependencyGraph) {
        List<String> errors = new ArrayList<>();
        Set<String> ancestors = new HashSet<>();
        String current = step.getDependsOn();
        while (current != null && ancestors.add(current)) {
            current = dependencyGraph.get(current);
        }

        for (Map.Entry<String, String> transformation : step.getTemplateTransformations().entrySet()) {
            String expression = transformation.getValue() == null ? "" : transformation.getValue().trim();
            Matcher matcher = Patterns.PREVIOUS_REFERENCE_PATTERN.matcher(expression);
            if (matcher.matches() && !ancestors.contains(matcher.group(1))) {
                addError(errors, "Invalid reference: " + expression + " in step '" + step.getName()
                        + "'. Available references: " + ancestors);
            }
        }
        return errors;
    }

    private void addError(List<String> errors, String error) {
        errors.add(error);
        log.error(error);
    }
}
