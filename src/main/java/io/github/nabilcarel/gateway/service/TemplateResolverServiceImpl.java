package io.github.nabilcarel.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.nabilcarel.gateway.config.GatewayProperties;
import io.github.nabilcarel.gateway.exception.TemplateReferenceUnresolvedException;
import io.github.nabilcarel.gateway.model.composite.CompositeStep;
import io.github.nabilcarel.gateway.model.context.ExecutionContext;
import io.github.nabilcarel.gateway.model.context.SharedValueScope;
import io.github.nabilcarel.gateway.util.JsonPaths;
import io.github.nabilcarel.gateway.util.Patterns;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;

@Service
@RequiredArgsConstructor
@Slf4j
public class TemplateResolverServiceImpl implements TemplateResolverService {

    public static final String GUID_EXPRESSION = "$guid";

    private final GatewayProperties properties;

    @Override
    public void applyTransformations(ObjectNode target, CompositeStep step, ExecutionContext context) {
        for (Map.Entry<String, String> transformation : step.getTemplateTransformations().entrySet()) {
            target.set(transformation.getKey(), resolve(transformation.getValue(), step.getName(), context));
        }
    }

    @Override
    public JsonNode resolve(String expression, String stepName, ExecutionContext context) {
        if (expression == null) {
            return TextNode.valueOf("");
        }
        String trimmed = expression.trim();

        if (GUID_EXPRESSION.equals(trimmed)) {
            return context.sharedValue(sharedValueKey(trimmed, stepName),
                    () -> TextNode.valueOf(UUID.randomUUID().toString()));
        }

        Matcher previous = Patterns.PREVIOUS_REFERENCE_PATTERN.matcher(trimmed);
        if (previous.matches()) {
            return resolvePrevious(trimmed, previous.group(1), previous.group(2), stepName, context);
        }

        Matcher variable = Patterns.CONTEXT_REFERENCE_PATTERN.matcher(trimmed);
        if (variable.matches()) {
            String name = variable.group(1);
            return context.getVariable(name)
                    .<JsonNode>map(TextNode::valueOf)
                    .orElseThrow(() -> new TemplateReferenceUnresolvedException(stepName,
                            "Context variable '" + name + "' is not defined", trimmed,
                            String.join(", ", context.getVariables().keySet())));
        }

        return TextNode.valueOf(expression);
    }

    private JsonNode resolvePrevious(String expression, String sourceStep, String path, String stepName,
                                     ExecutionContext context) {
        JsonNode result = context.getStepResult(sourceStep)
                .orElseThrow(() -> new TemplateReferenceUnresolvedException(stepName,
                        "No result available for step '" + sourceStep + "'", expression,
                        String.join(", ", context.getStepResults().keySet())));

        return JsonPaths.navigate(result, path)
                .orElseThrow(() -> {
                    log.debug("Path '{}' not found in result of step {}: {}", path, sourceStep, result);
                    return new TemplateReferenceUnresolvedException(stepName,
                            "Path '" + stripLeadingDot(path) + "' not found in result of step '" + sourceStep + "'",
                            expression);
                });
    }

    private String sharedValueKey(String expression, String stepName) {
        if (properties.getComposite().getSharedValueScope() == SharedValueScope.STEP) {
            return stepName + ":" + expression;
        }
        return expression;
    }

    private static String stripLeadingDot(String path) {
        return path.startsWith(".") ? path.substring(1) : path;
    }
}
