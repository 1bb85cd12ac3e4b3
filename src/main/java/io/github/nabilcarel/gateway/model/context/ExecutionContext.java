package io.github.nabilcarel.gateway.model.context;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * State of one composite execution. Confined to the request that created it.
 */
@Getter
public class ExecutionContext {

    private final String requestId;
    private final String environment;
    private final JsonNode root;
    private final Map<String, String> variables;
    private final Map<String, JsonNode> sharedValues = new HashMap<>();
    private final Map<String, JsonNode> stepResults = new LinkedHashMap<>();
    private String lastCompletedStep;

    public ExecutionContext(String requestId, String environment, JsonNode root, Map<String, String> variables) {
        this.requestId = requestId;
        this.environment = environment;
        this.root = root;
        this.variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public JsonNode sharedValue(String key, Supplier<JsonNode> generator) {
        return sharedValues.computeIfAbsent(key, k -> generator.get());
    }

    public void putStepResult(String stepName, JsonNode result) {
        stepResults.put(stepName, result);
        lastCompletedStep = stepName;
    }

    public Optional<JsonNode> getStepResult(String stepName) {
        return Optional.ofNullable(stepResults.get(stepName));
    }

    public Optional<JsonNode> getLastStepResult() {
        return lastCompletedStep == null ? Optional.empty() : getStepResult(lastCompletedStep);
    }

    public Map<String, JsonNode> getStepResults() {
        return Collections.unmodifiableMap(stepResults);
    }

    public Optional<String> getVariable(String name) {
        return Optional.ofNullable(variables.get(name));
    }
}
