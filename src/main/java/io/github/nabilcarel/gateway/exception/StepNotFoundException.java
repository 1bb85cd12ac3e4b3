package io.github.nabilcarel.gateway.exception;

import io.github.nabilcarel.gateway.model.response.CompositeErrorType;

public class StepNotFoundException extends StepExecutionException {
    private final String endpointName;

    public StepNotFoundException(String stepName, String endpointName) {
        super(stepName, "Endpoint '" + endpointName + "' for step '" + stepName + "' not found");
        this.endpointName = endpointName;
    }

    public String getEndpointName() {
        return endpointName;
    }

    @Override
    public CompositeErrorType getErrorType() {
        return CompositeErrorType.STEP_NOT_FOUND;
    }
}
