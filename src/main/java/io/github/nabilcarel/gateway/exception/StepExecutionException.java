package io.github.nabilcarel.gateway.exception;

import io.github.nabilcarel.gateway.model.response.CompositeErrorType;

/**
 * Failure of a single composite step. The orchestrator folds these into a failed result.
 */
public abstract class StepExecutionException extends RuntimeException {
    private final String stepName;

    protected StepExecutionException(String stepName, String message) {
        super(message);
        this.stepName = stepName;
    }

    protected StepExecutionException(String stepName, String message, Throwable cause) {
        super(message, cause);
        this.stepName = stepName;
    }

    public String getStepName() {
        return stepName;
    }

    public abstract CompositeErrorType getErrorType();
}
