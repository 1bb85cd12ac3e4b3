package io.github.nabilcarel.gateway.exception;

import io.github.nabilcarel.gateway.model.response.CompositeErrorType;

/**
 * A step's backend answered with a non-2xx status or could not be reached.
 * {@code statusCode} is null for transport failures.
 */
public class BackendCallFailedException extends StepExecutionException {
    private final Integer statusCode;
    private final String responseBody;
    private final boolean timedOut;

    public BackendCallFailedException(String stepName, int statusCode, String responseBody) {
        super(stepName, "Step '" + stepName + "' failed with HTTP " + statusCode);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
        this.timedOut = false;
    }

    public BackendCallFailedException(String stepName, BackendTransportException cause) {
        super(stepName, "Step '" + stepName + "' failed: " + cause.getMessage(), cause);
        this.statusCode = null;
        this.responseBody = null;
        this.timedOut = cause.isTimedOut();
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    @Override
    public CompositeErrorType getErrorType() {
        return CompositeErrorType.BACKEND_CALL_FAILED;
    }
}
