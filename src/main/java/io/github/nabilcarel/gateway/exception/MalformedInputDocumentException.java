package io.github.nabilcarel.gateway.exception;

import io.github.nabilcarel.gateway.model.response.CompositeErrorType;

public class MalformedInputDocumentException extends StepExecutionException {

    public MalformedInputDocumentException(String stepName, String message) {
        super(stepName, message);
    }

    public MalformedInputDocumentException(String stepName, String message, Throwable cause) {
        super(stepName, message, cause);
    }

    @Override
    public CompositeErrorType getErrorType() {
        return CompositeErrorType.MALFORMED_INPUT_DOCUMENT;
    }
}
