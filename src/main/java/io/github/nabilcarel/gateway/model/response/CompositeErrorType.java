package io.github.nabilcarel.gateway.model.response;

public enum CompositeErrorType {
    STEP_NOT_FOUND,
    TEMPLATE_REFERENCE_UNRESOLVED,
    BACKEND_CALL_FAILED,
    MALFORMED_INPUT_DOCUMENT,
    INVALID_DEFINITION
}
