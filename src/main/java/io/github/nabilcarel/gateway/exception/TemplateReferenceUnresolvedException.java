package io.github.nabilcarel.gateway.exception;

import io.github.nabilcarel.gateway.model.response.CompositeErrorType;

public class TemplateReferenceUnresolvedException extends StepExecutionException {
    private final String reference;
    private final String availableReferences;

    public TemplateReferenceUnresolvedException(String stepName, String message, String reference) {
        this(stepName, message, reference, null);
    }

    public TemplateReferenceUnresolvedException(String stepName, String message, String reference,
                                                String availableReferences) {
        super(stepName, message);
        this.reference = reference;
        this.availableReferences = availableReferences;
    }

    public String getReference() {
        return reference;
    }

    public String getAvailableReferences() {
        return availableReferences;
    }

    @Override
    public CompositeErrorType getErrorType() {
        return CompositeErrorType.TEMPLATE_REFERENCE_UNRESOLVED;
    }
}
