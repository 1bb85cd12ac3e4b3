package io.github.nabilcarel.gateway.model.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a composite execution. On failure {@code stepResults} holds the steps
 * that completed before {@code failedStep}.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompositeResult {
    private final boolean success;

    @Builder.Default
    private final Map<String, JsonNode> stepResults = new LinkedHashMap<>();

    private final String failedStep;
    private final CompositeErrorType errorType;
    private final String errorMessage;
    private final String errorDetail;
    private final Integer httpStatusCode;
    private final String responseBody;
    private final JsonNode structuredError;

    /**
     * Set when the backend could not be reached in time.
     */
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    private final boolean timedOut;

    public static CompositeResult succeeded(Map<String, JsonNode> stepResults) {
        return CompositeResult.builder()
                .success(true)
                .stepResults(new LinkedHashMap<>(stepResults))
                .build();
    }

    public static CompositeResult failed(CompositeErrorType errorType, String message) {
        return CompositeResult.builder()
                .success(false)
                .errorType(errorType)
                .errorMessage(message)
                .build();
    }
}
