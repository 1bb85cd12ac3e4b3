package io.github.nabilcarel.gateway.model.context;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpHeaders;

import java.util.Map;

/**
 * Inbound request data the engines need after the servlet request is gone.
 */
@Getter
@Builder
public class RequestMetadata {
    private final String requestId;
    private final String publicBaseUrl;

    @Builder.Default
    private final HttpHeaders headers = HttpHeaders.EMPTY;

    @Builder.Default
    private final Map<String, String> queryParameters = Map.of();

    /**
     * Extra values exposed to {@code $context.<name>} templates.
     */
    @Builder.Default
    private final Map<String, String> contextVariables = Map.of();
}
