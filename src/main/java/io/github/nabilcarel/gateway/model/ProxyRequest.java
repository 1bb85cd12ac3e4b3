package io.github.nabilcarel.gateway.model;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

/**
 * An inbound call to be passed through to a standard endpoint.
 */
@Getter
@Builder
public class ProxyRequest {
    private final String environment;
    private final EndpointDefinition endpoint;

    /**
     * Path below the endpoint name, without a leading slash.
     */
    private final String remainingPath;

    /**
     * Raw query string, without the leading {@code ?}.
     */
    private final String queryString;

    private final HttpMethod method;

    @Builder.Default
    private final HttpHeaders headers = HttpHeaders.EMPTY;

    private final byte[] body;
    private final String publicBaseUrl;
    private final String requestId;
}
