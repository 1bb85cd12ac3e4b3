package io.github.nabilcarel.gateway.model.backend;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

import java.time.Duration;

@Getter
@Builder
public class BackendRequest {
    private final String url;
    private final HttpMethod method;

    @Builder.Default
    private final HttpHeaders headers = new HttpHeaders();

    private final byte[] body;

    /**
     * Overrides the client's default response timeout when set.
     */
    private final Duration timeout;

    public boolean hasBody() {
        return body != null && body.length > 0;
    }
}
