package io.github.nabilcarel.gateway.model.cache;

import io.github.nabilcarel.gateway.model.backend.BackendResponse;
import lombok.Builder;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Builder(toBuilder = true)
public class CachedResponse {
    private final int statusCode;

    @Builder.Default
    private final Map<String, String> headers = new LinkedHashMap<>();

    private final byte[] body;
    private final String contentType;
    private final CacheOutcome outcome;

    public static CachedResponse of(BackendResponse response, CacheOutcome outcome) {
        return CachedResponse.builder()
                .statusCode(response.getStatusCode())
                .headers(new LinkedHashMap<>(response.getHeaders()))
                .body(response.getBody())
                .contentType(response.getContentType())
                .outcome(outcome)
                .build();
    }

    public static CachedResponse of(CacheEntry entry) {
        return CachedResponse.builder()
                .statusCode(entry.getStatusCode())
                .headers(entry.getHeaders() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(entry.getHeaders()))
                .body(entry.getBody())
                .contentType(entry.getContentType())
                .outcome(CacheOutcome.HIT)
                .build();
    }

    public boolean hasHeader(String name) {
        return headers.keySet().stream().anyMatch(key -> key.equalsIgnoreCase(name));
    }
}
