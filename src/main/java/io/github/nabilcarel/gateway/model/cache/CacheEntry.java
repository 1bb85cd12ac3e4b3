package io.github.nabilcarel.gateway.model.cache;

import io.github.nabilcarel.gateway.model.backend.BackendResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A memoized backend response. Expiry is owned by the store.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {
    private byte[] body;

    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

    private int statusCode;
    private String contentType;

    public static CacheEntry from(BackendResponse response) {
        return CacheEntry.builder()
                .body(response.getBody())
                .headers(new LinkedHashMap<>(response.getHeaders()))
                .statusCode(response.getStatusCode())
                .contentType(response.getContentType())
                .build();
    }
}
