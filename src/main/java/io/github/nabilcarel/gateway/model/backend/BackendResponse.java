package io.github.nabilcarel.gateway.model.backend;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Getter
@Builder(toBuilder = true)
public class BackendResponse {
    private final int statusCode;

    /**
     * Response headers, multi-valued headers joined with a comma.
     */
    @Builder.Default
    private final Map<String, String> headers = new LinkedHashMap<>();

    @Builder.Default
    private final byte[] body = new byte[0];

    private final String contentType;

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public String getBodyAsString() {
        return body == null ? "" : new String(body, getCharset());
    }

    /**
     * Charset declared by the content type, UTF-8 when none or an unknown one is declared.
     */
    public Charset getCharset() {
        if (!StringUtils.hasText(contentType)) {
            return StandardCharsets.UTF_8;
        }
        try {
            Charset charset = MediaType.parseMediaType(contentType).getCharset();
            return charset != null ? charset : StandardCharsets.UTF_8;
        } catch (InvalidMediaTypeException ex) {
            return StandardCharsets.UTF_8;
        }
    }

    public Optional<String> getHeader(String name) {
        return headers.entrySet().stream()
                .filter(entry -> entry.getKey().equalsIgnoreCase(name))
                .map(Map.Entry::getValue)
                .findFirst();
    }
}
