package io.github.nabilcarel.gateway.service;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Builds cache keys of the form
 * {@code proxy:{env}:{endpoint}:{path}:{query}[:auth:{sha256}][:lang:{value}]}.
 * The Authorization header is only ever stored as a hash. Every component has
 * {@code %} and {@code :} percent-escaped, so a path or query can never produce a
 * separator or the {@code auth}/{@code lang} suffixes of another request.
 */
@Component
public class CacheKeyFactory {

    public static final String LOCK_PREFIX = "lock:";

    public String cacheKey(String environment, String endpointName, String path, String queryString,
                           HttpHeaders headers) {
        StringBuilder key = new StringBuilder("proxy:")
                .append(escape(environment)).append(':')
                .append(escape(endpointName)).append(':')
                .append(escape(path)).append(':')
                .append(escape(queryString));

        String authorization = headers == null ? null : headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (StringUtils.hasText(authorization)) {
            key.append(":auth:").append(sha256(authorization));
        }

        String language = headers == null ? null : headers.getFirst(HttpHeaders.ACCEPT_LANGUAGE);
        if (StringUtils.hasText(language)) {
            key.append(":lang:").append(escape(language));
        }
        return key.toString();
    }

    public String lockKey(String cacheKey) {
        return LOCK_PREFIX + cacheKey;
    }

    private static String escape(String component) {
        if (component == null) {
            return "";
        }
        return component.replace("%", "%25").replace(":", "%3A");
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return Base64.getEncoder().encodeToString(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
