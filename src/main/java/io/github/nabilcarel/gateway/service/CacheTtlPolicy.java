package io.github.nabilcarel.gateway.service;

import io.github.nabilcarel.gateway.config.EndpointDirectory;
import io.github.nabilcarel.gateway.config.GatewayProperties;
import io.github.nabilcarel.gateway.model.EndpointDefinition;
import io.github.nabilcarel.gateway.util.Patterns;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Decides whether a backend response may be cached and for how long.
 */
@Component
@RequiredArgsConstructor
public class CacheTtlPolicy {

    private final GatewayProperties properties;
    private final EndpointDirectory endpointDirectory;

    /**
     * TTL from the backend's {@code Cache-Control: max-age}, else the endpoint's own
     * duration, else the configured default.
     */
    public Duration resolveTtl(Map<String, String> responseHeaders, String endpointName) {
        if (responseHeaders != null) {
            for (Map.Entry<String, String> header : responseHeaders.entrySet()) {
                if (HttpHeaders.CACHE_CONTROL.equalsIgnoreCase(header.getKey()) && header.getValue() != null) {
                    Matcher matcher = Patterns.MAX_AGE_PATTERN.matcher(header.getValue());
                    if (matcher.find()) {
                        return Duration.ofSeconds(Long.parseLong(matcher.group(1)));
                    }
                }
            }
        }

        Duration endpointDuration = endpointDirectory.lookup(endpointName)
                .map(EndpointDefinition::getCacheDuration)
                .orElse(null);
        if (endpointDuration != null) {
            return endpointDuration;
        }

        Duration configured = properties.getCache().getEndpointDurations().entrySet().stream()
                .filter(entry -> entry.getKey().equalsIgnoreCase(endpointName))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
        return configured != null ? configured : properties.getCache().getDefaultDuration();
    }

    /**
     * Media type match ignoring parameters such as charset.
     */
    public boolean isCacheable(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return false;
        }
        String mediaType = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return properties.getCache().getCacheableContentTypes().stream()
                .anyMatch(type -> type.trim().equalsIgnoreCase(mediaType));
    }
}
