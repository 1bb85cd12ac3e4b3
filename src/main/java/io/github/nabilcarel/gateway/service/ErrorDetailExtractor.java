package io.github.nabilcarel.gateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.nabilcarel.gateway.config.GatewayProperties;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Pulls a human readable message out of a failed backend response.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ErrorDetailExtractor {

    private static final List<String> MESSAGE_PATHS = List.of(
            "/error/message/value",
            "/error/message",
            "/message",
            "/detail",
            "/title");

    @Qualifier("gatewayObjectMapper")
    private final ObjectMapper mapper;
    private final GatewayProperties properties;

    @Getter
    @AllArgsConstructor
    public static class ErrorDetail {
        private final String detail;
        private final JsonNode structuredError;
    }

    public ErrorDetail extract(String body) {
        if (body == null || body.isBlank()) {
            return new ErrorDetail(null, null);
        }

        JsonNode parsed = parse(body);
        if (parsed != null && parsed.isContainerNode()) {
            for (String path : MESSAGE_PATHS) {
                JsonNode message = parsed.at(path);
                if (message.isValueNode() && !message.asText().isBlank()) {
                    return new ErrorDetail(message.asText(), parsed);
                }
            }
            return new ErrorDetail(truncate(body), parsed);
        }
        return new ErrorDetail(truncate(body), null);
    }

    private JsonNode parse(String body) {
        String trimmed = body.trim();
        if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) {
            return null;
        }
        try {
            return mapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            log.debug("Backend error body is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private String truncate(String body) {
        int maxLength = properties.getComposite().getErrorDetailMaxLength();
        return body.length() > maxLength ? body.substring(0, maxLength) + "..." : body;
    }
}
