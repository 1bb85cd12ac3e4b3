package io.github.nabilcarel.gateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.nabilcarel.gateway.config.EndpointDirectory;
import io.github.nabilcarel.gateway.model.EndpointDefinition;
import io.github.nabilcarel.gateway.util.UrlRewriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Replaces backend URLs in payloads with the gateway's public URL for the same endpoint,
 * {@code {publicBaseUrl}/api/{environment}/{endpointName}}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResponseUrlRewriteService {

    public static final String API_PREFIX = "/api";

    private final EndpointDirectory endpointDirectory;
    @Qualifier("gatewayObjectMapper")
    private final ObjectMapper mapper;

    public static String publicUrl(String publicBaseUrl, String environment, String endpointName) {
        String base = publicBaseUrl == null ? "" : publicBaseUrl.replaceAll("/+$", "");
        return base + API_PREFIX + "/" + environment + "/" + endpointName;
    }

    public String rewriteForEndpoint(String content, EndpointDefinition endpoint, String environment,
                                     String publicBaseUrl) {
        if (!StringUtils.hasText(content) || !StringUtils.hasText(endpoint.getUrl())) {
            return content;
        }
        try {
            return UrlRewriter.rewrite(content, endpoint.getUrl(),
                    publicUrl(publicBaseUrl, environment, endpoint.getName()));
        } catch (IllegalArgumentException e) {
            log.warn("Cannot rewrite URLs for endpoint {} with url {}: {}", endpoint.getName(), endpoint.getUrl(),
                    e.getMessage());
            return content;
        }
    }

    /**
     * Rewrites the URL of every known endpoint, longest URL first so that nested base
     * URLs map to the most specific endpoint.
     */
    public String rewriteKnownEndpoints(String content, String environment, String publicBaseUrl) {
        if (!StringUtils.hasText(content)) {
            return content;
        }
        List<EndpointDefinition> candidates = endpointDirectory.getAllEndpoints().stream()
                .filter(endpoint -> StringUtils.hasText(endpoint.getUrl()))
                .sorted(Comparator.comparingInt((EndpointDefinition endpoint) -> endpoint.getUrl().length()).reversed())
                .collect(Collectors.toList());

        String result = content;
        for (EndpointDefinition endpoint : candidates) {
            result = rewriteForEndpoint(result, endpoint, environment, publicBaseUrl);
        }
        return result;
    }

    public Map<String, JsonNode> rewriteStepResults(Map<String, JsonNode> stepResults, String environment,
                                                    String publicBaseUrl) {
        Map<String, JsonNode> rewritten = new LinkedHashMap<>();
        stepResults.forEach((step, result) -> rewritten.put(step, rewriteNode(step, result, environment, publicBaseUrl)));
        return rewritten;
    }

    private JsonNode rewriteNode(String step, JsonNode node, String environment, String publicBaseUrl) {
        if (node == null || node.isNull()) {
            return node;
        }
        try {
            String json = mapper.writeValueAsString(node);
            String replaced = rewriteKnownEndpoints(json, environment, publicBaseUrl);
            return replaced.equals(json) ? node : mapper.readTree(replaced);
        } catch (JsonProcessingException e) {
            log.warn("URL rewriting left result of step {} unchanged: {}", step, e.getOriginalMessage());
            return node;
        }
    }
}
