package io.github.nabilcarel.gateway.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.nabilcarel.gateway.config.EndpointDirectory;
import io.github.nabilcarel.gateway.config.GatewayProperties;
import io.github.nabilcarel.gateway.config.filter.RequestIdFilter;
import io.github.nabilcarel.gateway.exception.EndpointNotFoundException;
import io.github.nabilcarel.gateway.exception.EnvironmentNotAllowedException;
import io.github.nabilcarel.gateway.exception.InvalidRequestPathException;
import io.github.nabilcarel.gateway.exception.MethodNotAllowedException;
import io.github.nabilcarel.gateway.model.EndpointDefinition;
import io.github.nabilcarel.gateway.model.ProxyRequest;
import io.github.nabilcarel.gateway.model.cache.CachedResponse;
import io.github.nabilcarel.gateway.model.context.RequestMetadata;
import io.github.nabilcarel.gateway.model.response.CompositeErrorType;
import io.github.nabilcarel.gateway.model.response.CompositeResult;
import io.github.nabilcarel.gateway.service.CompositeOrchestrator;
import io.github.nabilcarel.gateway.service.EnvironmentSettingsService;
import io.github.nabilcarel.gateway.service.ProxyService;
import io.github.nabilcarel.gateway.service.ResponseUrlRewriteService;
import io.github.nabilcarel.gateway.util.PathSegments;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Single entry point for every endpoint of every environment:
 * {@code /api/{environment}/{endpoint}/**}.
 */
@RestController
@RequestMapping(ResponseUrlRewriteService.API_PREFIX)
@RequiredArgsConstructor
@Slf4j
public class GatewayController {

    private static final String COMPOSITE_SEGMENT = "composite";
    public static final String CACHE_STATUS_HEADER = "X-Cache";

    private final EndpointDirectory endpointDirectory;
    private final CompositeOrchestrator orchestrator;
    private final ProxyService proxyService;
    private final EnvironmentSettingsService environmentSettings;
    private final GatewayProperties properties;
    @Qualifier("gatewayObjectMapper")
    private final ObjectMapper mapper;

    @PostMapping("/{environment}/" + COMPOSITE_SEGMENT + "/{name}")
    public Mono<ResponseEntity<Object>> executeComposite(@PathVariable String environment,
                                                         @PathVariable String name,
                                                         @RequestBody(required = false) byte[] body,
                                                         HttpServletRequest request) {
        EndpointDefinition endpoint = resolveEndpoint(environment, name);
        if (!endpoint.isComposite()) {
            throw new EndpointNotFoundException(name);
        }
        return runComposite(endpoint, environment, body, request);
    }

    @RequestMapping(value = "/{environment}/{endpoint}/**",
            method = {RequestMethod.GET, RequestMethod.POST, RequestMethod.PUT, RequestMethod.PATCH,
                    RequestMethod.DELETE})
    public Mono<ResponseEntity<Object>> dispatch(@PathVariable String environment,
                                                 @PathVariable("endpoint") String endpointName,
                                                 @RequestBody(required = false) byte[] body,
                                                 HttpServletRequest request) {
        String method = request.getMethod();
        String remainingPath = remainingPath(request);
        if (!PathSegments.isSafeRelativePath(remainingPath)) {
            throw new InvalidRequestPathException(remainingPath);
        }

        if (COMPOSITE_SEGMENT.equalsIgnoreCase(endpointName) && endpointDirectory.lookup(endpointName).isEmpty()) {
            String compositeName = remainingPath.split("/", 2)[0];
            EndpointDefinition composite = resolveEndpoint(environment, compositeName);
            if (!composite.isComposite()) {
                throw new EndpointNotFoundException(compositeName);
            }
            throw new MethodNotAllowedException(compositeName, method, Set.of(HttpMethod.POST.name()));
        }

        EndpointDefinition endpoint = resolveEndpoint(environment, endpointName);
        if (endpoint.isComposite()) {
            if (!HttpMethod.POST.matches(method)) {
                throw new MethodNotAllowedException(endpointName, method, Set.of(HttpMethod.POST.name()));
            }
            return runComposite(endpoint, environment, body, request);
        }
        if (!endpoint.allowsMethod(method)) {
            throw new MethodNotAllowedException(endpointName, method, endpoint.getAllowedMethods());
        }

        ProxyRequest proxyRequest = ProxyRequest.builder()
                .environment(environment)
                .endpoint(endpoint)
                .remainingPath(remainingPath)
                .queryString(request.getQueryString())
                .method(HttpMethod.valueOf(method))
                .headers(new ServletServerHttpRequest(request).getHeaders())
                .body(body)
                .publicBaseUrl(publicBaseUrl(request))
                .requestId(requestId(request))
                .build();

        return proxyService.forward(proxyRequest).map(this::toResponseEntity);
    }

    private Mono<ResponseEntity<Object>> runComposite(EndpointDefinition endpoint, String environment, byte[] body,
                                                      HttpServletRequest request) {
        JsonNode document = null;
        if (body != null && body.length > 0) {
            try {
                document = mapper.readTree(body);
            } catch (IOException e) {
                log.warn("Composite {} called with invalid JSON: {}", endpoint.getName(), e.getMessage());
                CompositeResult result = CompositeResult.failed(CompositeErrorType.MALFORMED_INPUT_DOCUMENT,
                        "Request body is not valid JSON");
                return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body((Object) result));
            }
        }

        RequestMetadata metadata = RequestMetadata.builder()
                .requestId(requestId(request))
                .publicBaseUrl(publicBaseUrl(request))
                .headers(new ServletServerHttpRequest(request).getHeaders())
                .queryParameters(queryParameters(request))
                .build();

        return orchestrator.execute(endpoint.getCompositeConfig(), document, environment, metadata)
                .map(result -> ResponseEntity.status(statusFor(result)).body((Object) result));
    }

    /**
     * HTTP status returned to the caller for a composite result.
     */
    public static int statusFor(CompositeResult result) {
        if (result.isSuccess()) {
            return HttpStatus.OK.value();
        }
        if (result.getErrorType() == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR.value();
        }
        switch (result.getErrorType()) {
            case BACKEND_CALL_FAILED:
                if (result.getHttpStatusCode() != null && result.getHttpStatusCode() >= 400
                        && result.getHttpStatusCode() < 600) {
                    return result.getHttpStatusCode();
                }
                return result.isTimedOut() ? HttpStatus.GATEWAY_TIMEOUT.value() : HttpStatus.BAD_GATEWAY.value();
            case MALFORMED_INPUT_DOCUMENT:
                return HttpStatus.BAD_REQUEST.value();
            case TEMPLATE_REFERENCE_UNRESOLVED:
                return HttpStatus.UNPROCESSABLE_ENTITY.value();
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR.value();
        }
    }

    private EndpointDefinition resolveEndpoint(String environment, String endpointName) {
        if (!environmentSettings.isAllowed(environment)) {
            throw new EnvironmentNotAllowedException(environment, "Environment '" + environment + "' is not allowed");
        }
        EndpointDefinition endpoint = endpointDirectory.lookup(endpointName)
                .filter(candidate -> !candidate.isPrivate())
                .orElseThrow(() -> new EndpointNotFoundException(endpointName));
        if (!endpoint.allowsEnvironment(environment)) {
            throw new EnvironmentNotAllowedException(environment,
                    "Endpoint '" + endpointName + "' is not available in environment '" + environment + "'");
        }
        return endpoint;
    }

    private ResponseEntity<Object> toResponseEntity(CachedResponse response) {
        HttpHeaders headers = new HttpHeaders();
        response.getHeaders().forEach(headers::set);
        if (response.getContentType() != null && !headers.containsKey(HttpHeaders.CONTENT_TYPE)) {
            headers.set(HttpHeaders.CONTENT_TYPE, response.getContentType());
        }
        headers.set(CACHE_STATUS_HEADER, response.getOutcome().name());
        byte[] body = response.getBody() == null ? new byte[0] : response.getBody();
        return ResponseEntity.status(response.getStatusCode()).headers(headers).body((Object) body);
    }

    private String publicBaseUrl(HttpServletRequest request) {
        if (StringUtils.hasText(properties.getPublicBaseUrl())) {
            return properties.getPublicBaseUrl();
        }
        return ServletUriComponentsBuilder.fromContextPath(request).build().toUriString();
    }

    private static String requestId(HttpServletRequest request) {
        Object requestId = request.getAttribute(RequestIdFilter.REQUEST_ID_ATTRIBUTE);
        return requestId != null ? requestId.toString() : UUID.randomUUID().toString();
    }

    /**
     * Raw path below {@code /api/{environment}/{endpoint}}, without a leading slash.
     */
    private static String remainingPath(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        String[] segments = path.split("/", 5);
        return segments.length == 5 ? segments[4] : "";
    }

    private static Map<String, String> queryParameters(HttpServletRequest request) {
        Map<String, String> parameters = new LinkedHashMap<>();
        request.getParameterMap().forEach((name, values) -> {
            if (values != null && values.length > 0) {
                parameters.put(name, values[0]);
            }
        });
        return parameters;
    }
}
