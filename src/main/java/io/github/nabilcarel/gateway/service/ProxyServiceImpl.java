package io.github.nabilcarel.gateway.service;

import io.github.nabilcarel.gateway.config.GatewayProperties;
import io.github.nabilcarel.gateway.exception.TargetUrlNotAllowedException;
import io.github.nabilcarel.gateway.model.ProxyRequest;
import io.github.nabilcarel.gateway.model.backend.BackendRequest;
import io.github.nabilcarel.gateway.model.backend.BackendResponse;
import io.github.nabilcarel.gateway.model.cache.CacheOutcome;
import io.github.nabilcarel.gateway.model.cache.CachedResponse;
import io.github.nabilcarel.gateway.util.Patterns;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProxyServiceImpl implements ProxyService {

    private static final Set<String> SKIPPED_REQUEST_HEADERS = caseInsensitiveSet(
            HttpHeaders.HOST, HttpHeaders.CONNECTION, HttpHeaders.CONTENT_LENGTH, HttpHeaders.TRANSFER_ENCODING,
            HttpHeaders.ACCEPT_ENCODING, "Keep-Alive", HttpHeaders.UPGRADE, HttpHeaders.TE, HttpHeaders.TRAILER,
            HttpHeaders.PROXY_AUTHORIZATION);

    private static final Set<String> SKIPPED_RESPONSE_HEADERS = caseInsensitiveSet(
            HttpHeaders.CONTENT_LENGTH, HttpHeaders.TRANSFER_ENCODING, HttpHeaders.CONNECTION, "Keep-Alive",
            "Server", "X-Powered-By", "X-AspNet-Version", "X-AspNetMvc-Version", "X-SourceFiles");

    private static final String SOAP_ACTION = "SOAPAction";

    private final BackendInvoker backendInvoker;
    private final ResponseCacheService responseCacheService;
    private final CacheKeyFactory cacheKeyFactory;
    private final ResponseUrlRewriteService urlRewriteService;
    private final EnvironmentSettingsService environmentSettings;
    private final GatewayProperties properties;
    private final TargetUrlValidator targetUrlValidator;

    @Override
    public Mono<CachedResponse> forward(ProxyRequest request) {
        String targetUrl = buildTargetUrl(request);
        Optional<String> rejection = targetUrlValidator.rejectionReason(targetUrl);
        if (rejection.isPresent()) {
            log.warn("Blocked potentially unsafe URL {}: {}", targetUrl, rejection.get());
            return Mono.error(new TargetUrlNotAllowedException(targetUrl, rejection.get()));
        }
        boolean soap = isSoapRequest(request, targetUrl);
        Supplier<Mono<BackendResponse>> call = () -> execute(request, targetUrl, soap);

        if (soap || !HttpMethod.GET.equals(request.getMethod())) {
            log.debug("Passing {} {} through without cache (soap={})", request.getMethod(), targetUrl, soap);
            return Mono.defer(call).map(response -> CachedResponse.of(response, CacheOutcome.BYPASS));
        }

        String endpointName = request.getEndpoint().getName();
        String cacheKey = cacheKeyFactory.cacheKey(request.getEnvironment(), endpointName,
                request.getRemainingPath(), request.getQueryString(), request.getHeaders());
        return responseCacheService.handleCacheableGet(cacheKey, cacheKeyFactory.lockKey(cacheKey), endpointName, call)
                .map(this::withDefaultCacheControl);
    }

    private Mono<BackendResponse> execute(ProxyRequest request, String targetUrl, boolean soap) {
        return Mono.defer(() -> {
            HttpHeaders headers = new HttpHeaders();
            request.getHeaders().forEach((name, values) -> {
                if (!SKIPPED_REQUEST_HEADERS.contains(name)) {
                    headers.addAll(name, values);
                }
            });
            environmentSettings.applyHeaders(request.getEnvironment(), headers);
            if (request.getRequestId() != null && !headers.containsKey("X-Request-Id")) {
                headers.set("X-Request-Id", request.getRequestId());
            }

            BackendRequest backendRequest = BackendRequest.builder()
                    .url(targetUrl)
                    .method(request.getMethod())
                    .headers(headers)
                    .body(request.getBody())
                    .build();

            log.info("Proxying {} {} -> {}", request.getMethod(), request.getEndpoint().getName(), targetUrl);
            return backendInvoker.invoke(backendRequest)
                    .map(response -> postProcess(response, request, soap));
        });
    }

    private BackendResponse postProcess(BackendResponse response, ProxyRequest request, boolean soap) {
        Set<String> gatewayHeaders = caseInsensitiveSet(
                properties.getSecurity().getResponseHeaders().keySet().toArray(new String[0]));
        Map<String, String> headers = new LinkedHashMap<>();
        response.getHeaders().forEach((name, value) -> {
            if (!SKIPPED_RESPONSE_HEADERS.contains(name) && !gatewayHeaders.contains(name)) {
                headers.put(name, value);
            }
        });

        if (soap || !isTextual(response.getContentType())) {
            return response.toBuilder().headers(headers).build();
        }

        String body = response.getBodyAsString();
        String rewritten = urlRewriteService.rewriteForEndpoint(body, request.getEndpoint(),
                request.getEnvironment(), request.getPublicBaseUrl());
        return response.toBuilder()
                .headers(headers)
                .body(rewritten.equals(body) ? response.getBody() : rewritten.getBytes(response.getCharset()))
                .build();
    }

    private CachedResponse withDefaultCacheControl(CachedResponse response) {
        String defaultCacheControl = properties.getCache().getDefaultCacheControl();
        if (!StringUtils.hasText(defaultCacheControl) || response.hasHeader(HttpHeaders.CACHE_CONTROL)) {
            return response;
        }
        Map<String, String> headers = new LinkedHashMap<>(response.getHeaders());
        headers.put(HttpHeaders.CACHE_CONTROL, defaultCacheControl);
        return response.toBuilder().headers(headers).build();
    }

    private static String buildTargetUrl(ProxyRequest request) {
        StringBuilder url = new StringBuilder(request.getEndpoint().getUrl().replaceAll("/+$", ""));
        if (StringUtils.hasText(request.getRemainingPath())) {
            url.append('/').append(request.getRemainingPath().replaceAll("^/+", ""));
        }
        if (StringUtils.hasText(request.getQueryString())) {
            url.append('?').append(request.getQueryString());
        }
        return url.toString();
    }

    static boolean isSoapRequest(ProxyRequest request, String targetUrl) {
        HttpHeaders headers = request.getHeaders();
        String contentType = headers.getFirst(HttpHeaders.CONTENT_TYPE);
        if (contentType != null) {
            String type = contentType.toLowerCase(Locale.ROOT);
            if (type.startsWith("text/xml") || type.startsWith("application/soap+xml")) {
                return true;
            }
        }
        if (headers.containsKey(SOAP_ACTION)) {
            return true;
        }
        String path = targetUrl.split("\\?", 2)[0].toLowerCase(Locale.ROOT);
        if (path.endsWith(".svc") || path.contains(".svc/")) {
            return true;
        }
        byte[] body = request.getBody();
        return body != null && body.length > 0
                && Patterns.SOAP_ENVELOPE_PATTERN.matcher(new String(body, 0, Math.min(body.length, 512),
                StandardCharsets.UTF_8)).find();
    }

    private static boolean isTextual(String contentType) {
        if (contentType == null) {
            return true;
        }
        String type = contentType.toLowerCase(Locale.ROOT);
        return type.startsWith("text/") || type.contains("json") || type.contains("xml")
                || type.contains("javascript");
    }

    private static Set<String> caseInsensitiveSet(String... values) {
        Set<String> set = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        set.addAll(Set.of(values));
        return set;
    }
}
