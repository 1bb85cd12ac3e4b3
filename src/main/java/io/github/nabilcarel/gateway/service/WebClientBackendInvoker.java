package io.github.nabilcarel.gateway.service;

import io.github.nabilcarel.gateway.config.BackendClientProperties;
import io.github.nabilcarel.gateway.exception.BackendTransportException;
import io.github.nabilcarel.gateway.model.backend.BackendRequest;
import io.github.nabilcarel.gateway.model.backend.BackendResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

@Service
@Slf4j
public class WebClientBackendInvoker implements BackendInvoker {

    private final WebClient webClient;
    private final BackendClientProperties properties;

    public WebClientBackendInvoker(@Qualifier("gatewayWebClient") WebClient webClient,
                                   BackendClientProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public Mono<BackendResponse> invoke(BackendRequest request) {
        return Mono.defer(() -> {
            String url = request.getUrl();
            Duration timeout = request.getTimeout() != null ? request.getTimeout() : properties.getResponseTimeout();
            log.debug("Calling backend {} {}", request.getMethod(), url);

            WebClient.RequestBodySpec spec = webClient.method(request.getMethod())
                    .uri(toUri(url))
                    .headers(headers -> headers.addAll(request.getHeaders()));

            WebClient.RequestHeadersSpec<?> headersSpec = spec;
            if (request.hasBody() && supportsRequestBody(request.getMethod())) {
                headersSpec = spec.bodyValue(request.getBody());
            }

            return headersSpec.exchangeToMono(this::toBackendResponse)
                    .timeout(timeout)
                    .doOnNext(response -> log.debug("Backend {} {} answered {}",
                            request.getMethod(), url, response.getStatusCode()))
                    .onErrorMap(TimeoutException.class, ex -> new BackendTransportException(
                            "Backend call to " + url + " timed out after " + timeout.toMillis() + "ms", url, true, ex))
                    .onErrorMap(WebClientRequestException.class, ex -> new BackendTransportException(
                            "Backend call to " + url + " failed: " + ex.getMessage(), url, false, ex));
        });
    }

    private Mono<BackendResponse> toBackendResponse(ClientResponse response) {
        return response.bodyToMono(byte[].class)
                .defaultIfEmpty(new byte[0])
                .map(body -> BackendResponse.builder()
                        .statusCode(response.statusCode().value())
                        .headers(flatten(response.headers().asHttpHeaders()))
                        .body(body)
                        .contentType(response.headers().contentType().map(MediaType::toString).orElse(null))
                        .build());
    }

    private static Map<String, String> flatten(HttpHeaders headers) {
        Map<String, String> flattened = new LinkedHashMap<>();
        headers.forEach((name, values) -> flattened.put(name, String.join(",", values)));
        return flattened;
    }

    private static URI toUri(String url) {
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            return UriComponentsBuilder.fromHttpUrl(url).build().encode().toUri();
        }
    }

    private static boolean supportsRequestBody(HttpMethod method) {
        return method == HttpMethod.POST || method == HttpMethod.PUT
                || method == HttpMethod.PATCH || method == HttpMethod.DELETE;
    }
}
