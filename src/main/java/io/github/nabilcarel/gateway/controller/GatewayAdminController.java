package io.github.nabilcarel.gateway.controller;

import io.github.nabilcarel.gateway.config.EndpointDirectory;
import io.github.nabilcarel.gateway.model.EndpointDefinition;
import io.github.nabilcarel.gateway.model.EndpointType;
import io.github.nabilcarel.gateway.service.ResponseCacheService;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/gateway")
@RequiredArgsConstructor
@Slf4j
public class GatewayAdminController {
    private final EndpointDirectory endpointDirectory;
    private final ResponseCacheService responseCacheService;

    @Getter
    @AllArgsConstructor
    public static class EndpointSummary {
        private final String name;
        private final EndpointType type;
        private final Set<String> methods;
        private final Set<String> allowedEnvironments;
    }

    @GetMapping("/endpoints")
    public List<EndpointSummary> getAvailableEndpoints() {
        return endpointDirectory.getAvailableEndpoints().stream()
                .sorted(Comparator.comparing(EndpointDefinition::getName, String.CASE_INSENSITIVE_ORDER))
                .map(endpoint -> new EndpointSummary(endpoint.getName(), endpoint.getType(),
                        endpoint.getAllowedMethods(), endpoint.getAllowedEnvironments()))
                .collect(Collectors.toList());
    }

    @PostMapping("/endpoints/refresh")
    public Map<String, Integer> refreshEndpoints() {
        int count = endpointDirectory.reload();
        log.info("Endpoint directory refreshed, {} endpoints", count);
        return Map.of("endpoints", count);
    }

    @DeleteMapping("/cache")
    public Mono<ResponseEntity<Void>> clearCache() {
        return responseCacheService.clear().then(Mono.fromCallable(() -> ResponseEntity.noContent().<Void>build()));
    }
}
