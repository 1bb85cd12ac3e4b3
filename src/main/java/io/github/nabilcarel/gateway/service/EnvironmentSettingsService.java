package io.github.nabilcarel.gateway.service;

import io.github.nabilcarel.gateway.config.GatewayProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Per-environment settings: which environments are served and which headers their backends expect.
 */
@Service
@RequiredArgsConstructor
public class EnvironmentSettingsService {
    private final GatewayProperties properties;

    public boolean isAllowed(String environment) {
        List<String> allowed = properties.getEnvironments().getAllowed();
        return allowed == null || allowed.isEmpty()
                || allowed.stream().anyMatch(env -> env.equalsIgnoreCase(environment));
    }

    public void applyHeaders(String environment, HttpHeaders target) {
        Map<String, Map<String, String>> headers = properties.getEnvironments().getHeaders();
        if (headers == null || environment == null) {
            return;
        }
        headers.entrySet().stream()
                .filter(entry -> entry.getKey().equalsIgnoreCase(environment))
                .findFirst()
                .ifPresent(entry -> entry.getValue().forEach(target::set));
    }
}
