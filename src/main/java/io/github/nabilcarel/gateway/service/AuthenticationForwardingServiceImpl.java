package io.github.nabilcarel.gateway.service;

import io.github.nabilcarel.gateway.config.GatewayProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class AuthenticationForwardingServiceImpl implements AuthenticationForwardingService {
    private final GatewayProperties properties;

    @Override
    public void forwardAuthentication(HttpHeaders inboundHeaders, HttpHeaders targetHeaders) {
        if (inboundHeaders == null) {
            return;
        }
        forwardIfPresent(inboundHeaders, targetHeaders, HttpHeaders.AUTHORIZATION);
        forwardIfPresent(inboundHeaders, targetHeaders, HttpHeaders.COOKIE);
        forwardIfPresent(inboundHeaders, targetHeaders, "X-API-Key");
        forwardIfPresent(inboundHeaders, targetHeaders, "X-Auth-Token");

        properties.getSecurity().getAdditionalAuthHeaders().forEach(headerName ->
                forwardIfPresent(inboundHeaders, targetHeaders, headerName)
        );
    }

    private void forwardIfPresent(HttpHeaders inbound, HttpHeaders target, String headerName) {
        List<String> values = inbound.get(headerName);
        if (values != null && !values.isEmpty() && !target.containsKey(headerName)) {
            target.addAll(headerName, values);
        }
    }
}
