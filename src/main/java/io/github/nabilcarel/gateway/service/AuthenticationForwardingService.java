package io.github.nabilcarel.gateway.service;

import org.springframework.http.HttpHeaders;

public interface AuthenticationForwardingService {
    void forwardAuthentication(HttpHeaders inboundHeaders, HttpHeaders targetHeaders);
}
