package io.github.nabilcarel.gateway.config.filter;

import io.github.nabilcarel.gateway.config.GatewayProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Adds the configured {@code gateway.security.response-headers} to every response.
 * The proxy drops backend copies of the same headers, so these are the only values sent.
 */
@Component
@RequiredArgsConstructor
public class SecurityHeadersFilter extends OncePerRequestFilter {

    private final GatewayProperties properties;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        properties.getSecurity().getResponseHeaders().forEach(response::setHeader);
        filterChain.doFilter(request, response);
    }
}
