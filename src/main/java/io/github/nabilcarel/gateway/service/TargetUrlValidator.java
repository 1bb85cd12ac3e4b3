package io.github.nabilcarel.gateway.service;

import io.github.nabilcarel.gateway.config.GatewayProperties;
import io.github.nabilcarel.gateway.util.CidrRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Guards proxied calls against server-side request forgery: the backend host must be
 * allowed and must not resolve into a blocked network.
 */
@Component
@Slf4j
public class TargetUrlValidator {

    /**
     * Name resolution seam, {@link InetAddress#getAllByName} in production.
     */
    @FunctionalInterface
    public interface HostResolver {
        InetAddress[] resolve(String host) throws UnknownHostException;
    }

    private final GatewayProperties properties;
    private final HostResolver resolver;

    @Autowired
    public TargetUrlValidator(GatewayProperties properties) {
        this(properties, InetAddress::getAllByName);
    }

    public TargetUrlValidator(GatewayProperties properties, HostResolver resolver) {
        this.properties = properties;
        this.resolver = resolver;
    }

    /**
     * Why {@code url} must not be called, or empty when it may be.
     */
    public Optional<String> rejectionReason(String url) {
        UriComponents components;
        try {
            components = UriComponentsBuilder.fromHttpUrl(url).build();
        } catch (IllegalArgumentException ex) {
            return Optional.of("not an absolute http(s) URL");
        }
        if (!StringUtils.hasText(components.getHost())) {
            return Optional.of("no host");
        }
        String host = stripBrackets(components.getHost().toLowerCase(Locale.ROOT));

        GatewayProperties.Security security = properties.getSecurity();
        if (security.getAllowedHosts().stream().anyMatch(allowed -> allowed.equalsIgnoreCase(host))) {
            return Optional.empty();
        }
        if (!security.getAllowedHosts().isEmpty()) {
            return Optional.of("host '" + host + "' is not an allowed host");
        }

        List<CidrRange> blocked = security.getBlockedIpRanges().stream()
                .map(CidrRange::parse)
                .collect(Collectors.toList());
        if (blocked.isEmpty()) {
            return Optional.empty();
        }

        InetAddress[] addresses;
        try {
            addresses = resolver.resolve(host);
        } catch (UnknownHostException ex) {
            // an unresolvable host cannot be reached either; the call itself reports the failure
            log.debug("Could not resolve backend host {}: {}", host, ex.getMessage());
            return Optional.empty();
        }
        for (InetAddress address : addresses) {
            for (CidrRange range : blocked) {
                if (range.contains(address)) {
                    return Optional.of("host '" + host + "' resolves to " + address.getHostAddress()
                            + " in blocked range " + range);
                }
            }
        }
        return Optional.empty();
    }

    private static String stripBrackets(String host) {
        if (host.startsWith("[") && host.endsWith("]")) {
            return host.substring(1, host.length() - 1);
        }
        return host;
    }
}
