package io.github.nabilcarel.gateway.config;

import io.github.nabilcarel.gateway.model.context.SharedValueScope;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "gateway")
@Getter
@Setter
public class GatewayProperties {

    /**
     * Directory holding one sub-directory per endpoint, each with an {@code entity.json}.
     */
    private String endpointsDirectory = "endpoints";

    /**
     * Public base URL used when rewriting backend URLs. When unset it is derived
     * from the inbound request.
     */
    private String publicBaseUrl;

    private Composite composite = new Composite();

    private Cache cache = new Cache();

    private Environments environments = new Environments();

    private Security security = new Security();

    @Getter
    @Setter
    public static class Composite {
        /**
         * Maximum length of a dependsOn chain.
         */
        private int maxDepth = 10;

        /**
         * Raw backend bodies longer than this are truncated in errorDetail.
         */
        private int errorDetailMaxLength = 500;

        /**
         * Whether $guid values are shared across the whole request or per step.
         */
        private SharedValueScope sharedValueScope = SharedValueScope.REQUEST;

        /**
         * Upper bound for a whole composite execution.
         */
        private Duration requestTimeout = Duration.ofSeconds(120);
    }

    @Getter
    @Setter
    public static class Cache {
        private boolean enabled = true;

        private CacheProvider provider = CacheProvider.MEMORY;

        /**
         * TTL used when neither the backend nor the endpoint specify one.
         */
        private Duration defaultDuration = Duration.ofMinutes(5);

        /**
         * Endpoint-specific TTLs keyed by endpoint name.
         */
        private Map<String, Duration> endpointDurations = new HashMap<>();

        /**
         * Cache-Control value added to GET responses that carry none.
         */
        private String defaultCacheControl = "public, max-age=300";

        private List<String> cacheableContentTypes = new ArrayList<>(List.of(
                "application/json",
                "application/xml",
                "text/xml",
                "text/plain",
                "text/html",
                "text/csv"));

        /**
         * Upper bound on entries held by the in-memory store.
         */
        private long maxEntries = 10_000;

        private Lock lock = new Lock();

        private Redis redis = new Redis();
    }

    @Getter
    @Setter
    public static class Lock {
        private Duration leaseTime = Duration.ofSeconds(30);
        private Duration maxWait = Duration.ofSeconds(10);
        private Duration pollInterval = Duration.ofMillis(200);
    }

    @Getter
    @Setter
    public static class Redis {
        private String address = "redis://localhost:6379";
        private String password;
        private int database = 0;

        /**
         * Prefix applied to every key the gateway writes.
         */
        private String keyPrefix = "gateway:";
    }

    @Getter
    @Setter
    public static class Environments {
        /**
         * Environments the gateway serves. Empty means every environment.
         */
        private List<String> allowed = new ArrayList<>();

        /**
         * Extra headers sent to backends, per environment.
         */
        private Map<String, Map<String, String>> headers = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Security {
        /**
         * Inbound headers forwarded to backends in addition to the standard auth headers.
         */
        private List<String> additionalAuthHeaders = new ArrayList<>();

        /**
         * Hosts proxied backends may live on. A listed host is never range-checked; when
         * the list is not empty every other host is refused.
         */
        private List<String> allowedHosts = new ArrayList<>();

        /**
         * CIDR ranges a proxied backend host must not resolve into.
         */
        private List<String> blockedIpRanges = new ArrayList<>(List.of(
                "10.0.0.0/8",
                "172.16.0.0/12",
                "192.168.0.0/16",
                "169.254.0.0/16"));

        /**
         * Headers added to every response that does not already carry them.
         */
        private Map<String, String> responseHeaders = defaultResponseHeaders();

        private static Map<String, String> defaultResponseHeaders() {
            Map<String, String> headers = new LinkedHashMap<>();
            headers.put("X-Content-Type-Options", "nosniff");
            headers.put("X-Frame-Options", "DENY");
            headers.put("Content-Security-Policy", "default-src 'self'");
            headers.put("Referrer-Policy", "strict-origin-when-cross-origin");
            headers.put("X-XSS-Protection", "1; mode=block");
            return headers;
        }
    }

    public enum CacheProvider {
        MEMORY,
        REDIS
    }
}
