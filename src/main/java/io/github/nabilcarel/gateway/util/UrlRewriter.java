package io.github.nabilcarel.gateway.util;

import lombok.experimental.UtilityClass;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Textual replacement of a backend location with its public counterpart.
 * <p>
 * A match must start at a URL boundary and end where the host, port or path segment
 * ends, so {@code http://host:80} never matches inside {@code http://host:8080} and
 * {@code /svc} never matches inside {@code /services}. Default ports are matched both
 * written and omitted, and JSON-escaped slashes ({@code \/}) are handled.
 */
@UtilityClass
public class UrlRewriter {

    private static final String LEADING_BOUNDARY = "(?<![A-Za-z0-9+.\\-])";
    private static final String TRAILING_BOUNDARY = "(?![A-Za-z0-9_\\-.:~%])";

    public static String rewrite(String content, String originHost, String originPath,
                                 String publicHost, String publicPath) {
        if (content == null || content.isEmpty() || originHost == null || originHost.isBlank()) {
            return content;
        }
        String target = trimTrailingSlash(publicHost) + normalizePath(publicPath);
        String result = content;
        for (Map.Entry<String, String> variant : originVariants(originHost, originPath, target).entrySet()) {
            if (!result.contains(variant.getKey())) {
                continue;
            }
            Pattern pattern = Pattern.compile(LEADING_BOUNDARY + Pattern.quote(variant.getKey()) + TRAILING_BOUNDARY);
            result = pattern.matcher(result).replaceAll(Matcher.quoteReplacement(variant.getValue()));
        }
        return result;
    }

    /**
     * Rewrites {@code originUrl} (scheme, host, optional port and path) to {@code publicUrl}.
     */
    public static String rewrite(String content, String originUrl, String publicUrl) {
        if (originUrl == null || originUrl.isBlank()) {
            return content;
        }
        URI origin = URI.create(originUrl.trim());
        URI target = URI.create(publicUrl.trim());
        return rewrite(content, hostPart(origin), origin.getRawPath(), hostPart(target), target.getRawPath());
    }

    public static String hostPart(URI uri) {
        String host = uri.getScheme() + "://" + uri.getRawAuthority();
        return trimTrailingSlash(host);
    }

    private static Map<String, String> originVariants(String originHost, String originPath, String target) {
        String host = trimTrailingSlash(originHost);
        String path = normalizePath(originPath);
        Map<String, String> variants = new LinkedHashMap<>();
        variants.put(host + path, target);

        String alternateHost = alternateDefaultPortForm(host);
        if (alternateHost != null) {
            variants.put(alternateHost + path, target);
        }
        for (String form : new LinkedHashMap<>(variants).keySet()) {
            variants.put(form.replace("/", "\\/"), target.replace("/", "\\/"));
        }
        return variants;
    }

    /**
     * For {@code http://h} returns {@code http://h:80} and the other way round; null when
     * the host carries a non-default port.
     */
    private static String alternateDefaultPortForm(String host) {
        URI uri;
        try {
            uri = URI.create(host);
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            return null;
        }
        int defaultPort = "https".equalsIgnoreCase(uri.getScheme()) ? 443
                : "http".equalsIgnoreCase(uri.getScheme()) ? 80 : -1;
        if (defaultPort < 0) {
            return null;
        }
        String bare = uri.getScheme() + "://" + (uri.getRawUserInfo() != null ? uri.getRawUserInfo() + "@" : "") + uri.getHost();
        if (uri.getPort() == -1) {
            return bare + ":" + defaultPort;
        }
        return uri.getPort() == defaultPort ? bare : null;
    }

    private static String normalizePath(String path) {
        if (path == null || path.isBlank() || "/".equals(path)) {
            return "";
        }
        String normalized = path.startsWith("/") ? path : "/" + path;
        return trimTrailingSlash(normalized);
    }

    private static String trimTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        String result = value.trim();
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
