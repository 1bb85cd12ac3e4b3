package io.github.nabilcarel.gateway.util;

import lombok.experimental.UtilityClass;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

@UtilityClass
public class PathSegments {

    private static final Pattern SEPARATOR = Pattern.compile("[/\\\\]");
    private static final int MAX_DECODE_DEPTH = 3;

    /**
     * Whether a raw request sub-path stays below the base it is appended to: no
     * {@code .} or {@code ..} segment, whether written literally or percent-encoded
     * (up to three times over).
     */
    public static boolean isSafeRelativePath(String rawPath) {
        return rawPath == null || isSafe(rawPath, 0);
    }

    private static boolean isSafe(String path, int depth) {
        for (String segment : SEPARATOR.split(path, -1)) {
            if (".".equals(segment) || "..".equals(segment)) {
                return false;
            }
            if (depth < MAX_DECODE_DEPTH && segment.indexOf('%') >= 0) {
                String decoded;
                try {
                    decoded = UriUtils.decode(segment, StandardCharsets.UTF_8);
                } catch (IllegalArgumentException ex) {
                    // a malformed escape never decodes to a dot segment
                    continue;
                }
                if (!isSafe(decoded, depth + 1)) {
                    return false;
                }
            }
        }
        return true;
    }
}
