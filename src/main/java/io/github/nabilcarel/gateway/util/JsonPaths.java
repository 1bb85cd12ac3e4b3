package io.github.nabilcarel.gateway.util;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Navigation of JSON trees by dotted paths. Array elements are addressed either as a
 * numeric segment ({@code items.0.id}) or with brackets ({@code items[0].id}).
 */
@UtilityClass
public class JsonPaths {

    public static List<String> segments(String path) {
        List<String> segments = new ArrayList<>();
        if (path == null) {
            return segments;
        }
        for (String part : path.split("\\.")) {
            if (part.isEmpty()) {
                continue;
            }
            int bracket = part.indexOf('[');
            String head = bracket >= 0 ? part.substring(0, bracket) : part;
            if (!head.isEmpty()) {
                segments.add(head);
            }
            if (bracket >= 0) {
                Matcher matcher = Patterns.INDEX_PATTERN.matcher(part.substring(bracket));
                while (matcher.find()) {
                    segments.add(matcher.group(1));
                }
            }
        }
        return segments;
    }

    /**
     * Returns the node at {@code path}, or empty when any segment is missing. An empty
     * path returns the root itself. A JSON null present at the path is returned as found.
     */
    public static Optional<JsonNode> navigate(JsonNode root, String path) {
        if (root == null || root.isMissingNode()) {
            return Optional.empty();
        }
        JsonNode current = root;
        for (String segment : segments(path)) {
            if (current.isArray()) {
                Integer index = parseIndex(segment);
                if (index == null || index >= current.size()) {
                    return Optional.empty();
                }
                current = current.get(index);
            } else if (current.isObject()) {
                JsonNode next = current.get(segment);
                if (next == null) {
                    return Optional.empty();
                }
                current = next;
            } else {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    private static Integer parseIndex(String segment) {
        if (segment.isEmpty() || !segment.chars().allMatch(Character::isDigit)) {
            return null;
        }
        try {
            return Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
