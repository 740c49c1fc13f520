package com.locode.resolution.match;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses a token sequence into a {@link Query}.
 *
 * <p>A token of the form {@code [TAG]} switches the current component for the tokens
 * that follow; leading untagged tokens belong to the name component. For example
 * {@code Springfield [CO] US} becomes {@code {name=Springfield, CO=US}}.</p>
 */
public final class QueryParser {

    private QueryParser() {
    }

    public static Query parse(String text) {
        if (text == null || text.isBlank()) {
            return Query.builder().build();
        }
        return parse(Arrays.asList(text.trim().split("\\s+")));
    }

    public static Query parse(List<String> tokens) {
        Map<String, List<String>> parts = new LinkedHashMap<>();
        String current = Query.NAME;
        parts.put(current, new ArrayList<>());

        for (String token : tokens) {
            if (isTag(token)) {
                current = Query.normalizeTag(token.substring(1, token.length() - 1));
                // Repeating a tag restarts its value
                parts.put(current, new ArrayList<>());
            } else if (token != null && !token.isEmpty()) {
                parts.get(current).add(token);
            }
        }

        Query.Builder builder = Query.builder();
        parts.forEach((tag, words) -> {
            if (!words.isEmpty()) {
                builder.component(tag, String.join(" ", words));
            }
        });
        return builder.build();
    }

    static boolean isTag(String token) {
        return token != null && token.length() > 2
                && token.charAt(0) == '[' && token.charAt(token.length() - 1) == ']'
                && !token.substring(1, token.length() - 1).isBlank();
    }
}
