package com.locode.resolution.match;

import java.util.List;
import java.util.Optional;

/**
 * Structural hints understood by the matcher, with the query tags that select them.
 */
public enum QueryComponent {
    /**
     * Parent state (country), by code or name.
     */
    STATE(List.of("ST", "CO")),

    /**
     * Subdivision within the state, by code or name.
     */
    SUBDIVISION(List.of("SD")),

    /**
     * Reference coordinates as {@code "lat lon"}; scored only when distances are enabled.
     */
    COORDINATES(List.of("XY"));

    private final List<String> tags;

    QueryComponent(List<String> tags) {
        this.tags = tags;
    }

    public static Optional<QueryComponent> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = Query.normalizeTag(tag);
        for (QueryComponent component : values()) {
            if (component.tags.contains(normalized)) {
                return Optional.of(component);
            }
        }
        return Optional.empty();
    }
}
