package com.locode.resolution.match;

import com.locode.resolution.core.model.CodeType;

/**
 * The slice of the catalog a matcher searches.
 *
 * @param codeType  the candidate type, or null for every type
 * @param state     restricts candidates to one state, or null for all states
 * @param distances whether coordinate scoring and nearest-point search are available
 */
public record MatcherScope(CodeType codeType, String state, boolean distances) {

    public static MatcherScope all() {
        return new MatcherScope(null, null, false);
    }

    /**
     * Short label used in logs and metrics tags.
     */
    public String label() {
        String type = codeType != null ? codeType.name() : "ALL";
        return state != null ? type + "@" + state : type;
    }
}
