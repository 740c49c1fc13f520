package com.locode.resolution.core.model;

import java.util.List;

/**
 * Result of matching a query against a code.
 * The trace lists the scoring decisions in evaluation order and is only meant for display.
 */
public record MatchResult(
        Code code,
        double score,
        List<TraceStep> trace
) {
    public MatchResult {
        if (Double.isNaN(score)) {
            throw new IllegalArgumentException("score must be a number");
        }
        trace = trace != null ? List.copyOf(trace) : List.of();
    }

    /**
     * Creates a no-match result.
     */
    public static MatchResult noMatch() {
        return new MatchResult(null, 0.0, List.of());
    }

    /**
     * Returns true if this result carries a code.
     */
    public boolean hasMatch() {
        return code != null;
    }
}
