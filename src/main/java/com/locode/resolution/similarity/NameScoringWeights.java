package com.locode.resolution.similarity;

/**
 * Tuned constants of the name-scoring ladder.
 *
 * @param explicitMatchScore    score of a whole-word match, and floor of a containment match
 * @param containmentMultiplier factor applied to {@code len(name) / len(test)} for contained names
 * @param fuzzyScale            factor applied to the 0..100 token-sort similarity
 */
public record NameScoringWeights(
        double explicitMatchScore,
        double containmentMultiplier,
        double fuzzyScale
) {
    public NameScoringWeights {
        if (explicitMatchScore <= 0 || explicitMatchScore > 1.0) {
            throw new IllegalArgumentException("explicitMatchScore must be in (0, 1], got " + explicitMatchScore);
        }
        if (containmentMultiplier <= 0) {
            throw new IllegalArgumentException("containmentMultiplier must be positive");
        }
        if (fuzzyScale < 0) {
            throw new IllegalArgumentException("fuzzyScale must be non-negative");
        }
        // A perfect fuzzy score may reach the explicit floor but never pass it.
        if (fuzzyScale * 100 > explicitMatchScore + 1e-9) {
            throw new IllegalArgumentException(
                    "fuzzyScale * 100 must not exceed explicitMatchScore, got " + fuzzyScale * 100);
        }
    }

    /**
     * The historical weights: 0.9 explicit score, 1.4 containment multiplier, 0.009 fuzzy scale.
     */
    public static NameScoringWeights defaults() {
        return new NameScoringWeights(0.9, 1.4, 0.009);
    }
}
