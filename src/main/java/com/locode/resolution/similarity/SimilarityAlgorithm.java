package com.locode.resolution.similarity;

/**
 * Fuzzy similarity used by {@link NameScorer} once no explicit name tier applies.
 * Implementations return a value between 0.0 (unrelated) and 1.0 (same tokens).
 */
@FunctionalInterface
public interface SimilarityAlgorithm {

    double compute(String testName, String candidateName);
}
