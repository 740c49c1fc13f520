package com.locode.resolution.similarity;

/**
 * The rule of the name-scoring ladder that produced a score.
 */
public enum NameMatchTier {
    /**
     * Empty test name, or a code without names.
     */
    NONE,

    /**
     * Test name equals an alternative name (ignoring case). Score 1.0.
     */
    EXACT,

    /**
     * Test name occurs as a whole word inside an alternative name.
     */
    WHOLE_WORD,

    /**
     * An alternative name is contained in the test name.
     */
    CONTAINED,

    /**
     * Scaled token-sort similarity. Kept below the explicit tiers.
     */
    FUZZY;

    /**
     * Returns true for the tiers that matched a name explicitly rather than by similarity.
     */
    public boolean isExplicit() {
        return this == EXACT || this == WHOLE_WORD || this == CONTAINED;
    }
}
