package com.locode.resolution.similarity;

import java.util.Locale;

/**
 * Outcome of scoring a test name against the names of one code.
 *
 * @param score       the score; 1.0 for exact, up to the containment ceiling for contained names
 * @param tier        the rule that fired
 * @param matchedName the alternative name that produced the score, or null
 */
public record NameScore(double score, NameMatchTier tier, String matchedName) {

    public static NameScore none() {
        return new NameScore(0.0, NameMatchTier.NONE, null);
    }

    @Override
    public String toString() {
        if (matchedName == null) {
            return String.format(Locale.ROOT, "%s %.3f", tier, score);
        }
        return String.format(Locale.ROOT, "%s '%s' %.3f", tier, matchedName, score);
    }
}
