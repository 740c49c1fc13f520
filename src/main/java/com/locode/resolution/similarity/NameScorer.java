package com.locode.resolution.similarity;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.locode.resolution.core.model.Code;

import java.util.List;
import java.util.Objects;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Scores a free-text name against the alternative names of a code.
 *
 * <p>Rules are evaluated in order over all alternative names; the first rule that applies wins:</p>
 * <ol>
 *   <li>empty test name: 0</li>
 *   <li>equal to an alternative name: 1.0</li>
 *   <li>whole word of an alternative name: {@code explicitMatchScore}</li>
 *   <li>an alternative name is contained in the test name:
 *       {@code max(explicitMatchScore, containmentMultiplier * len(name) / len(test))}, best over all names</li>
 *   <li>otherwise {@code fuzzyScale * 100 * max(similarity)}, where similarity comes from the
 *       configured {@link SimilarityAlgorithm} ({@link TokenSortSimilarity} by default)</li>
 * </ol>
 *
 * <p>All comparisons ignore case. The whole-word pattern of a test name is compiled once and
 * reused for every candidate it is scored against.</p>
 */
public class NameScorer {

    private static final NameScorer DEFAULT = new NameScorer(NameScoringWeights.defaults());
    private static final int PATTERN_CACHE_SIZE = 1_024;

    private final NameScoringWeights weights;
    private final SimilarityAlgorithm similarity;
    private final Cache<String, Pattern> wholeWordPatterns;

    public NameScorer(NameScoringWeights weights) {
        this(weights, new TokenSortSimilarity());
    }

    public NameScorer(NameScoringWeights weights, SimilarityAlgorithm similarity) {
        this.weights = Objects.requireNonNull(weights, "weights is required");
        this.similarity = Objects.requireNonNull(similarity, "similarity is required");
        this.wholeWordPatterns = Caffeine.newBuilder()
                .maximumSize(PATTERN_CACHE_SIZE)
                .build();
    }

    public static NameScorer defaultScorer() {
        return DEFAULT;
    }

    public NameScore score(Code code, String testName) {
        return score(code.getAlternativeNames(), testName);
    }

    public NameScore score(List<String> names, String testName) {
        if (testName == null || testName.isBlank() || names.isEmpty()) {
            return NameScore.none();
        }
        String test = testName.trim();
        String lowerTest = test.toLowerCase(Locale.ROOT);

        for (String name : names) {
            if (name.toLowerCase(Locale.ROOT).equals(lowerTest)) {
                return new NameScore(1.0, NameMatchTier.EXACT, name);
            }
        }

        Pattern wholeWord = wholeWordPattern(test);
        for (String name : names) {
            if (wholeWord.matcher(name).find()) {
                return new NameScore(weights.explicitMatchScore(), NameMatchTier.WHOLE_WORD, name);
            }
        }

        NameScore contained = null;
        for (String name : names) {
            String lowerName = name.toLowerCase(Locale.ROOT);
            if (lowerTest.contains(lowerName)) {
                double score = Math.max(weights.explicitMatchScore(),
                        weights.containmentMultiplier() * lowerName.length() / lowerTest.length());
                if (contained == null || score > contained.score()) {
                    contained = new NameScore(score, NameMatchTier.CONTAINED, name);
                }
            }
        }
        if (contained != null) {
            return contained;
        }

        double best = -1.0;
        String bestName = null;
        for (String name : names) {
            double similarity = this.similarity.compute(test, name);
            if (similarity > best) {
                best = similarity;
                bestName = name;
            }
        }
        return new NameScore(weights.fuzzyScale() * 100 * best, NameMatchTier.FUZZY, bestName);
    }

    Pattern wholeWordPattern(String test) {
        return wholeWordPatterns.get(test, key -> Pattern.compile("\\b" + Pattern.quote(key) + "\\b",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS));
    }
}
