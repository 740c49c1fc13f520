package com.locode.resolution.similarity;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Order-independent token similarity.
 *
 * <p>Both strings are reduced to lower-case alphanumeric tokens, the tokens are sorted
 * and re-joined, and the results are compared with an insertion/deletion edit ratio:
 * {@code 2 * LCS / (len1 + len2)}, where LCS is the longest common subsequence.</p>
 */
public class TokenSortSimilarity implements SimilarityAlgorithm {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public double compute(String s1, String s2) {
        return ratio(s1, s2) / 100.0;
    }

    /**
     * Similarity on the 0..100 integer scale.
     */
    public int ratio(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0;
        }
        String sorted1 = sortTokens(s1);
        String sorted2 = sortTokens(s2);
        if (sorted1.isEmpty() || sorted2.isEmpty()) {
            return 0;
        }
        if (sorted1.equals(sorted2)) {
            return 100;
        }

        int lcs = longestCommonSubsequence(sorted1, sorted2);
        double ratio = 2.0 * lcs / (sorted1.length() + sorted2.length());
        return (int) Math.round(ratio * 100);
    }

    static String sortTokens(String s) {
        String processed = NON_ALPHANUMERIC.matcher(s).replaceAll(" ")
                .toLowerCase(Locale.ROOT)
                .trim();
        if (processed.isEmpty()) {
            return "";
        }
        String[] tokens = WHITESPACE.split(processed);
        Arrays.sort(tokens);
        return String.join(" ", tokens);
    }

    /**
     * Classic dynamic programming LCS with two rolling rows.
     */
    private int longestCommonSubsequence(String s1, String s2) {
        if (s1.length() > s2.length()) {
            String temp = s1;
            s1 = s2;
            s2 = temp;
        }

        int m = s1.length();
        int n = s2.length();

        int[] previousRow = new int[m + 1];
        int[] currentRow = new int[m + 1];

        for (int j = 1; j <= n; j++) {
            currentRow[0] = 0;
            for (int i = 1; i <= m; i++) {
                if (s1.charAt(i - 1) == s2.charAt(j - 1)) {
                    currentRow[i] = previousRow[i - 1] + 1;
                } else {
                    currentRow[i] = Math.max(currentRow[i - 1], previousRow[i]);
                }
            }

            int[] temp = previousRow;
            previousRow = currentRow;
            currentRow = temp;
        }

        return previousRow[m];
    }
}
