package com.forensic.anomaly.util;

/**
 * Normalized edit-distance similarity between two vendor names.
 * <p>
 * Uses the InDel distance (Levenshtein with substitutions costing two edits), normalized
 * by the combined length: {@code 1 - indel(a, b) / (|a| + |b|)}. The result is in [0, 1],
 * 1 meaning identical strings. Appending a suffix such as " Inc" or a trailing period
 * costs less than with plain Levenshtein, which is what near-duplicate vendor entries look like.
 */
public final class VendorSimilarity {

    private VendorSimilarity() {
    }

    /**
     * Similarity score of two strings, compared exactly as given (callers case-fold first).
     *
     * @return score in [0, 1]; two empty strings score 1
     */
    public static double score(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 1.0 - (double) indelDistance(a, b) / total;
    }

    /**
     * Minimum number of single-character insertions and deletions turning {@code a} into {@code b}.
     */
    public static int indelDistance(String a, String b) {
        return a.length() + b.length() - 2 * longestCommonSubsequence(a, b);
    }

    // two-row DP, O(|a| * |b|) time, O(min) space
    private static int longestCommonSubsequence(String a, String b) {
        if (a.length() < b.length()) {
            String tmp = a;
            a = b;
            b = tmp;
        }
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];

        for (int i = 1; i <= a.length(); i++) {
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                if (ca == b.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
