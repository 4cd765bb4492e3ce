package com.event.reconciliation.similarity;

/**
 * Edit-distance ratio: {@code (maxLength - distance) / maxLength}.
 * Case sensitive; callers canonicalize first. For strings of a fixed length the score strictly
 * decreases as the edit distance grows.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        int maxLength = Math.max(s1.length(), s2.length());
        return (double) (maxLength - distance(s1, s2)) / maxLength;
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    /**
     * Levenshtein edit distance (insertions, deletions, substitutions), two-row dynamic programming.
     */
    public static int distance(String s1, String s2) {
        String shorter = s1.length() <= s2.length() ? s1 : s2;
        String longer = shorter == s1 ? s2 : s1;

        int[] previous = new int[shorter.length() + 1];
        int[] current = new int[shorter.length() + 1];
        for (int i = 0; i <= shorter.length(); i++) {
            previous[i] = i;
        }

        for (int j = 1; j <= longer.length(); j++) {
            current[0] = j;
            char c = longer.charAt(j - 1);
            for (int i = 1; i <= shorter.length(); i++) {
                int substitution = previous[i - 1] + (shorter.charAt(i - 1) == c ? 0 : 1);
                current[i] = Math.min(substitution, Math.min(previous[i], current[i - 1]) + 1);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[shorter.length()];
    }
}
