package com.roster.matching.similarity;

/**
 * Normalized edit-distance ratio: {@code 1 - distance / max(length)}.
 * "robert" vs "roberto" scores 6/7; "bob" vs "bobby" scores 0.6.
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

        int distance = distance(s1, s2);
        int maxLength = Math.max(s1.length(), s2.length());
        return 1.0 - ((double) distance / maxLength);
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    /**
     * Wagner-Fischer with two rolling rows sized to the shorter string.
     */
    int distance(String s1, String s2) {
        String shorter = s1.length() <= s2.length() ? s1 : s2;
        String longer = shorter == s1 ? s2 : s1;

        int m = shorter.length();
        int[] previous = new int[m + 1];
        int[] current = new int[m + 1];
        for (int i = 0; i <= m; i++) {
            previous[i] = i;
        }

        for (int j = 1; j <= longer.length(); j++) {
            current[0] = j;
            char c = longer.charAt(j - 1);
            for (int i = 1; i <= m; i++) {
                int cost = shorter.charAt(i - 1) == c ? 0 : 1;
                current[i] = Math.min(
                        Math.min(current[i - 1] + 1, previous[i] + 1),
                        previous[i - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[m];
    }
}
