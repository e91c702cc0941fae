package com.entity.pipeline.similarity;

/**
 * Optimal string alignment distance (restricted Damerau-Levenshtein): insertions, deletions,
 * substitutions and transpositions of adjacent characters each cost 1. A swapped letter pair,
 * the most common typing and OCR error in names, counts as one edit.
 */
public class OptimalStringAlignment implements SimilarityAlgorithm {

    @Override
    public int distance(String s1, String s2) {
        return boundedDistance(s1, s2, Integer.MAX_VALUE - 1);
    }

    /**
     * Three-row dynamic programme. Stops as soon as every cell of a row exceeds the bound.
     */
    @Override
    public int boundedDistance(String s1, String s2, int maxDistance) {
        if (s1 == null || s2 == null) {
            throw new IllegalArgumentException("Strings must not be null");
        }
        if (s1.equals(s2)) {
            return 0;
        }
        // Ensure s1 is the shorter string for space optimization
        if (s1.length() > s2.length()) {
            String temp = s1;
            s1 = s2;
            s2 = temp;
        }
        int m = s1.length();
        int n = s2.length();
        if (n - m > maxDistance) {
            return maxDistance + 1;
        }
        if (m == 0) {
            return n;
        }

        int[] twoBack = new int[m + 1];
        int[] previousRow = new int[m + 1];
        int[] currentRow = new int[m + 1];

        for (int i = 0; i <= m; i++) {
            previousRow[i] = i;
        }

        for (int j = 1; j <= n; j++) {
            currentRow[0] = j;
            int rowMin = currentRow[0];

            for (int i = 1; i <= m; i++) {
                int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
                int value = Math.min(
                        Math.min(currentRow[i - 1] + 1, previousRow[i] + 1),
                        previousRow[i - 1] + cost
                );
                if (i > 1 && j > 1
                        && s1.charAt(i - 1) == s2.charAt(j - 2)
                        && s1.charAt(i - 2) == s2.charAt(j - 1)) {
                    value = Math.min(value, twoBack[i - 2] + 1);
                }
                currentRow[i] = value;
                rowMin = Math.min(rowMin, value);
            }

            if (rowMin > maxDistance) {
                return maxDistance + 1;
            }

            // Rotate rows
            int[] temp = twoBack;
            twoBack = previousRow;
            previousRow = currentRow;
            currentRow = temp;
        }

        return Math.min(previousRow[m], maxDistance + 1);
    }

    @Override
    public String getName() {
        return "OptimalStringAlignment";
    }
}
