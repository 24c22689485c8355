package eu.virtualparadox.retrieval.util;

/**
 * Edit-distance based string similarity.
 */
public final class StringSimilarity {

    private StringSimilarity() {
        // prevent instantiation
    }

    /**
     * Classic Levenshtein distance (insert, delete, substitute all cost 1).
     */
    public static int levenshtein(final String a, final String b) {
        if (a.equals(b)) {
            return 0;
        }
        if (a.isEmpty()) {
            return b.length();
        }
        if (b.isEmpty()) {
            return a.length();
        }

        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            final char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                final int cost = ca == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            final int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    /**
     * Levenshtein similarity normalized by the longer string: {@code (maxLen - distance) / maxLen}.
     *
     * @return value in [0,1]; two empty strings are identical (1.0)
     */
    public static double similarity(final String a, final String b) {
        final int maxLength = Math.max(a.length(), b.length());
        if (maxLength == 0) {
            return 1.0;
        }
        return (maxLength - levenshtein(a, b)) / (double) maxLength;
    }
}
