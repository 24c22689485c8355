package eu.virtualparadox.retrieval.rag.text;

import java.util.Locale;

/**
 * Character-level helpers for Thai script (U+0E00..U+0E7F).
 */
public final class ThaiText {

    private static final char THAI_START = '\u0E00';
    private static final char THAI_END = '\u0E7F';

    /** Tone marks, thanthakhat and maitaikhu. */
    private static final String TONE_MARKS = "่้๊๋์็";

    /** Vowel signs that vary freely between spellings of the same word. */
    private static final String VOWELS = "ะาิีึืุูเแโใไ";

    private ThaiText() {
        // prevent instantiation
    }

    public static boolean isThai(final char c) {
        return c >= THAI_START && c <= THAI_END;
    }

    public static boolean containsThai(final String text) {
        if (text == null) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (isThai(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return share of Thai characters in the text, 0 for null or empty input
     */
    public static double density(final String text) {
        if (text == null || text.isEmpty()) {
            return 0.0;
        }
        int thai = 0;
        for (int i = 0; i < text.length(); i++) {
            if (isThai(text.charAt(i))) {
                thai++;
            }
        }
        return thai / (double) text.length();
    }

    /**
     * Tone-, vowel- and space-insensitive form used for fuzzy comparison of Thai words.
     */
    public static String fold(final String text) {
        final StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (Character.isWhitespace(c) || TONE_MARKS.indexOf(c) >= 0 || VOWELS.indexOf(c) >= 0) {
                continue;
            }
            sb.append(Character.toLowerCase(c));
        }
        return sb.toString();
    }

    /**
     * Case- and tone-insensitive form for literal matching. Vowels are kept and whitespace runs
     * collapse to a single space, so a literal only matches the same spelled word.
     */
    public static String literalForm(final String text) {
        final StringBuilder sb = new StringBuilder(text.length());
        boolean pendingSpace = false;
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                pendingSpace = sb.length() > 0;
                continue;
            }
            if (TONE_MARKS.indexOf(c) >= 0) {
                continue;
            }
            if (pendingSpace) {
                sb.append(' ');
                pendingSpace = false;
            }
            sb.append(c);
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    public static String stripSpaces(final String text) {
        final StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (!Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
