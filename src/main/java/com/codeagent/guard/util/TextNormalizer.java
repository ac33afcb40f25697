package com.codeagent.guard.util;

import java.util.Locale;

public final class TextNormalizer {
    private static final String ALLOWED_PUNCTUATION = " \n\t.,!?-_'\"";

    private TextNormalizer() {
    }

    public static String orEmpty(String input) {
        return input == null ? "" : input;
    }

    public static String lower(String input) {
        return orEmpty(input).toLowerCase(Locale.ROOT);
    }

    /** Backslashes become forward slashes and the result is lower-cased. */
    public static String normalizePath(String input) {
        return lower(input).replace('\\', '/');
    }

    public static String normalizeBlockedPath(String entry) {
        String normalized = normalizePath(entry).trim();
        return normalized.startsWith("~") ? normalized.substring(1) : normalized;
    }

    public static int length(String input) {
        String text = orEmpty(input);
        return text.codePointCount(0, text.length());
    }

    public static boolean containsNul(String input) {
        return orEmpty(input).indexOf('\0') >= 0;
    }

    /**
     * Share of code points that are neither letters, digits, nor one of the allowed punctuation marks.
     * Empty text has a ratio of zero.
     */
    public static double specialCharacterRatio(String input) {
        String text = orEmpty(input);
        if (text.isEmpty()) {
            return 0.0;
        }
        long total = text.codePoints().count();
        long special = text.codePoints()
                .filter(codePoint -> !Character.isLetterOrDigit(codePoint))
                .filter(codePoint -> ALLOWED_PUNCTUATION.indexOf(codePoint) < 0)
                .count();
        return (double) special / Math.max(total, 1);
    }
}
