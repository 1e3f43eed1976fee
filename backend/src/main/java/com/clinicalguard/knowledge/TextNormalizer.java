package com.clinicalguard.knowledge;

import java.util.Locale;

/**
 * Case and whitespace folding used for every text comparison against the
 * knowledge base.
 */
public final class TextNormalizer {

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    /**
     * True if {@code needle} occurs in {@code haystack} starting at a word boundary.
     * "nitro" matches "nitroglycerin" but not "dinitrate".
     */
    public static boolean containsWordPrefix(String haystack, String needle) {
        return indexOfWord(normalize(haystack), normalize(needle), false) >= 0;
    }

    static int indexOfWord(String haystack, String needle, boolean wholeWord) {
        if (needle.isEmpty() || haystack.length() < needle.length()) {
            return -1;
        }
        int from = 0;
        while (true) {
            int idx = haystack.indexOf(needle, from);
            if (idx < 0) {
                return -1;
            }
            boolean startOk = idx == 0 || !Character.isLetterOrDigit(haystack.charAt(idx - 1));
            int end = idx + needle.length();
            boolean endOk = !wholeWord || end == haystack.length()
                || !Character.isLetterOrDigit(haystack.charAt(end));
            if (startOk && endOk) {
                return idx;
            }
            from = idx + 1;
        }
    }
}
