package com.eainde.manuscript.nodes;

import java.util.Locale;

/**
 * Cheap heuristics for source text that did not come out of OCR or conversion in readable form.
 */
final class TextQuality {

    private static final double MIN_ALNUM_RATIO = 0.3;
    private static final double MAX_SPECIAL_RATIO = 0.5;
    private static final String ORDINARY_PUNCTUATION = ".,;:!?'\"-()|/%";

    private TextQuality() {
    }

    /** JSON input is structured and never judged garbled. */
    static boolean looksGarbled(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String trimmed = text.trim();
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
            return false;
        }
        return hasTripledWord(trimmed) || alnumRatio(trimmed) < MIN_ALNUM_RATIO
                || specialRatio(trimmed) > MAX_SPECIAL_RATIO;
    }

    static boolean hasTripledWord(String text) {
        String[] words = text.toLowerCase(Locale.ROOT).split("\\s+");
        for (int i = 2; i < words.length; i++) {
            if (words[i].equals(words[i - 1]) && words[i].equals(words[i - 2])) {
                return true;
            }
        }
        return false;
    }

    static double alnumRatio(String text) {
        int visible = 0;
        int alnum = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                continue;
            }
            visible++;
            if (Character.isLetterOrDigit(c)) {
                alnum++;
            }
        }
        return visible == 0 ? 1.0 : (double) alnum / visible;
    }

    static double specialRatio(String text) {
        int special = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isLetterOrDigit(c) && !Character.isWhitespace(c) && ORDINARY_PUNCTUATION.indexOf(c) < 0) {
                special++;
            }
        }
        return (double) special / text.length();
    }
}
