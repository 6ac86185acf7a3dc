package com.eainde.manuscript.collaborator;

import com.eainde.manuscript.governance.tone.ToneLinter;
import com.eainde.manuscript.model.ToneFlag;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline rewriter: replaces every fail-severity term with its policy suggestion (or the caller's
 * guidance), keeping the case shape of the original word. Bracketed citations are copied verbatim.
 */
public class SuggestionTextRewriter implements TextRewriter {

    private static final Pattern CITATION = Pattern.compile("\\[[^\\]]*]+");

    private final ToneLinter linter;

    public SuggestionTextRewriter(ToneLinter linter) {
        this.linter = linter;
    }

    @Override
    public String rewrite(String sentence, String suggestion) {
        StringBuilder out = new StringBuilder();
        Matcher citations = CITATION.matcher(sentence);
        int cursor = 0;
        while (citations.find()) {
            out.append(replace(sentence.substring(cursor, citations.start()), suggestion));
            out.append(citations.group());
            cursor = citations.end();
        }
        out.append(replace(sentence.substring(cursor), suggestion));
        return out.toString();
    }

    private String replace(String text, String guidance) {
        List<ToneFlag> fails = linter.lint(text).stream().filter(ToneFlag::failing).toList();
        if (fails.isEmpty()) {
            return text;
        }
        StringBuilder out = new StringBuilder();
        int cursor = 0;
        for (ToneFlag flag : fails) {
            out.append(text, cursor, flag.start());
            String replacement = flag.suggestion() != null ? flag.suggestion() : guidance;
            out.append(matchCase(flag.word(), replacement));
            cursor = flag.end();
        }
        out.append(text.substring(cursor));
        return out.toString();
    }

    static String matchCase(String original, String replacement) {
        if (replacement == null || replacement.isEmpty()) {
            return "";
        }
        if (original.length() > 1 && original.equals(original.toUpperCase(Locale.ROOT))) {
            return replacement.toUpperCase(Locale.ROOT);
        }
        if (Character.isUpperCase(original.charAt(0))) {
            return Character.toUpperCase(replacement.charAt(0)) + replacement.substring(1);
        }
        return replacement;
    }
}
