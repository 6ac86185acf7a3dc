package com.eainde.manuscript.governance.tone;

import com.eainde.manuscript.collaborator.TextRewriter;
import com.eainde.manuscript.model.ToneFlag;
import com.eainde.manuscript.state.RigorLevel;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lints text against the tone policy and, in conservative mode, rewrites failing sentences.
 *
 * <h3>Strict rewrite</h3>
 * <ol>
 * <li>Split the text into sentences on terminal punctuation followed by whitespace.</li>
 * <li>For every sentence that contains a fail match, split out citation markers ({@code [..]} and
 *     {@code [[..]]}) and send only the remaining fragments that still fail to the {@link TextRewriter}.</li>
 * <li>Re-lint the whole text. Any fail finding left raises {@link ToneGovernanceException}.</li>
 * </ol>
 * Exploratory mode records findings and returns the text unchanged.
 */
@Log4j2
public class ToneGovernor {

    static final String DEFAULT_GUIDANCE = "balanced";

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern CITATION = Pattern.compile("\\[\\[[^\\]]*]]|\\[[^\\]]*]");

    private final ToneLinter linter;
    private final TextRewriter rewriter;

    public ToneGovernor(ToneLinter linter, TextRewriter rewriter) {
        this.linter = linter;
        this.rewriter = rewriter;
    }

    public List<ToneFlag> lint(String text) {
        return linter.lint(text);
    }

    public ToneGovernanceResult govern(String text, RigorLevel rigor) {
        return govern(text, rigor, "text");
    }

    /**
     * @param location used in the error message, e.g. a block id
     * @throws ToneGovernanceException in conservative mode when fail findings survive the rewrite
     */
    public ToneGovernanceResult govern(String text, RigorLevel rigor, String location) {
        String input = text == null ? "" : text;
        List<ToneFlag> findings = linter.lint(input);
        boolean failing = findings.stream().anyMatch(ToneFlag::failing);
        if (rigor != RigorLevel.CONSERVATIVE || !failing) {
            return new ToneGovernanceResult(input, findings, findings, false);
        }

        String rewritten = rewriteFailingSentences(input, findings);
        List<ToneFlag> remaining = linter.lint(rewritten);
        List<ToneFlag> stillFailing = remaining.stream().filter(ToneFlag::failing).toList();
        if (!stillFailing.isEmpty()) {
            log.warn("TONE: {} did not converge, remaining {}", location, stillFailing);
            throw new ToneGovernanceException(location, stillFailing);
        }
        log.debug("TONE: {} rewritten, {} finding(s) resolved", location, findings.size() - remaining.size());
        return new ToneGovernanceResult(rewritten, findings, remaining, true);
    }

    private String rewriteFailingSentences(String text, List<ToneFlag> findings) {
        List<ToneFlag> fails = findings.stream().filter(ToneFlag::failing).toList();
        StringBuilder out = new StringBuilder(text.length());
        int cursor = 0;
        for (int[] sentence : sentences(text)) {
            int start = sentence[0];
            int end = sentence[1];
            out.append(text, cursor, start);
            List<ToneFlag> hits = fails.stream().filter(f -> f.start() >= start && f.start() < end).toList();
            String body = text.substring(start, end);
            out.append(hits.isEmpty() ? body : rewriteSentence(body, guidance(hits)));
            cursor = end;
        }
        out.append(text.substring(cursor));
        return out.toString();
    }

    private String rewriteSentence(String sentence, String guidance) {
        StringBuilder out = new StringBuilder(sentence.length());
        Matcher citations = CITATION.matcher(sentence);
        int cursor = 0;
        while (citations.find()) {
            out.append(rewriteFragment(sentence.substring(cursor, citations.start()), guidance));
            out.append(citations.group());
            cursor = citations.end();
        }
        out.append(rewriteFragment(sentence.substring(cursor), guidance));
        return out.toString();
    }

    private String rewriteFragment(String fragment, String guidance) {
        if (!linter.hasFailures(fragment)) {
            return fragment;
        }
        int lead = 0;
        while (lead < fragment.length() && Character.isWhitespace(fragment.charAt(lead))) {
            lead++;
        }
        int trail = fragment.length();
        while (trail > lead && Character.isWhitespace(fragment.charAt(trail - 1))) {
            trail--;
        }
        String core = fragment.substring(lead, trail);
        String replacement;
        try {
            replacement = rewriter.rewrite(core, guidance);
        } catch (RuntimeException e) {
            log.warn("TONE: rewriter failed for fragment '{}': {}", core, e.getMessage());
            return fragment;
        }
        if (replacement == null || replacement.isBlank()) {
            return fragment;
        }
        return fragment.substring(0, lead) + replacement.strip() + fragment.substring(trail);
    }

    private static List<int[]> sentences(String text) {
        List<int[]> bounds = new ArrayList<>();
        Matcher m = SENTENCE_BOUNDARY.matcher(text);
        int start = 0;
        while (m.find()) {
            bounds.add(new int[]{start, m.start()});
            start = m.end();
        }
        bounds.add(new int[]{start, text.length()});
        return bounds;
    }

    private static String guidance(List<ToneFlag> hits) {
        Set<String> suggestions = new LinkedHashSet<>();
        hits.stream().map(ToneFlag::suggestion).filter(Objects::nonNull).forEach(suggestions::add);
        return suggestions.isEmpty() ? DEFAULT_GUIDANCE : String.join("; ", suggestions);
    }
}
