package com.eainde.manuscript.governance.tone;

import com.eainde.manuscript.governance.DeterministicScope;
import com.eainde.manuscript.model.ToneFlag;
import com.eainde.manuscript.model.ToneTerm;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Regex lint over a {@link TonePolicy}: one case-insensitive, word-bounded alternation of every term.
 * Longer terms are tried first so a phrase wins over a word it contains.
 */
public class ToneLinter {

    private final TonePolicy policy;
    private final List<ToneTerm> ordered;
    private final Pattern pattern;

    public ToneLinter(TonePolicy policy) {
        this.policy = policy;
        this.ordered = policy.terms().stream()
                .sorted(Comparator.comparing((ToneTerm t) -> t.word().length()).reversed()
                        .thenComparing(ToneTerm::word))
                .collect(Collectors.toList());
        if (ordered.isEmpty()) {
            this.pattern = null;
        } else {
            // group i + 1 captures ordered.get(i)
            String alternation = ordered.stream()
                    .map(t -> "(" + Pattern.quote(t.word()) + ")")
                    .collect(Collectors.joining("|"));
            this.pattern = Pattern.compile("\\b(?:" + alternation + ")\\b",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        }
    }

    public TonePolicy policy() {
        return policy;
    }

    public List<ToneFlag> lint(String text) {
        if (pattern == null || text == null || text.isEmpty()) {
            return List.of();
        }
        return DeterministicScope.call("tone-lint", () -> scan(text));
    }

    public boolean hasFailures(String text) {
        return lint(text).stream().anyMatch(ToneFlag::failing);
    }

    private List<ToneFlag> scan(String text) {
        List<ToneFlag> flags = new ArrayList<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            int group = matchedGroup(m);
            ToneTerm term = ordered.get(group - 1);
            flags.add(new ToneFlag(m.group(group), term.severity(), List.of(m.start(group), m.end(group)),
                    term.replacement(), term.category()));
        }
        return flags;
    }

    private static int matchedGroup(Matcher m) {
        for (int i = 1; i <= m.groupCount(); i++) {
            if (m.group(i) != null) {
                return i;
            }
        }
        throw new IllegalStateException("Tone pattern matched without a term group");
    }
}
