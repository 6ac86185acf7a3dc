package com.eainde.manuscript.governance.tone;

import com.eainde.manuscript.model.ToneSeverity;
import com.eainde.manuscript.model.ToneTerm;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Banned vocabulary. Terms are unique case-insensitively; the first definition of a word wins.
 */
public record TonePolicy(List<ToneTerm> terms) {

    public TonePolicy {
        Map<String, ToneTerm> unique = new LinkedHashMap<>();
        if (terms != null) {
            terms.forEach(t -> unique.putIfAbsent(key(t.word()), t));
        }
        terms = List.copyOf(unique.values());
    }

    public static TonePolicy of(ToneTerm... terms) {
        return new TonePolicy(List.of(terms));
    }

    public Optional<ToneTerm> find(String word) {
        String k = key(word);
        return terms.stream().filter(t -> key(t.word()).equals(k)).findFirst();
    }

    public long count(ToneSeverity severity) {
        return terms.stream().filter(t -> t.severity() == severity).count();
    }

    private static String key(String word) {
        return word.trim().toLowerCase(Locale.ROOT);
    }
}
