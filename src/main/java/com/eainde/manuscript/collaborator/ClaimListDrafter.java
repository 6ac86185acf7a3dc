package com.eainde.manuscript.collaborator;

import com.eainde.manuscript.model.ExtractedTriple;
import com.eainde.manuscript.state.RigorLevel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Offline drafter: one cited sentence per triple.
 */
public class ClaimListDrafter implements Drafter {

    @Override
    public String draft(List<ExtractedTriple> triples, List<String> citations, RigorLevel rigor) {
        List<String> sentences = new ArrayList<>();
        for (int i = 0; i < triples.size(); i++) {
            ExtractedTriple t = triples.get(i);
            String predicate = t.predicate().replace('_', ' ').toLowerCase(Locale.ROOT);
            String cite = i < citations.size() ? " [[" + citations.get(i) + "]]" : "";
            sentences.add(t.subject() + " " + predicate + " " + t.object() + cite + ".");
        }
        return String.join(" ", sentences);
    }
}
