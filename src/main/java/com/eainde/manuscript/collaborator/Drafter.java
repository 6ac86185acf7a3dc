package com.eainde.manuscript.collaborator;

import com.eainde.manuscript.model.ExtractedTriple;
import com.eainde.manuscript.state.RigorLevel;

import java.util.List;

/**
 * Drafts manuscript prose from triples.
 */
public interface Drafter {

    /**
     * @param triples   extracted triples
     * @param citations claim ids the draft may cite, aligned with {@code triples}
     * @param rigor     governance mode of the project
     * @return prose with inline {@code [[claim_id]]} markers, or a JSON array of blocks
     */
    String draft(List<ExtractedTriple> triples, List<String> citations, RigorLevel rigor);
}
