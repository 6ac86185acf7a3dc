package com.eainde.manuscript.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of the extractor: relation triples plus the entities it recognised.
 */
public record ExtractionResult(
        @JsonProperty("triples") List<ExtractedTriple> triples,
        @JsonProperty("entities") List<String> entities
) {

    public ExtractionResult {
        triples = triples == null ? List.of() : List.copyOf(triples);
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    public static ExtractionResult empty() {
        return new ExtractionResult(List.of(), List.of());
    }

    public boolean hasTriples() {
        return !triples.isEmpty();
    }
}
