package com.eainde.manuscript.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A relation triple as returned by the extractor, before it becomes a {@link Claim}.
 */
public record ExtractedTriple(
        @JsonProperty("subject") String subject,
        @JsonProperty("predicate") String predicate,
        @JsonProperty("object") String object,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("source_pointer") SourcePointer sourcePointer,
        @JsonProperty("claim_text") String claimText,
        @JsonProperty("rq_hits") List<String> rqHits
) {

    public ExtractedTriple {
        rqHits = rqHits == null ? List.of() : List.copyOf(rqHits);
    }

    @JsonIgnore
    public boolean isComplete() {
        return notBlank(subject) && notBlank(predicate) && notBlank(object);
    }

    public Integer page() {
        return sourcePointer == null ? null : sourcePointer.page();
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
