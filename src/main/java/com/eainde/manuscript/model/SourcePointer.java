package com.eainde.manuscript.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Raw provenance as reported by the extractor. Unlike {@link SourceAnchor} it may be incomplete.
 */
public record SourcePointer(
        @JsonProperty("doc_hash") String docHash,
        @JsonProperty("page") Integer page,
        @JsonProperty("bbox") List<Double> bbox,
        @JsonProperty("snippet") String snippet
) {

    /**
     * Converts the pointer into a validated anchor.
     *
     * @param fallbackDocId document id to use when the pointer carries none
     * @return the anchor, or {@code null} when the pointer has no page or no locatable evidence
     */
    public SourceAnchor toAnchor(String fallbackDocId) {
        String docId = docHash != null && !docHash.isBlank() ? docHash : fallbackDocId;
        if (docId == null || docId.isBlank() || page == null || page < 1) {
            return null;
        }
        BoundingBox box = BoundingBox.fromCorners(bbox);
        boolean hasSnippet = snippet != null && !snippet.isBlank();
        if (box == null && !hasSnippet) {
            return null;
        }
        return new SourceAnchor(docId, page, box, null, hasSnippet ? snippet : null);
    }
}
