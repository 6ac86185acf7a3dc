package com.eainde.manuscript.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Locatable evidence for a claim inside a source document.
 * <p>
 * An anchor always names a document and a page, and must carry at least one of
 * {@code bbox}, {@code span} or a non-blank {@code snippet}. Anything else is rejected here,
 * at construction, so no stage ever has to reason about an anchor that points nowhere.
 * </p>
 *
 * @param docId      document identifier (usually the file hash)
 * @param pageNumber 1-based page number
 * @param bbox       optional bounding box on the page
 * @param span       optional character span in the page text
 * @param snippet    optional verbatim excerpt
 */
public record SourceAnchor(
        @JsonProperty("doc_id") String docId,
        @JsonProperty("page_number") int pageNumber,
        @JsonProperty("bbox") BoundingBox bbox,
        @JsonProperty("span") TextSpan span,
        @JsonProperty("snippet") String snippet
) {

    public SourceAnchor {
        if (docId == null || docId.isBlank()) {
            throw new IllegalArgumentException("SourceAnchor requires a doc_id");
        }
        if (pageNumber < 1) {
            throw new IllegalArgumentException("SourceAnchor page_number must be >= 1, was " + pageNumber);
        }
        boolean hasSnippet = snippet != null && !snippet.isBlank();
        if (bbox == null && span == null && !hasSnippet) {
            throw new IllegalArgumentException(
                    "SourceAnchor for " + docId + " page " + pageNumber + " has no bbox, span or snippet");
        }
    }

    public static SourceAnchor ofSnippet(String docId, int pageNumber, String snippet) {
        return new SourceAnchor(docId, pageNumber, null, null, snippet);
    }
}
