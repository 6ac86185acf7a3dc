package com.eainde.manuscript.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;

/**
 * A single extracted (subject, predicate, object) fact with its confidence and provenance.
 *
 * <p>Claims are immutable. The {@code claimId} is derived from content via
 * {@link #generateClaimId(String, String, String, String, Integer)}, so repeated extraction attempts
 * over the same source collapse onto the same id.</p>
 *
 * @param claimId      deterministic content hash
 * @param subject      normalised subject text as extracted
 * @param predicate    relation name
 * @param object       object text
 * @param confidence   extractor confidence in [0, 1]
 * @param sourceAnchor where the claim is evidenced, may be {@code null}
 * @param rqHits       research-question ids this claim answers
 * @param fileHash     hash of the source document
 * @param ingestionId  ingestion batch the claim came from, may be {@code null}
 * @param claimText    sentence the claim was read from, may be {@code null}
 */
public record Claim(
        @JsonProperty("claim_id") String claimId,
        @JsonProperty("subject") String subject,
        @JsonProperty("predicate") String predicate,
        @JsonProperty("object") String object,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("source_anchor") SourceAnchor sourceAnchor,
        @JsonProperty("rq_hits") List<String> rqHits,
        @JsonProperty("file_hash") String fileHash,
        @JsonProperty("ingestion_id") String ingestionId,
        @JsonProperty("claim_text") String claimText
) {

    public Claim {
        requireText(claimId, "claim_id");
        requireText(subject, "subject");
        requireText(predicate, "predicate");
        requireText(object, "object");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Claim confidence must be within [0, 1], was " + confidence);
        }
        rqHits = rqHits == null ? List.of() : List.copyOf(rqHits);
    }

    /**
     * Builds a claim from an extracted triple, deriving its id and anchor.
     *
     * @param triple      complete triple (see {@link ExtractedTriple#isComplete()})
     * @param fileHash    hash of the document the triple was extracted from
     * @param ingestionId ingestion batch, may be {@code null}
     */
    public static Claim fromTriple(ExtractedTriple triple, String fileHash, String ingestionId) {
        SourceAnchor anchor = triple.sourcePointer() == null ? null : triple.sourcePointer().toAnchor(fileHash);
        Integer page = anchor != null ? Integer.valueOf(anchor.pageNumber()) : triple.page();
        double confidence = triple.confidence() == null ? 1.0 : triple.confidence();
        return new Claim(
                generateClaimId(triple.subject(), triple.predicate(), triple.object(), fileHash, page),
                triple.subject().trim(),
                triple.predicate().trim(),
                triple.object().trim(),
                confidence,
                anchor,
                triple.rqHits(),
                fileHash,
                ingestionId,
                triple.claimText());
    }

    /**
     * SHA-256 (hex) of {@code subject|predicate|object|fileHash|page}, each part trimmed and lower-cased.
     * A {@code null} part hashes as the empty string.
     */
    public static String generateClaimId(String subject, String predicate, String object,
                                         String fileHash, Integer page) {
        String key = String.join("|",
                normalize(subject),
                normalize(predicate),
                normalize(object),
                normalize(fileHash),
                page == null ? "" : page.toString());
        return Hashing.sha256Hex(key);
    }

    /** Page of the anchor, or {@code null} when the claim is unanchored. */
    public Integer pageNumber() {
        return sourceAnchor == null ? null : sourceAnchor.pageNumber();
    }

    /** Text used when the claim is quoted in an explanation. */
    public String displayText() {
        if (claimText != null && !claimText.isBlank()) {
            return claimText;
        }
        return subject + " " + predicate + " " + object;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Claim requires a non-blank " + field);
        }
    }
}
