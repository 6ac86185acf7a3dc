package com.eainde.manuscript.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A drafted paragraph with the claims it cites.
 */
public record ManuscriptBlock(
        @JsonProperty("block_id") String blockId,
        @JsonProperty("section_id") String sectionId,
        @JsonProperty("rq_id") String rqId,
        @JsonProperty("text") String text,
        @JsonProperty("claim_ids") List<String> claimIds
) {

    public ManuscriptBlock {
        if (blockId == null || blockId.isBlank()) {
            throw new IllegalArgumentException("ManuscriptBlock requires a block_id");
        }
        text = text == null ? "" : text;
        claimIds = claimIds == null ? List.of() : List.copyOf(claimIds);
    }

    public ManuscriptBlock withText(String newText) {
        return new ManuscriptBlock(blockId, sectionId, rqId, newText, claimIds);
    }

    public ManuscriptBlock withClaimIds(List<String> ids) {
        return new ManuscriptBlock(blockId, sectionId, rqId, text, ids);
    }

    public int wordCount() {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
