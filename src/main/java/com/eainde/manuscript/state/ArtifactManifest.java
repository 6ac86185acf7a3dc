package com.eainde.manuscript.state;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Summary of what the run produced, built by the artifact registry stage.
 */
public record ArtifactManifest(
        @JsonProperty("block_count") int blockCount,
        @JsonProperty("total_words") int totalWords,
        @JsonProperty("total_claims") int totalClaims,
        @JsonProperty("claims_per_100_words") double claimsPer100Words,
        @JsonProperty("citation_count") int citationCount,
        @JsonProperty("table_ids") List<String> tableIds,
        @JsonProperty("precision_flag_count") int precisionFlagCount,
        @JsonProperty("tone_warnings") List<String> toneWarnings,
        @JsonProperty("warnings") List<String> warnings
) {

    public ArtifactManifest {
        tableIds = tableIds == null ? List.of() : List.copyOf(tableIds);
        toneWarnings = toneWarnings == null ? List.of() : List.copyOf(toneWarnings);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
