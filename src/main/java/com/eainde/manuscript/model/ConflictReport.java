package com.eainde.manuscript.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of one critic pass over the run's claims.
 * <p>
 * A report is immutable: the {@code conflictHash} is computed once from the items when the report is
 * created (see {@code ConflictHasher}), and a corrected report is always a new instance.
 * </p>
 *
 * @param conflictItems       detected conflicts, possibly empty when the critic failed for other reasons
 * @param conflictHash        order-independent SHA-256 over the items
 * @param severity            highest severity among the items, or the failure severity when there are none
 * @param deadlock            critic failed with the retry budget exhausted
 * @param recommendedNextStep routing hint for the critic decision
 * @param revisionCount       revision at which the report was produced
 */
public record ConflictReport(
        @JsonProperty("conflict_items") List<ConflictItem> conflictItems,
        @JsonProperty("conflict_hash") String conflictHash,
        @JsonProperty("severity") ConflictSeverity severity,
        @JsonProperty("deadlock") boolean deadlock,
        @JsonProperty("recommended_next_step") RecommendedNextStep recommendedNextStep,
        @JsonProperty("revision_count") int revisionCount
) {

    public ConflictReport {
        conflictItems = conflictItems == null ? List.of() : List.copyOf(conflictItems);
        if (conflictHash == null || conflictHash.isBlank()) {
            throw new IllegalArgumentException("ConflictReport requires a conflict_hash");
        }
    }

    public boolean recommendsReframing() {
        return recommendedNextStep == RecommendedNextStep.TRIGGER_REFRAMING
                || recommendedNextStep == RecommendedNextStep.PAUSE_FOR_HUMAN;
    }

    public List<String> contradictedClaimIds() {
        return conflictItems.stream()
                .flatMap(item -> item.contradicts().stream())
                .distinct()
                .sorted()
                .toList();
    }
}
