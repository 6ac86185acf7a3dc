package com.eainde.manuscript.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Proposal handed to a reviewer when the critic deadlocks.
 */
public record ReframingProposal(
        @JsonProperty("proposal_id") String proposalId,
        @JsonProperty("pivot_type") String pivotType,
        @JsonProperty("proposal") String proposal,
        @JsonProperty("conflict_hash") String conflictHash,
        @JsonProperty("contradicted_claim_ids") List<String> contradictedClaimIds,
        @JsonProperty("requires_human_signoff") boolean requiresHumanSignoff
) {

    public ReframingProposal {
        contradictedClaimIds = contradictedClaimIds == null ? List.of() : List.copyOf(contradictedClaimIds);
    }

    public ReframingProposal withProposal(String editedText) {
        return new ReframingProposal(proposalId, pivotType, editedText, conflictHash,
                contradictedClaimIds, requiresHumanSignoff);
    }
}
