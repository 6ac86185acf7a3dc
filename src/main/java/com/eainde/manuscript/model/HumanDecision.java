package com.eainde.manuscript.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reviewer verdict on a {@link ReframingProposal}.
 *
 * @param proposalId     proposal being answered, {@code null} to answer whatever is pending
 * @param approved       whether the reframing is accepted
 * @param editedContent  replacement proposal text, may be {@code null}
 * @param reviewer       who decided, may be {@code null}
 */
public record HumanDecision(
        @JsonProperty("proposal_id") String proposalId,
        @JsonProperty("approved") boolean approved,
        @JsonProperty("edited_content") String editedContent,
        @JsonProperty("reviewer") String reviewer
) {

    public static HumanDecision approve(String proposalId) {
        return new HumanDecision(proposalId, true, null, null);
    }

    public static HumanDecision reject(String proposalId) {
        return new HumanDecision(proposalId, false, null, null);
    }
}
