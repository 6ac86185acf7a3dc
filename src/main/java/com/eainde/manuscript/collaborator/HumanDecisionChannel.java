package com.eainde.manuscript.collaborator;

import com.eainde.manuscript.model.HumanDecision;
import com.eainde.manuscript.model.ReframingProposal;

import java.util.Optional;

/**
 * Carries reframing proposals to reviewers and their decisions back.
 */
public interface HumanDecisionChannel {

    /** Notifies reviewers that a proposal awaits sign-off. May fail; the run stays suspended regardless. */
    void publish(ReframingProposal proposal);

    /** Non-blocking: the decision for {@code proposalId} if one has been made. */
    Optional<HumanDecision> await(String proposalId);
}
