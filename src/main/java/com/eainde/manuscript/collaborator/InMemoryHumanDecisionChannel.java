package com.eainde.manuscript.collaborator;

import com.eainde.manuscript.model.HumanDecision;
import com.eainde.manuscript.model.ReframingProposal;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Log4j2
@Component
public class InMemoryHumanDecisionChannel implements HumanDecisionChannel {

    private final Map<String, ReframingProposal> pending = new ConcurrentHashMap<>();
    private final Map<String, HumanDecision> decisions = new ConcurrentHashMap<>();

    @Override
    public void publish(ReframingProposal proposal) {
        pending.put(proposal.proposalId(), proposal);
        log.info("Reframing proposal {} awaiting sign-off (conflict hash {})",
                proposal.proposalId(), proposal.conflictHash());
    }

    @Override
    public Optional<HumanDecision> await(String proposalId) {
        return Optional.ofNullable(decisions.get(proposalId));
    }

    /** Records a reviewer decision for a published proposal. */
    public void submit(HumanDecision decision) {
        if (!pending.containsKey(decision.proposalId())) {
            throw new IllegalArgumentException("No pending proposal " + decision.proposalId());
        }
        pending.remove(decision.proposalId());
        decisions.put(decision.proposalId(), decision);
    }

    public Collection<ReframingProposal> pendingProposals() {
        return List.copyOf(pending.values());
    }
}
