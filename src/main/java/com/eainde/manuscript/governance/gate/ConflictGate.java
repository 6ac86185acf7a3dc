package com.eainde.manuscript.governance.gate;

import com.eainde.manuscript.state.PipelineRun;

import java.util.List;

/**
 * Conservative runs may not publish while detected conflicts are unresolved. A reviewer's approval of a
 * reframing proposal resolves them.
 */
public class ConflictGate implements GovernanceGate {

    @Override
    public String name() {
        return "conflict";
    }

    @Override
    public GateOutcome apply(PipelineRun run) {
        if (!run.isConflictDetected()) {
            return GateOutcome.pass(run, List.of());
        }
        List<String> flags = List.of("conflict:" + run.getConflicts().size() + "_detected");
        boolean signedOff = run.getHumanDecision() != null && run.getHumanDecision().approved();
        if (run.conservative() && !signedOff) {
            return GateOutcome.refuse(run, flags, "Unresolved conflicts without reviewer sign-off");
        }
        return GateOutcome.pass(run, flags);
    }
}
