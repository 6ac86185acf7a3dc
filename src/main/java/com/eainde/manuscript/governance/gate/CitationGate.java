package com.eainde.manuscript.governance.gate;

import com.eainde.manuscript.governance.citation.CitationIntegrity;
import com.eainde.manuscript.model.Claim;
import com.eainde.manuscript.state.PipelineRun;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

public class CitationGate implements GovernanceGate {

    @Override
    public String name() {
        return "citation";
    }

    @Override
    public GateOutcome apply(PipelineRun run) {
        Set<String> known = run.getClaims().stream().map(Claim::claimId).collect(Collectors.toSet());
        List<String> problems = CitationIntegrity.validate(run.getManuscriptBlocks(), known, run.conservative());
        if (!problems.isEmpty() && run.conservative()) {
            return GateOutcome.refuse(run, problems, "Citation integrity validation failed");
        }
        return GateOutcome.pass(run, problems);
    }
}
