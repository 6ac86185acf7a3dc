package com.eainde.manuscript.nodes;

import com.eainde.manuscript.governance.gate.GovernanceGates;
import com.eainde.manuscript.state.PipelineRun;
import com.eainde.manuscript.workflow.Stage;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.List;

@Log4j2
@Component
@RequiredArgsConstructor
public class ToneGuardNode implements PipelineNode {

    private final GovernanceGates gates;

    @Override
    public Stage stage() {
        return Stage.TONE_GUARD;
    }

    @Override
    public void execute(PipelineRun run) {
        gates.enforce(run, List.of(gates.tone()));
        log.info("TONE_GUARD: job {} governed, {} finding(s) remain", run.getJobId(), run.getToneFindings().size());
    }
}
