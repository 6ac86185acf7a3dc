package com.eainde.manuscript.nodes;

import com.eainde.manuscript.governance.gate.GovernanceGates;
import com.eainde.manuscript.model.ManuscriptBlock;
import com.eainde.manuscript.state.PipelineRun;
import com.eainde.manuscript.workflow.Stage;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Last governance pass before persistence: every gate, in order, over the already governed run.
 */
@Log4j2
@Component
@RequiredArgsConstructor
public class ToneValidatorNode implements PipelineNode {

    private final GovernanceGates gates;

    @Override
    public Stage stage() {
        return Stage.TONE_VALIDATOR;
    }

    @Override
    public void execute(PipelineRun run) {
        gates.enforceAll(run);
        if (run.getManuscriptBlocks().isEmpty()) {
            run.setFinalText(run.getSynthesis());
        } else {
            run.setFinalText(run.getManuscriptBlocks().stream()
                    .map(ManuscriptBlock::text)
                    .collect(Collectors.joining("\n\n")));
        }
        log.info("TONE_VALIDATOR: job {} cleared {} gate(s), {} flag(s)", run.getJobId(),
                gates.gates().size(), run.getGovernanceFlags().size());
    }
}
