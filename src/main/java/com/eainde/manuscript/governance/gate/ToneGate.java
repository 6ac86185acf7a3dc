package com.eainde.manuscript.governance.gate;

import com.eainde.manuscript.governance.tone.ToneGovernanceException;
import com.eainde.manuscript.governance.tone.ToneGovernanceResult;
import com.eainde.manuscript.governance.tone.ToneGovernor;
import com.eainde.manuscript.model.ManuscriptBlock;
import com.eainde.manuscript.model.ToneFlag;
import com.eainde.manuscript.state.PipelineRun;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs the {@link ToneGovernor} over every manuscript block, or over the raw synthesis when the run has
 * no blocks. Only non-convergence in conservative mode refuses the run.
 */
public class ToneGate implements GovernanceGate {

    private final ToneGovernor governor;

    public ToneGate(ToneGovernor governor) {
        this.governor = governor;
    }

    @Override
    public String name() {
        return "tone";
    }

    @Override
    public GateOutcome apply(PipelineRun run) {
        Set<ToneFlag> findings = new LinkedHashSet<>(run.getToneFindings());
        try {
            if (run.getManuscriptBlocks().isEmpty()) {
                if (run.getSynthesis() != null) {
                    ToneGovernanceResult result = governor.govern(run.getSynthesis(), run.getRigor(), "synthesis");
                    run.setSynthesis(result.text());
                    findings.addAll(result.remaining());
                }
            } else {
                List<ManuscriptBlock> governed = new ArrayList<>();
                for (ManuscriptBlock block : run.getManuscriptBlocks()) {
                    ToneGovernanceResult result = governor.govern(block.text(), run.getRigor(), block.blockId());
                    governed.add(result.rewritten() ? block.withText(result.text()) : block);
                    findings.addAll(result.remaining());
                }
                run.setManuscriptBlocks(governed);
            }
        } catch (ToneGovernanceException e) {
            return GateOutcome.refuse(run, e.getFlags(), e.getMessage());
        }
        run.setToneFindings(new ArrayList<>(findings));
        return GateOutcome.pass(run, findings.stream().map(f -> "tone:" + f).toList());
    }
}
