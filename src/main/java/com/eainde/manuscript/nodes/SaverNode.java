package com.eainde.manuscript.nodes;

import com.eainde.manuscript.collaborator.ClaimStore;
import com.eainde.manuscript.collaborator.ManuscriptStore;
import com.eainde.manuscript.state.Phase;
import com.eainde.manuscript.state.PipelineRun;
import com.eainde.manuscript.state.RunStatus;
import com.eainde.manuscript.state.SaveReceipt;
import com.eainde.manuscript.workflow.Stage;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

/**
 * Persists the finished run. Store failures propagate and abort the invocation.
 */
@Log4j2
@Component
@RequiredArgsConstructor
public class SaverNode implements PipelineNode {

    private final ManuscriptStore manuscriptStore;
    private final ClaimStore claimStore;

    @Override
    public Stage stage() {
        return Stage.SAVER;
    }

    @Override
    public void execute(PipelineRun run) {
        claimStore.save(run.getProjectId(), run.getIngestionId(), run.getJobId(), run.getClaims());
        run.setPhase(Phase.DONE);
        run.setStatus(RunStatus.COMPLETED);
        SaveReceipt receipt = manuscriptStore.save(run);
        run.setSaveReceipt(receipt);
        log.info("SAVER: job {} saved to {}/{}", run.getJobId(), receipt.collection(), receipt.key());
    }
}
