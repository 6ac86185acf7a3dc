package com.eainde.manuscript.nodes;

import com.eainde.manuscript.state.PipelineRun;
import com.eainde.manuscript.state.RunStatus;
import com.eainde.manuscript.workflow.Stage;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Terminal stage for every run that cannot finish. Keeps the conflict report and governance flags.
 */
@Log4j2
@Component
public class FailureCleanupNode implements PipelineNode {

    public static final String CANCELLED = "Run cancelled";

    @Override
    public Stage stage() {
        return Stage.FAILURE_CLEANUP;
    }

    @Override
    public void execute(PipelineRun run) {
        run.setStatus(RunStatus.FAILED);
        run.setPendingDecision(null);
        if (run.isCancelled()) {
            if (run.getFailureReason() == null) {
                run.setFailureReason(CANCELLED);
            }
        } else {
            run.setNeedsHumanReview(true);
            if (run.getFailureReason() == null) {
                run.setFailureReason("Critic status " + run.getCriticStatus().name().toLowerCase(Locale.ROOT)
                        + " after " + run.getRevisionCount() + " revision(s); retry budget exhausted");
            }
        }
        log.warn("FAILURE_CLEANUP: job {} failed: {}", run.getJobId(), run.getFailureReason());
    }
}
