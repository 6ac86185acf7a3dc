package com.eainde.manuscript.nodes;

import com.eainde.manuscript.collaborator.HumanDecisionChannel;
import com.eainde.manuscript.model.ConflictReport;
import com.eainde.manuscript.model.ReframingProposal;
import com.eainde.manuscript.state.PipelineRun;
import com.eainde.manuscript.workflow.Stage;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Escalates a deadlocked critic loop to a reviewer.
 * <p>
 * The suspension flags are set on the run before the proposal is published, so a failing channel can
 * never leave a checkpoint that looks resumable without sign-off.
 * </p>
 */
@Log4j2
@Component
public class ReframingNode implements PipelineNode {

    static final String PIVOT_SCOPE = "SCOPE";
    static final String SCOPE_PROPOSAL = "Refine scope to reduce contradiction.";
    static final String PUBLISH_FAILED = "signoff_notification_failed";

    private final HumanDecisionChannel channel;

    public ReframingNode(HumanDecisionChannel channel) {
        this.channel = channel;
    }

    @Override
    public Stage stage() {
        return Stage.REFRAMING;
    }

    @Override
    public void execute(PipelineRun run) {
        ConflictReport report = run.getConflictReport();
        if (report == null || !report.recommendsReframing()) {
            log.info("REFRAMING: job {} has no deadlocked report, nothing to sign off", run.getJobId());
            run.setNeedsSignoff(false);
            return;
        }

        ReframingProposal proposal = new ReframingProposal(
                proposalId(run.getJobId(), report.conflictHash()),
                PIVOT_SCOPE,
                SCOPE_PROPOSAL,
                report.conflictHash(),
                report.contradictedClaimIds(),
                true);
        run.setReframingProposal(proposal);
        run.setNeedsSignoff(true);
        run.setNeedsHumanReview(true);
        run.setPendingDecision(proposal.proposalId());

        try {
            channel.publish(proposal);
            log.info("REFRAMING: job {} suspended on proposal {}", run.getJobId(), proposal.proposalId());
        } catch (RuntimeException e) {
            log.warn("REFRAMING: could not publish proposal {} for job {}, run stays suspended: {}",
                    proposal.proposalId(), run.getJobId(), e.getMessage());
            run.addWarning(PUBLISH_FAILED);
        }
    }

    static String proposalId(String jobId, String conflictHash) {
        return "reframe_" + UUID.nameUUIDFromBytes((jobId + "|" + conflictHash).getBytes(StandardCharsets.UTF_8));
    }
}
