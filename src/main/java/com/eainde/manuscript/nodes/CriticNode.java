package com.eainde.manuscript.nodes;

import com.eainde.manuscript.governance.conflict.ConflictDetection;
import com.eainde.manuscript.governance.conflict.ConflictDetector;
import com.eainde.manuscript.model.ConflictReport;
import com.eainde.manuscript.prompts.PromptRegistry;
import com.eainde.manuscript.state.CriticStatus;
import com.eainde.manuscript.state.PipelineRun;
import com.eainde.manuscript.workflow.Stage;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

/**
 * Deterministic vetting of the mapped claims.
 * <p>
 * Every pass starts from an empty critique list. The pass fails when any critique was added; in
 * conservative mode detected conflicts are a critique, in exploratory mode only a warning.
 * </p>
 */
@Log4j2
@Component
public class CriticNode implements PipelineNode {

    static final String CONFLICT_GATE_VERSION = "1";

    private final ConflictDetector detector;

    public CriticNode(ConflictDetector detector) {
        this.detector = detector;
    }

    @Override
    public Stage stage() {
        return Stage.CRITIC;
    }

    @Override
    public void execute(PipelineRun run) {
        run.setCritiques(new ArrayList<>());

        if (run.getClaims().isEmpty()) {
            run.addCritique(run.getExtractionError() == null
                    ? "No claims extracted"
                    : "No claims extracted (" + run.getExtractionError() + ")");
        }
        if (TextQuality.looksGarbled(run.getRawText())) {
            run.addCritique("Source text looks garbled");
        }
        if (run.conservative()) {
            long unanchored = run.getClaims().stream().filter(c -> c.sourceAnchor() == null).count();
            if (unanchored > 0) {
                run.addCritique(unanchored + " claim(s) without source anchor (conservative mode)");
            }
        }

        ConflictDetection detection = detector.detect(run);
        if (detection.storeFailure() != null) {
            run.addWarning("claim_store_unavailable");
        }
        int count = detection.items().size();
        run.setConflicts(new ArrayList<>(detection.items()));
        run.setConflictDetected(detection.hasConflicts());
        boolean humanReview = detector.requiresHumanReview(run.getRigor(), count);
        if (humanReview) {
            run.setNeedsHumanReview(true);
        }
        if (detection.hasConflicts()) {
            if (run.conservative()) {
                run.addCritique("Detected " + count + " conflicts."
                        + (humanReview ? " Human review required (conservative mode)." : ""));
            } else {
                run.addWarning("Detected " + count + " conflicts. Flagged for review.");
            }
        }

        CriticStatus status = run.getCritiques().isEmpty() ? CriticStatus.PASS : CriticStatus.FAIL;
        run.setCriticStatus(status);

        ConflictReport previous = run.getConflictReport();
        if (status == CriticStatus.FAIL || detection.hasConflicts()) {
            ConflictReport report = detector.buildReport(detection.items(), status, run.getRevisionCount(),
                    run.isNeedsHumanReview());
            run.setConflictPersisted(previous != null && previous.conflictHash().equals(report.conflictHash()));
            run.setConflictReport(report);
        } else {
            run.setConflictPersisted(false);
            run.setConflictReport(null);
        }
        run.recordPrompt("governance:conflict", PromptRegistry.governancePass("conflict", CONFLICT_GATE_VERSION));

        log.info("CRITIC: job {} revision {} -> {} ({} critique(s), {} conflict(s){})",
                run.getJobId(), run.getRevisionCount(), status, run.getCritiques().size(), count,
                run.getConflictReport() != null && run.getConflictReport().deadlock() ? ", deadlock" : "");
    }
}
