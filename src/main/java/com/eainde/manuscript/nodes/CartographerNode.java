package com.eainde.manuscript.nodes;

import com.eainde.manuscript.collaborator.Extractor;
import com.eainde.manuscript.collaborator.PromptAware;
import com.eainde.manuscript.model.Claim;
import com.eainde.manuscript.model.ExtractedTriple;
import com.eainde.manuscript.model.ExtractionResult;
import com.eainde.manuscript.prompts.PromptRegistry;
import com.eainde.manuscript.state.PipelineRun;
import com.eainde.manuscript.workflow.Stage;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps source text into triples and claims.
 * <p>
 * Extractor failures of any kind (timeouts, malformed output) leave the run with zero triples and an
 * {@code extractionError}; the critic then decides whether to retry. Triples the extractor got wrong
 * (missing parts, confidence out of range) are dropped with a warning.
 * </p>
 */
@Log4j2
@Component
public class CartographerNode implements PipelineNode {

    private final Extractor extractor;
    private final PromptRegistry prompts;

    public CartographerNode(Extractor extractor, PromptRegistry prompts) {
        this.extractor = extractor;
        this.prompts = prompts;
    }

    @Override
    public Stage stage() {
        return Stage.CARTOGRAPHER;
    }

    @Override
    public void execute(PipelineRun run) {
        if (run.isForceFailure()) {
            return;
        }
        ExtractionResult result;
        try {
            result = extractor.extract(run.getRawText(), run.getProjectContext());
            run.setExtractionError(null);
        } catch (RuntimeException e) {
            log.warn("CARTOGRAPHER: extraction failed for job {} (revision {}): {}",
                    run.getJobId(), run.getRevisionCount(), e.getMessage());
            result = ExtractionResult.empty();
            run.setExtractionError(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        if (result == null) {
            result = ExtractionResult.empty();
        }
        if (extractor instanceof PromptAware aware) {
            run.recordPrompt(stage().wireName(), prompts.use(aware.promptRole()));
        }

        List<ExtractedTriple> accepted = new ArrayList<>();
        List<Claim> claims = new ArrayList<>();
        for (ExtractedTriple triple : result.triples()) {
            if (!triple.isComplete()) {
                run.addWarning("invalid_triple:incomplete");
                continue;
            }
            try {
                claims.add(Claim.fromTriple(triple, run.getDocHash(), run.getIngestionId()));
                accepted.add(triple);
            } catch (IllegalArgumentException e) {
                log.warn("CARTOGRAPHER: dropping triple ({}, {}, {}): {}",
                        triple.subject(), triple.predicate(), triple.object(), e.getMessage());
                run.addWarning("invalid_triple:" + e.getMessage());
            }
        }
        run.setExtraction(new ExtractionResult(accepted, result.entities()));
        int added = run.mergeClaims(claims);
        log.info("CARTOGRAPHER: job {} revision {} -> {} triples, {} new claims ({} total)",
                run.getJobId(), run.getRevisionCount(), accepted.size(), added, run.getClaims().size());
    }
}
