package com.eainde.manuscript.nodes;

import com.eainde.manuscript.model.Hashing;
import com.eainde.manuscript.state.PipelineRun;
import com.eainde.manuscript.workflow.Stage;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

/**
 * Ingestion checks: the run needs source text, and a document hash to key its claims by.
 */
@Log4j2
@Component
public class VisionNode implements PipelineNode {

    static final String NO_SOURCE_TEXT = "No source text supplied";

    @Override
    public Stage stage() {
        return Stage.VISION;
    }

    @Override
    public void execute(PipelineRun run) {
        if (run.getRawText() == null || run.getRawText().isBlank()) {
            log.warn("VISION: job {} has no source text", run.getJobId());
            run.forceFailure(NO_SOURCE_TEXT);
            return;
        }
        if (run.getDocHash() == null || run.getDocHash().isBlank()) {
            run.setDocHash(Hashing.sha256Hex(run.getRawText()));
        }
        log.info("VISION: job {} ingested {} chars, doc {}", run.getJobId(), run.getRawText().length(),
                run.getDocHash());
    }
}
