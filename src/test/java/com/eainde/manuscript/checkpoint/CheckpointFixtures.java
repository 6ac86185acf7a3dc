package com.eainde.manuscript.checkpoint;

import com.eainde.manuscript.model.Claim;
import com.eainde.manuscript.model.ManuscriptBlock;
import com.eainde.manuscript.model.SourceAnchor;
import com.eainde.manuscript.model.TableData;
import com.eainde.manuscript.model.ToneFlag;
import com.eainde.manuscript.model.ToneSeverity;
import com.eainde.manuscript.state.PipelineRequest;
import com.eainde.manuscript.state.PipelineRun;
import com.eainde.manuscript.state.ProjectContext;
import com.eainde.manuscript.state.RigorLevel;
import com.eainde.manuscript.workflow.Stage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class CheckpointFixtures {

    static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    private CheckpointFixtures() {
    }

    static PipelineRun run(String threadId) {
        PipelineRequest request = new PipelineRequest("job-1", threadId, "proj-1", "ing-1",
                "X impacts Y.", "doc-hash", null, RigorLevel.CONSERVATIVE,
                new ProjectContext("X impacts Y", List.of("rq1")),
                List.of(new TableData("t1", "Results", List.of(Map.of("v", "1.50")), List.of("c1"), null)));
        PipelineRun run = PipelineRun.submit(request, RigorLevel.EXPLORATORY, NOW);
        Claim claim = new Claim(Claim.generateClaimId("X", "IMPACTS", "Y", "doc-hash", 1), "X", "IMPACTS", "Y",
                0.9, SourceAnchor.ofSnippet("doc-hash", 1, "X impacts Y"), List.of("rq1"), "doc-hash", "ing-1", null);
        run.setClaims(new ArrayList<>(List.of(claim)));
        run.setManuscriptBlocks(new ArrayList<>(List.of(
                new ManuscriptBlock("b1", "s1", "rq1", "X impacts Y [[" + claim.claimId() + "]].",
                        List.of(claim.claimId())))));
        run.setToneFindings(new ArrayList<>(List.of(
                new ToneFlag("novel", ToneSeverity.WARN, List.of(0, 5), "new", "hype"))));
        run.setCurrentStage(Stage.CRITIC);
        run.getStageHistory().add(Stage.VISION);
        return run;
    }
}
