package com.eainde.manuscript.nodes;

import com.eainde.manuscript.governance.gate.GovernanceGates;
import com.eainde.manuscript.model.ManuscriptBlock;
import com.eainde.manuscript.model.TableData;
import com.eainde.manuscript.model.ToneFlag;
import com.eainde.manuscript.state.ArtifactManifest;
import com.eainde.manuscript.state.PipelineRun;
import com.eainde.manuscript.workflow.Stage;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Governs the run's tables and records what the run produced.
 */
@Log4j2
@Component
@RequiredArgsConstructor
public class ArtifactRegistryNode implements PipelineNode {

    private final GovernanceGates gates;

    @Override
    public Stage stage() {
        return Stage.ARTIFACT_REGISTRY;
    }

    @Override
    public void execute(PipelineRun run) {
        gates.enforce(run, List.of(gates.precision()));
        ArtifactManifest manifest = manifest(run);
        run.setArtifactManifest(manifest);
        log.info("ARTIFACT_REGISTRY: job {} -> {} block(s), {} words, {} table(s), {} precision flag(s)",
                run.getJobId(), manifest.blockCount(), manifest.totalWords(), manifest.tableIds().size(),
                manifest.precisionFlagCount());
    }

    static ArtifactManifest manifest(PipelineRun run) {
        List<ManuscriptBlock> blocks = run.getManuscriptBlocks();
        int words = blocks.stream().mapToInt(ManuscriptBlock::wordCount).sum();
        int citations = blocks.stream().mapToInt(b -> b.claimIds().size()).sum();
        int claims = (int) blocks.stream().flatMap(b -> b.claimIds().stream()).distinct().count();
        double density = words == 0 ? 0.0
                : BigDecimal.valueOf(claims * 100.0 / words).setScale(2, RoundingMode.HALF_UP).doubleValue();
        return new ArtifactManifest(
                blocks.size(),
                words,
                claims,
                density,
                citations,
                run.getTables().stream().map(TableData::tableId).toList(),
                run.getPrecisionFlags().size(),
                run.getToneFindings().stream().filter(f -> !f.failing()).map(ToneFlag::toString).toList(),
                run.getWarnings());
    }
}
