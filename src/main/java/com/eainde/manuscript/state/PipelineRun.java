package com.eainde.manuscript.state;

import com.eainde.manuscript.model.Claim;
import com.eainde.manuscript.model.ConflictItem;
import com.eainde.manuscript.model.ConflictReport;
import com.eainde.manuscript.model.ExtractionResult;
import com.eainde.manuscript.model.HumanDecision;
import com.eainde.manuscript.model.ManuscriptBlock;
import com.eainde.manuscript.model.PrecisionFlag;
import com.eainde.manuscript.model.ReframingProposal;
import com.eainde.manuscript.model.TableData;
import com.eainde.manuscript.model.ToneFlag;
import com.eainde.manuscript.workflow.Stage;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Full state of one pipeline run.
 * <p>
 * Every stage works on its own copy of the run and the engine only replaces the checkpointed
 * snapshot once the stage has returned. The object is therefore plain mutable state: no locking,
 * and no sharing between runs.
 * </p>
 *
 * <h3>Identity</h3>
 * <ul>
 * <li>{@code jobId}: the business job the run belongs to.</li>
 * <li>{@code threadId}: the checkpoint key.</li>
 * <li>{@code projectId}: scope for claim loading and rigor configuration.</li>
 * </ul>
 */
@Data
@NoArgsConstructor
public class PipelineRun {

    // ── Identity ──
    private String jobId;
    private String threadId;
    private String projectId;
    private String ingestionId;

    // ── Control ──
    private RunStatus status = RunStatus.RUNNING;
    private Phase phase = Phase.INGESTING;
    private Stage currentStage = Stage.VISION;
    private List<Stage> stageHistory = new ArrayList<>();
    private RigorLevel rigor = RigorLevel.CONSERVATIVE;
    private int revisionCount;
    private CriticStatus criticStatus = CriticStatus.UNKNOWN;
    private List<String> critiques = new ArrayList<>();
    private boolean needsHumanReview;
    private boolean needsSignoff;
    private boolean conflictDetected;
    private boolean conflictPersisted;
    private boolean forceFailure;
    private boolean cancelled;
    private String failureReason;

    // ── Inputs ──
    private String rawText;
    private String docHash;
    private String formula;
    private ProjectContext projectContext = ProjectContext.empty();

    // ── Mapping ──
    private ExtractionResult extraction = ExtractionResult.empty();
    private String extractionError;
    private List<Claim> claims = new ArrayList<>();
    private Presentation presentation;
    private LogicValidation logicValidation;

    // ── Vetting ──
    private List<ConflictItem> conflicts = new ArrayList<>();
    private ConflictReport conflictReport;
    private ReframingProposal reframingProposal;
    private String pendingDecision;
    private HumanDecision humanDecision;

    // ── Synthesis and governance ──
    private String synthesis;
    private List<ManuscriptBlock> manuscriptBlocks = new ArrayList<>();
    private List<TableData> tables = new ArrayList<>();
    private List<ToneFlag> toneFindings = new ArrayList<>();
    private List<PrecisionFlag> precisionFlags = new ArrayList<>();
    private List<String> governanceFlags = new ArrayList<>();
    private List<String> warnings = new ArrayList<>();
    private ArtifactManifest artifactManifest;
    private String finalText;
    private Map<String, PromptUse> promptManifest = new LinkedHashMap<>();

    // ── Persistence ──
    private SaveReceipt saveReceipt;
    private Instant createdAt;
    private Instant updatedAt;

    public static PipelineRun submit(PipelineRequest request, RigorLevel defaultRigor, Instant now) {
        PipelineRun run = new PipelineRun();
        run.setJobId(request.jobId() != null ? request.jobId() : UUID.randomUUID().toString());
        run.setThreadId(request.threadId() != null ? request.threadId() : UUID.randomUUID().toString());
        run.setProjectId(request.projectId());
        run.setIngestionId(request.ingestionId());
        run.setRigor(request.rigor() != null ? request.rigor() : defaultRigor);
        run.setRawText(request.rawText());
        run.setDocHash(request.docHash());
        run.setFormula(request.formula());
        run.setProjectContext(request.context());
        run.setTables(new ArrayList<>(request.tables()));
        run.setCreatedAt(now);
        run.setUpdatedAt(now);
        return run;
    }

    public boolean conservative() {
        return rigor == RigorLevel.CONSERVATIVE;
    }

    public boolean awaitingDecision() {
        return pendingDecision != null;
    }

    public void addCritique(String critique) {
        critiques.add(critique);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    /** Sets the fatal-failure flag; routing then sends the run to failure cleanup. */
    public void forceFailure(String reason) {
        this.forceFailure = true;
        if (failureReason == null) {
            this.failureReason = reason;
        }
    }

    /**
     * Adds claims not already present, keyed by claim id. Existing claims keep their position.
     *
     * @return number of claims actually added
     */
    public int mergeClaims(List<Claim> incoming) {
        Map<String, Claim> byId = new LinkedHashMap<>();
        claims.forEach(c -> byId.put(c.claimId(), c));
        int before = byId.size();
        incoming.forEach(c -> byId.putIfAbsent(c.claimId(), c));
        claims = new ArrayList<>(byId.values());
        return byId.size() - before;
    }

    public void recordPrompt(String key, PromptUse use) {
        promptManifest.put(key, use);
    }
}
