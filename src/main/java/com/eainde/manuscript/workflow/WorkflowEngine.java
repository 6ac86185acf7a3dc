package com.eainde.manuscript.workflow;

import com.eainde.manuscript.checkpoint.CheckpointCodec;
import com.eainde.manuscript.checkpoint.CheckpointStore;
import com.eainde.manuscript.collaborator.HumanDecisionChannel;
import com.eainde.manuscript.governance.GovernanceViolationException;
import com.eainde.manuscript.model.HumanDecision;
import com.eainde.manuscript.nodes.FailureCleanupNode;
import com.eainde.manuscript.nodes.PipelineNode;
import com.eainde.manuscript.state.PipelineRequest;
import com.eainde.manuscript.state.PipelineRun;
import com.eainde.manuscript.state.RunStatus;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The entry point for running the manuscript pipeline.
 * <p>
 * The engine drives a run stage by stage through the {@link StageRouter}, checkpointing the full
 * {@link PipelineRun} after every transition so any run can be inspected, resumed or cancelled by its
 * {@code threadId}.
 * </p>
 *
 * <h3>Stage isolation</h3>
 * Each stage executes against a copy of the checkpointed run. The copy only becomes the new checkpoint once
 * the stage returns:
 * <ul>
 * <li>a {@link GovernanceViolationException} discards the copy and routes the run to failure cleanup;</li>
 * <li>any other exception aborts the invocation with a {@link StageExecutionException} and leaves the last
 *     checkpoint untouched.</li>
 * </ul>
 *
 * <h3>Suspension</h3>
 * When a stage leaves a pending decision on the run (the reframing stage), the engine checkpoints it as
 * {@link RunStatus#AWAITING_SIGNOFF} and returns. {@link #resume(String, HumanDecision)} re-enters from the
 * reframing exit transition.
 *
 * <h3>Concurrency</h3>
 * Runs on different threads are independent. A second invocation on a thread that is being driven is
 * rejected; {@link #cancel(String)} is the only call allowed while a run is in flight.
 */
@Log4j2
@Service
public class WorkflowEngine {

    private final Map<Stage, PipelineNode> nodes = new EnumMap<>(Stage.class);
    private final StageRouter router;
    private final CheckpointStore checkpoints;
    private final CheckpointCodec codec;
    private final HumanDecisionChannel decisionChannel;
    private final PipelineSettings settings;
    private final Clock clock;

    private final Set<String> active = ConcurrentHashMap.newKeySet();
    private final Set<String> cancelRequests = ConcurrentHashMap.newKeySet();

    public WorkflowEngine(List<PipelineNode> allNodes, StageRouter router, CheckpointStore checkpoints,
                          CheckpointCodec codec, HumanDecisionChannel decisionChannel, PipelineSettings settings,
                          Clock clock) {
        for (PipelineNode node : allNodes) {
            PipelineNode previous = nodes.put(node.stage(), node);
            if (previous != null) {
                throw new IllegalArgumentException("Two nodes registered for stage " + node.stage() + ": "
                        + previous.getClass().getSimpleName() + ", " + node.getClass().getSimpleName());
            }
        }
        for (Stage stage : Stage.values()) {
            if (!nodes.containsKey(stage)) {
                throw new IllegalArgumentException("No node registered for stage " + stage);
            }
        }
        this.router = router;
        this.checkpoints = checkpoints;
        this.codec = codec;
        this.decisionChannel = decisionChannel;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Submits a new run and drives it until it is terminal or suspended.
     *
     * @throws IllegalStateException when the request's thread id already has a checkpoint
     */
    public PipelineRun start(PipelineRequest request) {
        PipelineRun run = PipelineRun.submit(request, settings.defaultRigor(), clock.instant());
        String threadId = run.getThreadId();
        acquire(threadId);
        try {
            if (checkpoints.load(threadId).isPresent()) {
                throw new IllegalStateException("Thread " + threadId + " already has a checkpoint");
            }
            checkpoints.save(threadId, run);
            log.info("Started job {} on thread {} (project {}, {})", run.getJobId(), threadId,
                    run.getProjectId(), run.getRigor().wireName());
            return drive(run);
        } finally {
            release(threadId);
        }
    }

    /**
     * Applies a reviewer decision to a suspended run and continues it.
     *
     * @throws RunNotFoundException  when the thread has no checkpoint
     * @throws IllegalStateException when the run is not suspended or the decision answers another proposal
     */
    public PipelineRun resume(String threadId, HumanDecision decision) {
        acquire(threadId);
        try {
            PipelineRun run = suspended(threadId);
            applyDecision(run, decision);
            return drive(run);
        } finally {
            release(threadId);
        }
    }

    /**
     * Polls the decision channel for a suspended run. Without a decision the run is returned unchanged.
     * A run left {@link RunStatus#RUNNING} by an aborted invocation is driven on from its last checkpoint.
     */
    public PipelineRun resume(String threadId) {
        acquire(threadId);
        try {
            PipelineRun run = checkpoints.load(threadId).orElseThrow(() -> new RunNotFoundException(threadId));
            if (run.getStatus() == RunStatus.RUNNING) {
                log.info("Re-driving job {} from stage {}", run.getJobId(), run.getCurrentStage().wireName());
                return drive(run);
            }
            PipelineRun waiting = suspended(threadId);
            Optional<HumanDecision> decision = decisionChannel.await(waiting.getPendingDecision());
            if (decision.isEmpty()) {
                log.debug("No decision yet for proposal {}", waiting.getPendingDecision());
                return waiting;
            }
            applyDecision(waiting, decision.get());
            return drive(waiting);
        } finally {
            release(threadId);
        }
    }

    /**
     * Cancels a run. An in-flight run is stopped at the next checkpoint boundary and the result of the stage
     * in progress is discarded; a suspended run goes to failure cleanup immediately. A run already inside a
     * terminal stage (saver or failure cleanup) runs to its end.
     *
     * @return false for unknown or already terminal runs, and for runs inside a terminal stage
     */
    public boolean cancel(String threadId) {
        Optional<PipelineRun> loaded = checkpoints.load(threadId);
        if (loaded.isEmpty() || finishing(loaded.get())) {
            return false;
        }
        if (!active.add(threadId)) {
            cancelRequests.add(threadId);
            log.info("Cancellation requested for in-flight thread {}", threadId);
            return true;
        }
        try {
            Optional<PipelineRun> current = checkpoints.load(threadId);
            if (current.isEmpty() || finishing(current.get())) {
                return false;
            }
            drive(markCancelled(current.get()));
            return true;
        } finally {
            release(threadId);
        }
    }

    private static boolean finishing(PipelineRun run) {
        return run.getStatus().isTerminal() || run.getCurrentStage().isTerminal();
    }

    public Optional<PipelineRun> getRun(String threadId) {
        return checkpoints.load(threadId);
    }

    public List<PipelineRun> history(String threadId) {
        return checkpoints.history(threadId);
    }

    private PipelineRun drive(PipelineRun start) {
        String threadId = start.getThreadId();
        MDC.put("threadId", threadId);
        MDC.put("jobId", start.getJobId());
        try {
            PipelineRun run = start;
            while (true) {
                Stage stage = run.getCurrentStage();
                if (!stage.isTerminal() && cancelRequests.remove(threadId)) {
                    run = markCancelled(run);
                    continue;
                }

                PipelineRun working = codec.copy(run);
                log.debug("Entering stage {} (revision {})", stage.wireName(), working.getRevisionCount());
                try {
                    nodes.get(stage).execute(working);
                } catch (GovernanceViolationException e) {
                    run = governanceFailure(run, stage, e);
                    continue;
                } catch (RuntimeException e) {
                    log.error("Stage {} aborted, last checkpoint kept", stage.wireName(), e);
                    throw new StageExecutionException(stage, threadId, e);
                }

                if (!stage.isTerminal() && cancelRequests.remove(threadId)) {
                    log.info("Discarding result of stage {} for cancelled run", stage.wireName());
                    run = markCancelled(run);
                    continue;
                }

                working.getStageHistory().add(stage);
                working.setUpdatedAt(clock.instant());
                if (stage.isTerminal()) {
                    checkpoints.save(threadId, working);
                    log.info("Job {} finished at {} with status {}", working.getJobId(), stage.wireName(),
                            working.getStatus());
                    return working;
                }
                if (working.awaitingDecision()) {
                    working.setStatus(RunStatus.AWAITING_SIGNOFF);
                    checkpoints.save(threadId, working);
                    log.info("Job {} suspended at {} awaiting decision on {}", working.getJobId(),
                            stage.wireName(), working.getPendingDecision());
                    return working;
                }

                Stage next = router.nextStage(working);
                if (stage == Stage.CRITIC && next == Stage.CARTOGRAPHER) {
                    working.setRevisionCount(working.getRevisionCount() + 1);
                }
                log.debug("Routing {} -> {}", stage.wireName(), next.wireName());
                advance(working, next);
                checkpoints.save(threadId, working);
                run = working;
            }
        } finally {
            MDC.remove("threadId");
            MDC.remove("jobId");
        }
    }

    /** The stage's partial result is dropped; only the failure and the gate's flags are kept. */
    private PipelineRun governanceFailure(PipelineRun before, Stage stage, GovernanceViolationException e) {
        log.warn("Governance gate {} refused at stage {}: {} {}", e.getGate(), stage.wireName(), e.getMessage(),
                e.getFlags());
        PipelineRun failed = codec.copy(before);
        failed.getStageHistory().add(stage);
        failed.forceFailure("Governance violation (" + e.getGate() + "): " + e.getMessage());
        Set<String> flags = new LinkedHashSet<>(failed.getGovernanceFlags());
        flags.addAll(e.getFlags());
        failed.setGovernanceFlags(List.copyOf(flags));
        failed.setUpdatedAt(clock.instant());
        advance(failed, Stage.FAILURE_CLEANUP);
        checkpoints.save(failed.getThreadId(), failed);
        return failed;
    }

    private PipelineRun markCancelled(PipelineRun run) {
        log.info("Cancelling job {} at stage {}", run.getJobId(), run.getCurrentStage().wireName());
        PipelineRun cancelled = codec.copy(run);
        cancelled.setCancelled(true);
        cancelled.forceFailure(FailureCleanupNode.CANCELLED);
        cancelled.setStatus(RunStatus.RUNNING);
        cancelled.setUpdatedAt(clock.instant());
        advance(cancelled, Stage.FAILURE_CLEANUP);
        checkpoints.save(cancelled.getThreadId(), cancelled);
        return cancelled;
    }

    private PipelineRun suspended(String threadId) {
        PipelineRun run = checkpoints.load(threadId).orElseThrow(() -> new RunNotFoundException(threadId));
        if (run.getStatus() != RunStatus.AWAITING_SIGNOFF || !run.awaitingDecision()) {
            throw new IllegalStateException("Run on thread " + threadId + " is not awaiting sign-off (status "
                    + run.getStatus() + ")");
        }
        return run;
    }

    private void applyDecision(PipelineRun run, HumanDecision decision) {
        String pending = run.getPendingDecision();
        if (decision.proposalId() != null && !decision.proposalId().equals(pending)) {
            throw new IllegalStateException("Decision answers proposal " + decision.proposalId()
                    + " but the run awaits " + pending);
        }
        HumanDecision applied = new HumanDecision(pending, decision.approved(), decision.editedContent(),
                decision.reviewer());
        run.setHumanDecision(applied);
        run.setPendingDecision(null);
        run.setStatus(RunStatus.RUNNING);
        if (applied.approved()) {
            run.setNeedsSignoff(false);
            if (applied.editedContent() != null && !applied.editedContent().isBlank()
                    && run.getReframingProposal() != null) {
                run.setReframingProposal(run.getReframingProposal().withProposal(applied.editedContent()));
            }
        } else {
            run.setFailureReason("Reframing proposal " + pending + " rejected"
                    + (applied.reviewer() == null ? "" : " by " + applied.reviewer()));
        }
        log.info("Decision on {} applied to job {}: {}", pending, run.getJobId(),
                applied.approved() ? "approved" : "rejected");

        run.setUpdatedAt(clock.instant());
        advance(run, router.nextStage(run));
        checkpoints.save(run.getThreadId(), run);
    }

    private static void advance(PipelineRun run, Stage next) {
        run.setCurrentStage(next);
        if (next.phase() != null) {
            run.setPhase(next.phase());
        }
    }

    private void acquire(String threadId) {
        if (!active.add(threadId)) {
            throw new IllegalStateException("Thread " + threadId + " is already being driven");
        }
    }

    private void release(String threadId) {
        active.remove(threadId);
        cancelRequests.remove(threadId);
    }
}
