package com.eainde.manuscript.workflow;

import com.eainde.manuscript.edges.CriticRoutingEdge;
import com.eainde.manuscript.state.Presentation;
import com.eainde.manuscript.state.PipelineRun;

/**
 * The transition table of the pipeline as one pure function of the run's state.
 */
public class StageRouter {

    private final CriticRoutingEdge criticEdge;

    public StageRouter(CriticRoutingEdge criticEdge) {
        this.criticEdge = criticEdge;
    }

    /**
     * @return the stage that follows {@code run.getCurrentStage()}
     * @throws IllegalStateException when the current stage is terminal
     */
    public Stage nextStage(PipelineRun run) {
        Stage current = run.getCurrentStage();
        return switch (current) {
            case VISION -> Stage.CARTOGRAPHER;
            case CARTOGRAPHER -> {
                if (run.isForceFailure()) {
                    yield Stage.FAILURE_CLEANUP;
                }
                yield run.getExtraction().hasTriples() ? Stage.LEAD_COUNSEL : Stage.CRITIC;
            }
            case LEAD_COUNSEL -> run.getPresentation() == Presentation.DETAIL ? Stage.LOGICIAN : Stage.CRITIC;
            case LOGICIAN -> Stage.CRITIC;
            case CRITIC -> switch (criticEdge.apply(run)) {
                case PASS -> Stage.SYNTHESIZER;
                case RETRY -> Stage.CARTOGRAPHER;
                case REFRAMING -> Stage.REFRAMING;
                case MANUAL -> Stage.FAILURE_CLEANUP;
            };
            case REFRAMING -> run.isNeedsSignoff() ? Stage.FAILURE_CLEANUP : Stage.SAVER;
            case SYNTHESIZER -> orFailure(run, Stage.TONE_GUARD);
            case TONE_GUARD -> orFailure(run, Stage.ARTIFACT_REGISTRY);
            case ARTIFACT_REGISTRY -> orFailure(run, Stage.TONE_VALIDATOR);
            case TONE_VALIDATOR -> orFailure(run, Stage.SAVER);
            case SAVER, FAILURE_CLEANUP -> throw new IllegalStateException("No transition out of terminal stage " + current);
        };
    }

    private static Stage orFailure(PipelineRun run, Stage next) {
        return run.isForceFailure() ? Stage.FAILURE_CLEANUP : next;
    }
}
