package com.eainde.manuscript.edges;

import com.eainde.manuscript.model.ConflictReport;
import com.eainde.manuscript.state.CriticStatus;
import com.eainde.manuscript.state.PipelineRun;

/**
 * Decides where a run goes after the critic.
 *
 * <ol>
 * <li>A forced failure always goes to {@link CriticRoute#MANUAL}.</li>
 * <li>A passing critic goes to {@link CriticRoute#PASS}.</li>
 * <li>Anything else (fail or unknown) retries while {@code revisionCount < maxRevisions}.</li>
 * <li>With the budget exhausted the run goes to {@link CriticRoute#REFRAMING} when the current conflict
 *     report is deadlocked and reframing is enabled, else to {@link CriticRoute#MANUAL}.</li>
 * </ol>
 */
public class CriticRoutingEdge {

    private final int maxRevisions;
    private final boolean reframingOnDeadlock;

    public CriticRoutingEdge(int maxRevisions, boolean reframingOnDeadlock) {
        this.maxRevisions = maxRevisions;
        this.reframingOnDeadlock = reframingOnDeadlock;
    }

    public CriticRoute apply(PipelineRun state) {
        if (state.isForceFailure()) {
            return CriticRoute.MANUAL;
        }
        if (state.getCriticStatus() == CriticStatus.PASS) {
            return CriticRoute.PASS;
        }
        if (state.getRevisionCount() < maxRevisions) {
            return CriticRoute.RETRY;
        }
        ConflictReport report = state.getConflictReport();
        if (reframingOnDeadlock && report != null && report.deadlock()) {
            return CriticRoute.REFRAMING;
        }
        return CriticRoute.MANUAL;
    }
}
