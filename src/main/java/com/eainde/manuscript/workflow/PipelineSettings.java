package com.eainde.manuscript.workflow;

import com.eainde.manuscript.state.RigorLevel;

/**
 * @param maxRevisions        retry budget of the critic loop
 * @param reframingOnDeadlock route deadlocked, budget-exhausted runs to reframing instead of failure
 * @param defaultRigor        rigor used when a request does not name one
 */
public record PipelineSettings(int maxRevisions, boolean reframingOnDeadlock, RigorLevel defaultRigor) {

    public PipelineSettings {
        if (maxRevisions < 0) {
            throw new IllegalArgumentException("maxRevisions must be >= 0");
        }
        defaultRigor = defaultRigor == null ? RigorLevel.CONSERVATIVE : defaultRigor;
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(3, true, RigorLevel.CONSERVATIVE);
    }
}
