package com.eainde.manuscript.workflow;

import com.eainde.manuscript.state.Phase;

import java.util.Locale;

/**
 * Pipeline stages in the order a successful run visits them.
 * <p>
 * {@link #SAVER} and {@link #FAILURE_CLEANUP} are terminal: the engine stops after running either.
 * {@link #FAILURE_CLEANUP} has no phase of its own and leaves the run's phase where it was.
 * </p>
 */
public enum Stage {
    VISION(Phase.INGESTING),
    CARTOGRAPHER(Phase.MAPPING),
    LEAD_COUNSEL(Phase.MAPPING),
    LOGICIAN(Phase.MAPPING),
    CRITIC(Phase.VETTING),
    REFRAMING(Phase.VETTING),
    SYNTHESIZER(Phase.SYNTHESIZING),
    TONE_GUARD(Phase.SYNTHESIZING),
    ARTIFACT_REGISTRY(Phase.SYNTHESIZING),
    TONE_VALIDATOR(Phase.SYNTHESIZING),
    SAVER(Phase.PERSISTING),
    FAILURE_CLEANUP(null);

    private final Phase phase;

    Stage(Phase phase) {
        this.phase = phase;
    }

    public Phase phase() {
        return phase;
    }

    public boolean isTerminal() {
        return this == SAVER || this == FAILURE_CLEANUP;
    }

    /** Lower-case name used in logs and the prompt manifest, e.g. {@code lead_counsel}. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
