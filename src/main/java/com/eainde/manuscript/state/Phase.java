package com.eainde.manuscript.state;

/**
 * Coarse lifecycle phase of a run. Stages map onto phases through {@code Stage.phase()}.
 */
public enum Phase {
    INGESTING,
    MAPPING,
    VETTING,
    SYNTHESIZING,
    PERSISTING,
    DONE
}
