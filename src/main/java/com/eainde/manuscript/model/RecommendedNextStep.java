package com.eainde.manuscript.model;

/**
 * Routing hint carried by a {@link ConflictReport}.
 */
public enum RecommendedNextStep {
    PROCEED,
    REVISE_AND_RETRY,
    PAUSE_FOR_HUMAN,
    TRIGGER_REFRAMING
}
