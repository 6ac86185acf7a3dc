package com.eainde.manuscript.edges;

/**
 * Labels of the critic decision.
 */
public enum CriticRoute {
    PASS,
    RETRY,
    REFRAMING,
    MANUAL
}
