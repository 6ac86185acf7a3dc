package com.eainde.manuscript.state;

/**
 * Lead counsel triage: whether the extraction needs symbolic checking before the critic.
 */
public enum Presentation {
    DETAIL,
    SUMMARIZE
}
