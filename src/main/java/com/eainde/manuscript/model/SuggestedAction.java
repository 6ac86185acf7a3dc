package com.eainde.manuscript.model;

/**
 * What a reviewer or the pipeline should do about a conflict.
 */
public enum SuggestedAction {
    RETRY_EXTRACTION,
    HUMAN_SIGNOFF_REQUIRED,
    ADD_EVIDENCE,
    NARROW_SCOPE
}
