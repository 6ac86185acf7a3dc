package com.eainde.manuscript.collaborator;

/**
 * Implemented by collaborators that drive a language model with a registry prompt, so stages can
 * record the prompt version in the run's manifest.
 */
public interface PromptAware {

    String promptRole();
}
