package com.eainde.manuscript.prompts;

/**
 * Backing store of role prompts, consulted on cache misses.
 */
@FunctionalInterface
public interface PromptSource {

    /**
     * @throws IllegalArgumentException when the role has no prompt
     */
    PromptTemplate load(String role);
}
