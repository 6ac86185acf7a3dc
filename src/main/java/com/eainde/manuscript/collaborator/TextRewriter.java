package com.eainde.manuscript.collaborator;

/**
 * Rewrites a single sentence fragment so it no longer uses banned vocabulary.
 */
public interface TextRewriter {

    /**
     * @param sentence   fragment to rewrite; never contains citation markers
     * @param suggestion replacement guidance from the tone policy
     * @return the rewritten fragment
     */
    String rewrite(String sentence, String suggestion);
}
