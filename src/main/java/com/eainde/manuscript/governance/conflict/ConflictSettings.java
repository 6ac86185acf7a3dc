package com.eainde.manuscript.governance.conflict;

/**
 * @param maxRevisions         retry budget of the critic loop; deadlock is declared at this revision
 * @param humanReviewThreshold conservative runs with more conflicts than this need human review
 * @param excerptLength        characters of claim text quoted in explanations
 */
public record ConflictSettings(int maxRevisions, int humanReviewThreshold, int excerptLength) {

    public static ConflictSettings defaults() {
        return new ConflictSettings(3, 2, 60);
    }
}
