package com.eainde.manuscript.model;

/**
 * Kind of conflict. Each type has its own explanation template.
 */
public enum ConflictType {
    CONTRADICTION,
    MISSING_EVIDENCE,
    AMBIGUOUS,
    OUTDATED
}
