package com.eainde.manuscript.model;

public enum ConflictSeverity {
    LOW,
    MEDIUM,
    HIGH,
    BLOCKER
}
