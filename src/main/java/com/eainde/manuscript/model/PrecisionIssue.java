package com.eainde.manuscript.model;

public enum PrecisionIssue {
    EXCESSIVE_PRECISION,
    INCONSISTENT_DECIMALS
}
