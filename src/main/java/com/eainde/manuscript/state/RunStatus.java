package com.eainde.manuscript.state;

public enum RunStatus {
    RUNNING,
    AWAITING_SIGNOFF,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
