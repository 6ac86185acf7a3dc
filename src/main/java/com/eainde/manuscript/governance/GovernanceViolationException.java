package com.eainde.manuscript.governance;

import java.util.List;

/**
 * A governance gate refused to let the run advance. Fatal for the run, not for the process:
 * the engine routes the run to failure cleanup and keeps {@link #getFlags()} on the state.
 */
public class GovernanceViolationException extends RuntimeException {

    private final String gate;
    private final List<String> flags;

    public GovernanceViolationException(String gate, String message, List<String> flags) {
        super(message);
        this.gate = gate;
        this.flags = flags == null ? List.of() : List.copyOf(flags);
    }

    public String getGate() {
        return gate;
    }

    public List<String> getFlags() {
        return flags;
    }
}
