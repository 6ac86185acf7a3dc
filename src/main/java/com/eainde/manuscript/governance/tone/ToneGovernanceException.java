package com.eainde.manuscript.governance.tone;

import com.eainde.manuscript.governance.GovernanceViolationException;
import com.eainde.manuscript.model.ToneFlag;

import java.util.List;

/**
 * Strict-mode rewrite did not converge: fail-severity findings remain after the rewrite pass.
 */
public class ToneGovernanceException extends GovernanceViolationException {

    private final List<ToneFlag> remaining;

    public ToneGovernanceException(String location, List<ToneFlag> remaining) {
        super("tone", "Tone governance failed for " + location + ": "
                        + remaining.size() + " fail finding(s) remain after rewrite",
                remaining.stream().map(ToneFlag::toString).toList());
        this.remaining = List.copyOf(remaining);
    }

    public List<ToneFlag> getRemaining() {
        return remaining;
    }
}
