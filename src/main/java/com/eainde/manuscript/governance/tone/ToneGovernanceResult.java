package com.eainde.manuscript.governance.tone;

import com.eainde.manuscript.model.ToneFlag;

import java.util.List;

/**
 * @param text      governed text
 * @param findings  findings on the input text
 * @param remaining findings on the governed text; never contains fail findings in conservative mode
 * @param rewritten whether any sentence was sent for rewrite
 */
public record ToneGovernanceResult(String text, List<ToneFlag> findings, List<ToneFlag> remaining, boolean rewritten) {

    public ToneGovernanceResult {
        findings = List.copyOf(findings);
        remaining = List.copyOf(remaining);
    }
}
