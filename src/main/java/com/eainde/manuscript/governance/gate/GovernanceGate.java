package com.eainde.manuscript.governance.gate;

import com.eainde.manuscript.state.PipelineRun;

/**
 * A deterministic check that can keep a run from advancing. Gates must be idempotent: applying a gate to
 * its own output changes nothing.
 */
public interface GovernanceGate {

    String name();

    GateOutcome apply(PipelineRun run);
}
