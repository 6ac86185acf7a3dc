package com.eainde.manuscript.governance.gate;

import com.eainde.manuscript.state.PipelineRun;

import java.util.List;

/**
 * Result of one gate: the (possibly rewritten) run, whether it may advance, and what was flagged.
 *
 * @param message reason for refusing, {@code null} when {@code ok}
 */
public record GateOutcome(PipelineRun run, boolean ok, List<String> flags, String message) {

    public GateOutcome {
        flags = List.copyOf(flags);
    }

    public static GateOutcome pass(PipelineRun run, List<String> flags) {
        return new GateOutcome(run, true, flags, null);
    }

    public static GateOutcome refuse(PipelineRun run, List<String> flags, String message) {
        return new GateOutcome(run, false, flags, message);
    }
}
