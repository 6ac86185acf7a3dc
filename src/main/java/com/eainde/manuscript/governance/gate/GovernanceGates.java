package com.eainde.manuscript.governance.gate;

import com.eainde.manuscript.governance.GovernanceViolationException;
import com.eainde.manuscript.prompts.PromptRegistry;
import com.eainde.manuscript.state.PipelineRun;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The fixed, ordered list of governance gates: tone, precision, citation, conflict.
 * Gates are folded in order, each seeing the state the previous one produced.
 */
@Log4j2
public class GovernanceGates {

    static final String GATE_VERSION = "1";

    private final List<GovernanceGate> gates;

    public GovernanceGates(ToneGate tone, PrecisionGate precision, CitationGate citation, ConflictGate conflict) {
        this.gates = List.of(tone, precision, citation, conflict);
    }

    public List<GovernanceGate> gates() {
        return gates;
    }

    public ToneGate tone() {
        return (ToneGate) gates.get(0);
    }

    public PrecisionGate precision() {
        return (PrecisionGate) gates.get(1);
    }

    /** Applies every gate in order. */
    public void enforceAll(PipelineRun run) {
        enforce(run, gates);
    }

    /**
     * Applies the given gates in order and records their flags on the run.
     *
     * @throws GovernanceViolationException for the first gate that refuses
     */
    public void enforce(PipelineRun run, List<? extends GovernanceGate> selected) {
        Set<String> flags = new LinkedHashSet<>(run.getGovernanceFlags());
        PipelineRun state = run;
        for (GovernanceGate gate : selected) {
            GateOutcome outcome = gate.apply(state);
            state = outcome.run();
            state.recordPrompt("governance:" + gate.name(), PromptRegistry.governancePass(gate.name(), GATE_VERSION));
            if (!outcome.ok()) {
                log.warn("GATE {}: refused, {}", gate.name(), outcome.message());
                throw new GovernanceViolationException(gate.name(), outcome.message(), outcome.flags());
            }
            flags.addAll(outcome.flags());
            log.debug("GATE {}: passed with {} flag(s)", gate.name(), outcome.flags().size());
        }
        state.setGovernanceFlags(new ArrayList<>(flags));
    }
}
