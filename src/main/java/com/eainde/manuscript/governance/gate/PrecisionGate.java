package com.eainde.manuscript.governance.gate;

import com.eainde.manuscript.governance.precision.PrecisionGovernor;
import com.eainde.manuscript.governance.precision.PrecisionResult;
import com.eainde.manuscript.governance.precision.PrecisionSettings;
import com.eainde.manuscript.model.PrecisionContract;
import com.eainde.manuscript.model.PrecisionFlag;
import com.eainde.manuscript.model.TableData;
import com.eainde.manuscript.state.PipelineRun;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Applies the {@link PrecisionGovernor} to every table of the run.
 * <p>
 * Corrections made by the governor are advisory. In conservative mode the gate refuses when a table has no
 * source claim ids, or when a second governor pass over the governed table still raises flags (a value the
 * governor could not bring within the contract).
 * </p>
 */
public class PrecisionGate implements GovernanceGate {

    private final PrecisionGovernor governor;
    private final PrecisionSettings settings;

    public PrecisionGate(PrecisionGovernor governor, PrecisionSettings settings) {
        this.governor = governor;
        this.settings = settings;
    }

    @Override
    public String name() {
        return "precision";
    }

    @Override
    public GateOutcome apply(PipelineRun run) {
        boolean conservative = run.conservative();
        Set<PrecisionFlag> flags = new LinkedHashSet<>(run.getPrecisionFlags());
        Set<String> warnings = new LinkedHashSet<>(run.getWarnings());
        List<String> problems = new ArrayList<>();
        List<TableData> governed = new ArrayList<>();

        for (TableData table : run.getTables()) {
            PrecisionContract contract = table.contract() != null ? table.contract() : settings.contractFor(run.getRigor());
            PrecisionResult first = governor.govern(table, contract, run.getRigor());
            governed.add(first.table());
            flags.addAll(first.flags());
            warnings.addAll(first.warnings());
            if (!conservative) {
                continue;
            }
            if (table.sourceClaimIds().isEmpty()) {
                problems.add("precision:" + table.tableId() + ":missing_source_claim_ids");
            }
            PrecisionResult second = governor.govern(first.table(), contract, run.getRigor());
            second.flags().forEach(f -> problems.add("precision:" + f));
        }

        run.setTables(governed);
        run.setPrecisionFlags(new ArrayList<>(flags));
        run.setWarnings(new ArrayList<>(warnings));
        if (!problems.isEmpty()) {
            return GateOutcome.refuse(run, problems,
                    "Precision contract not met for " + problems.size() + " table value(s) or table(s)");
        }
        return GateOutcome.pass(run, flags.stream().map(f -> "precision:" + f).toList());
    }
}
