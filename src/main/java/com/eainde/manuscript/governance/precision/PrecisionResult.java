package com.eainde.manuscript.governance.precision;

import com.eainde.manuscript.model.PrecisionFlag;
import com.eainde.manuscript.model.TableData;

import java.util.List;

/**
 * Governed table plus the advisory output of the governor.
 */
public record PrecisionResult(TableData table, List<PrecisionFlag> flags, List<String> warnings) {

    public PrecisionResult {
        flags = List.copyOf(flags);
        warnings = List.copyOf(warnings);
    }

    public boolean clean() {
        return flags.isEmpty() && warnings.isEmpty();
    }
}
