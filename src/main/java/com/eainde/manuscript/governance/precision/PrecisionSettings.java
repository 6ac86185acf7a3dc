package com.eainde.manuscript.governance.precision;

import com.eainde.manuscript.model.ConsistencyRule;
import com.eainde.manuscript.model.PrecisionContract;
import com.eainde.manuscript.model.RoundingRule;
import com.eainde.manuscript.state.RigorLevel;

/**
 * Project defaults used for tables that carry no contract of their own.
 */
public record PrecisionSettings(int maxSigFigs, int conservativeMaxDecimals, int exploratoryMaxDecimals,
                                RoundingRule rounding, ConsistencyRule consistency) {

    public static PrecisionSettings defaults() {
        return new PrecisionSettings(4, 2, 3, RoundingRule.HALF_UP, ConsistencyRule.PER_COLUMN);
    }

    public PrecisionContract contractFor(RigorLevel rigor) {
        int decimals = rigor == RigorLevel.CONSERVATIVE ? conservativeMaxDecimals : exploratoryMaxDecimals;
        return new PrecisionContract(maxSigFigs, decimals, rounding, consistency);
    }
}
