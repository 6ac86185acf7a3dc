package com.eainde.manuscript.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Numeric-precision contract applied to one table.
 *
 * @param maxSigFigs      maximum significant digits a value may keep
 * @param maxDecimals     exact number of decimal places values are rendered with
 * @param roundingRule    rounding used for both clamps
 * @param consistencyRule whether decimal places must agree within a column
 */
public record PrecisionContract(
        @JsonProperty("max_sig_figs") int maxSigFigs,
        @JsonProperty("max_decimals") int maxDecimals,
        @JsonProperty("rounding_rule") RoundingRule roundingRule,
        @JsonProperty("consistency_rule") ConsistencyRule consistencyRule
) {

    public PrecisionContract {
        if (maxSigFigs < 1) {
            throw new IllegalArgumentException("max_sig_figs must be >= 1, was " + maxSigFigs);
        }
        if (maxDecimals < 0) {
            throw new IllegalArgumentException("max_decimals must be >= 0, was " + maxDecimals);
        }
        roundingRule = roundingRule == null ? RoundingRule.HALF_UP : roundingRule;
        consistencyRule = consistencyRule == null ? ConsistencyRule.PER_COLUMN : consistencyRule;
    }

    public static PrecisionContract of(int maxSigFigs, int maxDecimals) {
        return new PrecisionContract(maxSigFigs, maxDecimals, RoundingRule.HALF_UP, ConsistencyRule.PER_COLUMN);
    }
}
