package com.eainde.manuscript.state;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of the logician's symbolic check.
 */
public record LogicValidation(
        @JsonProperty("formula") String formula,
        @JsonProperty("tool_used") String toolUsed,
        @JsonProperty("valid") boolean valid,
        @JsonProperty("error") String error
) {

    public static final String NO_FORMULA = "no_formula";

    public static LogicValidation missingFormula() {
        return new LogicValidation(null, null, false, NO_FORMULA);
    }

    public static LogicValidation failed(String formula, String toolUsed, String error) {
        return new LogicValidation(formula, toolUsed, false, error);
    }
}
