package com.eainde.manuscript.collaborator;

import com.eainde.manuscript.state.LogicValidation;

/**
 * Checks a formula for structural soundness.
 */
public interface SymbolicChecker {

    LogicValidation check(String formula);
}
