package com.eainde.manuscript.nodes;

import com.eainde.manuscript.collaborator.SymbolicChecker;
import com.eainde.manuscript.state.LogicValidation;
import com.eainde.manuscript.state.PipelineRun;
import com.eainde.manuscript.workflow.Stage;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

/**
 * Symbolic check of the run's formula. Advisory: the outcome is recorded, never fatal.
 */
@Log4j2
@Component
public class LogicianNode implements PipelineNode {

    private final SymbolicChecker checker;

    public LogicianNode(SymbolicChecker checker) {
        this.checker = checker;
    }

    @Override
    public Stage stage() {
        return Stage.LOGICIAN;
    }

    @Override
    public void execute(PipelineRun run) {
        String formula = run.getFormula();
        if (formula == null || formula.isBlank()) {
            run.setLogicValidation(LogicValidation.missingFormula());
            return;
        }
        LogicValidation result;
        try {
            result = checker.check(formula);
        } catch (RuntimeException e) {
            log.warn("LOGICIAN: symbolic checker failed for job {}: {}", run.getJobId(), e.getMessage());
            result = LogicValidation.failed(formula, null, "checker_unavailable: " + e.getMessage());
        }
        run.setLogicValidation(result);
        log.info("LOGICIAN: job {} formula valid={} {}", run.getJobId(), result.valid(),
                result.error() == null ? "" : result.error());
    }
}
