package com.eainde.manuscript.collaborator;

import com.eainde.manuscript.state.LogicValidation;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Local checker: verifies that brackets, braces and parentheses of a LaTeX-style formula are balanced.
 */
@Component
public class BalancedExpressionChecker implements SymbolicChecker {

    static final String TOOL = "balanced-delimiters";

    @Override
    public LogicValidation check(String formula) {
        Deque<Character> open = new ArrayDeque<>();
        for (int i = 0; i < formula.length(); i++) {
            char c = formula.charAt(i);
            if (c == '\\' && i + 1 < formula.length()) {
                i++;
                continue;
            }
            switch (c) {
                case '(', '[', '{' -> open.push(c);
                case ')', ']', '}' -> {
                    if (open.isEmpty() || open.pop() != matching(c)) {
                        return LogicValidation.failed(formula, TOOL, "unbalanced '" + c + "' at " + i);
                    }
                }
                default -> {
                }
            }
        }
        if (!open.isEmpty()) {
            return LogicValidation.failed(formula, TOOL, "unclosed '" + open.peek() + "'");
        }
        return new LogicValidation(formula, TOOL, true, null);
    }

    private static char matching(char close) {
        return switch (close) {
            case ')' -> '(';
            case ']' -> '[';
            default -> '{';
        };
    }
}
