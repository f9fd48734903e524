package com.boolexpr.rule;

/**
 * Result of rule evaluation.
 */
public interface RuleEvaluationResult {

    /**
     * Get the name of the matched rule.
     * Null if no rule matched.
     */
    String getRuleName();

    /**
     * Check if a rule matched.
     */
    boolean isMatched();

    /**
     * Get human-readable explanation of the decision.
     */
    String getExplanation();
}
