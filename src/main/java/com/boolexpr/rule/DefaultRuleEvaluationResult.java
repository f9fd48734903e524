package com.boolexpr.rule;

/**
 * Default implementation of RuleEvaluationResult.
 */
public class DefaultRuleEvaluationResult implements RuleEvaluationResult {

    private final String ruleName;
    private final boolean matched;
    private final String explanation;

    private DefaultRuleEvaluationResult(String ruleName, boolean matched, String explanation) {
        this.ruleName = ruleName;
        this.matched = matched;
        this.explanation = explanation;
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }

    @Override
    public boolean isMatched() {
        return matched;
    }

    @Override
    public String getExplanation() {
        return explanation;
    }

    @Override
    public String toString() {
        return "RuleEvaluationResult{" +
                "matched=" + matched +
                ", rule=" + (ruleName != null ? ruleName : "none") +
                '}';
    }

    /**
     * Create a result for a matched rule.
     */
    public static RuleEvaluationResult matched(Rule rule, int index) {
        String explanation = "Matched rule " + (index + 1) + " '" + rule.name() + "': " + rule.expression();
        return new DefaultRuleEvaluationResult(rule.name(), true, explanation);
    }

    /**
     * Create a result when no rule matched.
     */
    public static RuleEvaluationResult unmatched(int ruleCount) {
        String explanation = "No rule matched (" + ruleCount + " evaluated)";
        return new DefaultRuleEvaluationResult(null, false, explanation);
    }
}
