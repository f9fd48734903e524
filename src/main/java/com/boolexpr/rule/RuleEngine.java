package com.boolexpr.rule;

import java.util.List;
import java.util.Map;

/**
 * Evaluates an ordered list of rules against variable bindings.
 */
public interface RuleEngine {

    /**
     * Find the first rule that matches the binding.
     *
     * @param binding Variable name to value
     * @return Evaluation result naming the matched rule, if any
     */
    RuleEvaluationResult evaluate(Map<String, ?> binding);

    /**
     * Find every rule that matches the binding.
     *
     * @param binding Variable name to value
     * @return Names of matching rules, in declaration order
     */
    List<String> evaluateAll(Map<String, ?> binding);

    /**
     * Get the rules in evaluation order.
     */
    List<Rule> getRules();
}
