package com.boolexpr.condition;

import com.boolexpr.value.Value;

import java.util.Map;

/**
 * Evaluates expression trees against a variable binding.
 */
public interface ExpressionEvaluator {

    /**
     * Evaluate a tree.
     *
     * @param node    Root of the tree
     * @param binding Variable name to value, may be null
     * @return Computed value
     * @throws com.boolexpr.exception.EvaluationException if an operator gets operands it cannot handle
     */
    Value evaluate(ExpressionNode node, Map<String, ?> binding);

    /**
     * Evaluate a tree and interpret the result as a boolean.
     */
    default boolean test(ExpressionNode node, Map<String, ?> binding) {
        return evaluate(node, binding).isTruthy();
    }
}
