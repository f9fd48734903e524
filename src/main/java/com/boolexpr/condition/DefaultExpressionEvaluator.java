package com.boolexpr.condition;

import com.boolexpr.value.Value;
import com.boolexpr.value.ValueComparisons;
import com.boolexpr.variable.VariableResolver;

import java.util.Map;

/**
 * Default implementation of ExpressionEvaluator.
 * Plain recursive walk: no caching, no mutation, both sides of every
 * binary node are always evaluated.
 */
public class DefaultExpressionEvaluator implements ExpressionEvaluator {

    private final VariableResolver variableResolver;

    public DefaultExpressionEvaluator(VariableResolver variableResolver) {
        this.variableResolver = variableResolver;
    }

    @Override
    public Value evaluate(ExpressionNode node, Map<String, ?> binding) {
        if (node instanceof ExpressionNode.NumberLiteral number) {
            return Value.of(number.value());
        }
        if (node instanceof ExpressionNode.StringLiteral string) {
            return Value.of(string.value());
        }
        if (node instanceof ExpressionNode.VariableRef variable) {
            return evaluateVariable(variable, binding);
        }
        if (node instanceof ExpressionNode.Comparison comparison) {
            Value left = evaluate(comparison.left(), binding);
            Value right = evaluate(comparison.right(), binding);
            return Value.of(compare(comparison.operator(), left, right));
        }
        if (node instanceof ExpressionNode.Logical logical) {
            boolean left = evaluate(logical.left(), binding).isTruthy();
            boolean right = evaluate(logical.right(), binding).isTruthy();
            return Value.of(switch (logical.operator()) {
                case AND -> left && right;
                case OR -> left || right;
            });
        }
        throw new IllegalStateException("Unknown node type: " + node);
    }

    private Value evaluateVariable(ExpressionNode.VariableRef variable, Map<String, ?> binding) {
        // Missing variable = false
        Value value = variableResolver.resolveAsValue(variable.name(), binding)
                .orElse(Value.FALSE);
        if (variable.negated()) {
            return Value.of(!value.isTruthy());
        }
        return value;
    }

    private boolean compare(ComparisonOperator operator, Value left, Value right) {
        return switch (operator) {
            case GT -> ValueComparisons.compare(left, right) > 0;
            case GTE -> ValueComparisons.compare(left, right) >= 0;
            case LT -> ValueComparisons.compare(left, right) < 0;
            case LTE -> ValueComparisons.compare(left, right) <= 0;
            case EQ -> ValueComparisons.equal(left, right);
            case NEQ -> !ValueComparisons.equal(left, right);
            case STRING_PREFIX -> ValueComparisons.startsWith(left, right);
        };
    }
}
