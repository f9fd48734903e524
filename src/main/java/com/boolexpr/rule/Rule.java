package com.boolexpr.rule;

import com.boolexpr.expression.BooleanExpression;

import java.util.Objects;

/**
 * A named, compiled expression.
 *
 * @param name       Unique rule name
 * @param expression Compiled expression
 */
public record Rule(String name, BooleanExpression expression) {

    public Rule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(expression, "expression");
    }

    /**
     * Compile a rule from expression text.
     */
    public static Rule of(String name, String expression) {
        return new Rule(name, new BooleanExpression(expression));
    }
}
