package com.boolexpr.condition;

import java.util.Objects;

/**
 * Node of a parsed expression tree.
 * <p>
 * Leaves are literals and variable references; inner nodes apply a
 * comparison or logical operator to exactly two children. Trees are
 * immutable and may be shared between threads.
 */
public sealed interface ExpressionNode permits ExpressionNode.NumberLiteral, ExpressionNode.StringLiteral,
        ExpressionNode.VariableRef, ExpressionNode.Comparison, ExpressionNode.Logical {

    record NumberLiteral(double value) implements ExpressionNode {
        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record StringLiteral(String value) implements ExpressionNode {
        public StringLiteral {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return "\"" + value + "\"";
        }
    }

    /**
     * @param name    Variable name without the negation marker
     * @param negated True when the source name was prefixed with {@code !}
     */
    record VariableRef(String name, boolean negated) implements ExpressionNode {
        public VariableRef {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return negated ? "!" + name : name;
        }
    }

    record Comparison(ComparisonOperator operator, ExpressionNode left, ExpressionNode right)
            implements ExpressionNode {
        public Comparison {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator.getSymbol() + " " + right + ")";
        }
    }

    record Logical(LogicalOperator operator, ExpressionNode left, ExpressionNode right)
            implements ExpressionNode {
        public Logical {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator.getKeyword() + " " + right + ")";
        }
    }
}
