package com.boolexpr.value;

import com.boolexpr.exception.EvaluationException;

import java.util.Objects;

/**
 * Runtime value produced by evaluating an expression.
 * Closed set of variants: number, string and boolean.
 */
public sealed interface Value permits Value.NumberValue, Value.StringValue, Value.BooleanValue {

    BooleanValue TRUE = new BooleanValue(true);
    BooleanValue FALSE = new BooleanValue(false);

    /**
     * Boolean interpretation of this value for AND, OR and negation.
     */
    boolean isTruthy();

    /**
     * Unwrap to the matching Java type ({@link Double}, {@link String} or {@link Boolean}).
     */
    Object toJava();

    /**
     * Short name of the variant, used in error messages.
     */
    String typeName();

    static BooleanValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    static NumberValue of(double value) {
        return new NumberValue(value);
    }

    static StringValue of(String value) {
        return new StringValue(value);
    }

    /**
     * Convert a host object taken from a binding.
     *
     * @param value Non-null binding value
     * @return Matching variant
     * @throws EvaluationException if the type has no variant
     */
    static Value from(Object value) {
        Objects.requireNonNull(value, "value");
        if (value instanceof Value v) {
            return v;
        }
        if (value instanceof Boolean b) {
            return of(b.booleanValue());
        }
        if (value instanceof Number n) {
            return of(n.doubleValue());
        }
        if (value instanceof String s) {
            return of(s);
        }
        if (value instanceof Character c) {
            return of(String.valueOf(c));
        }
        throw new EvaluationException("Unsupported variable type: " + value.getClass().getName());
    }

    record NumberValue(double value) implements Value {

        public NumberValue {
            // -0.0 and 0.0 must compare equal
            if (value == 0.0) {
                value = 0.0;
            }
        }

        @Override
        public boolean isTruthy() {
            return value != 0.0;
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String typeName() {
            return "number";
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record StringValue(String value) implements Value {

        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isTruthy() {
            return !value.isEmpty();
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String typeName() {
            return "string";
        }

        @Override
        public String toString() {
            return "\"" + value + "\"";
        }
    }

    record BooleanValue(boolean value) implements Value {

        @Override
        public boolean isTruthy() {
            return value;
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String typeName() {
            return "boolean";
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }
}
