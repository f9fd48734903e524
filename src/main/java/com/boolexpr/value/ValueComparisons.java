package com.boolexpr.value;

import com.boolexpr.exception.EvaluationException;

/**
 * Comparison rules between runtime values.
 * <p>
 * Ordering is defined per variant pair:
 * <ul>
 *   <li>number / number: numeric</li>
 *   <li>string / string: lexicographic</li>
 *   <li>boolean / boolean and boolean / number: numeric, with false as 0 and true as 1</li>
 * </ul>
 * Every other pairing is rejected. Equality follows the same numeric view of
 * booleans, so a missing variable equals 0.
 */
public final class ValueComparisons {

    private ValueComparisons() {
    }

    /**
     * Order two values.
     *
     * @return negative, zero or positive as {@code left} is less than, equal to or greater than {@code right}
     * @throws EvaluationException if the pair has no ordering
     */
    public static int compare(Value left, Value right) {
        if (left instanceof Value.StringValue l && right instanceof Value.StringValue r) {
            return l.value().compareTo(r.value());
        }
        if (isNumeric(left) && isNumeric(right)) {
            return Double.compare(toDouble(left), toDouble(right));
        }
        throw new EvaluationException("Cannot order " + left.typeName() + " " + left
                + " against " + right.typeName() + " " + right);
    }

    /**
     * Equality. Numbers and booleans compare numerically; strings only equal strings.
     */
    public static boolean equal(Value left, Value right) {
        if (isNumeric(left) && isNumeric(right)) {
            return toDouble(left) == toDouble(right);
        }
        return left.equals(right);
    }

    /**
     * Test whether {@code value} starts with {@code prefix}. Both must be strings.
     *
     * @throws EvaluationException if either side is not a string
     */
    public static boolean startsWith(Value value, Value prefix) {
        if (value instanceof Value.StringValue v && prefix instanceof Value.StringValue p) {
            return v.value().startsWith(p.value());
        }
        throw new EvaluationException("Prefix test requires strings, got "
                + value.typeName() + " " + value + " and " + prefix.typeName() + " " + prefix);
    }

    private static boolean isNumeric(Value value) {
        return value instanceof Value.NumberValue || value instanceof Value.BooleanValue;
    }

    private static double toDouble(Value value) {
        if (value instanceof Value.BooleanValue b) {
            return b.value() ? 1.0 : 0.0;
        }
        return ((Value.NumberValue) value).value();
    }
}
