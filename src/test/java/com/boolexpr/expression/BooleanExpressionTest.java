package com.boolexpr.expression;

import com.boolexpr.exception.EvaluationException;
import com.boolexpr.exception.ExpressionSyntaxException;
import com.boolexpr.value.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests: compile once, evaluate against bindings.
 */
class BooleanExpressionTest {

    @Test
    @DisplayName("Missing variable evaluates as false")
    void missingVariableIsFalse() {
        assertEquals(Value.FALSE, new BooleanExpression("x").evaluate(Map.of()));
    }

    @Test
    @DisplayName("Negation prefix inverts the looked-up value")
    void negationInvertsLookup() {
        BooleanExpression expr = new BooleanExpression("!flag");

        assertEquals(Value.FALSE, expr.evaluate(Map.of("flag", true)));
        assertEquals(Value.TRUE, expr.evaluate(Map.of("flag", false)));
        assertEquals(Value.TRUE, expr.evaluate(Map.of()));
    }

    @ParameterizedTest
    @DisplayName("String prefix operator")
    @CsvSource({
            "abc, true",
            "ab, true",
            "xab, false",
            "a, false"
    })
    void stringPrefix(String name, boolean expected) {
        BooleanExpression expr = new BooleanExpression("name .* \"ab\"");

        assertEquals(expected, expr.matches(Map.of("name", name)));
    }

    @Test
    @DisplayName("Equality holds across quote styles")
    void equalityAcrossQuoteStyles() {
        Map<String, Object> binding = Map.of("a", "x");

        assertTrue(new BooleanExpression("a == \"x\"").matches(binding));
        assertTrue(new BooleanExpression("a == 'x'").matches(binding));
    }

    @ParameterizedTest
    @DisplayName("Numeric comparison")
    @CsvSource({
            "18, true",
            "17.9, false",
            "42, true"
    })
    void numericComparison(double age, boolean expected) {
        assertEquals(expected, new BooleanExpression("age >= 18").matches(Map.of("age", age)));
    }

    @Test
    @DisplayName("Integer bindings compare as numbers")
    void integerBinding() {
        assertTrue(new BooleanExpression("age >= 18").matches(Map.of("age", 18)));
        assertTrue(new BooleanExpression("count == 3").matches(Map.of("count", 3L)));
    }

    @Test
    @DisplayName("Unterminated group fails at construction")
    void unterminatedGroupFails() {
        assertThrows(ExpressionSyntaxException.class, () -> new BooleanExpression("(a == 1"));
    }

    @Test
    @DisplayName("Dangling operator fails at construction")
    void danglingOperatorFails() {
        assertThrows(ExpressionSyntaxException.class, () -> new BooleanExpression("a =="));
    }

    @Test
    @DisplayName("Null expression is rejected")
    void nullExpression() {
        assertThrows(NullPointerException.class, () -> new BooleanExpression(null));
    }

    @Test
    @DisplayName("Bare boolean variable as whole condition")
    void bareBooleanVariable() {
        assertEquals(Value.TRUE, new BooleanExpression("is_active").evaluate(Map.of("is_active", true)));
    }

    @Test
    @DisplayName("Bare terminal at the root yields the raw value")
    void bareTerminalYieldsRawValue() {
        assertEquals(Value.of(7.0), new BooleanExpression("7").evaluate(Map.of()));
        assertEquals(Value.of("hi"), new BooleanExpression("'hi'").evaluate(Map.of()));
        assertEquals("eu", new BooleanExpression("region").evaluate(Map.of("region", "eu")).toJava());
    }

    @Test
    @DisplayName("Precedence: and before or")
    void precedenceAffectsResult() {
        Map<String, Object> binding = Map.of("A", false, "B", true, "C", true);

        assertTrue(new BooleanExpression("A and B or C").matches(binding));
        assertFalse(new BooleanExpression("A and (B or C)").matches(binding));
    }

    @Test
    @DisplayName("Realistic policy expression")
    void policyExpression() {
        BooleanExpression expr = new BooleanExpression(
                "role == 'admin' or (age >= 18 and country != \"XX\" and !banned)");

        assertTrue(expr.matches(Map.of("role", "admin", "age", 15, "country", "XX")));
        assertTrue(expr.matches(Map.of("role", "user", "age", 30, "country", "NL")));
        assertFalse(expr.matches(Map.of("role", "user", "age", 30, "country", "NL", "banned", true)));
        assertFalse(expr.matches(Map.of("role", "user", "age", 30, "country", "XX")));
    }

    @Test
    @DisplayName("Both sides of or are evaluated even when the left side holds")
    void noShortCircuit() {
        BooleanExpression expr = new BooleanExpression("role == 'admin' or age >= 18");

        assertThrows(EvaluationException.class, () -> expr.evaluate(Map.of("role", "admin", "age", "ten")));
    }

    @Test
    @DisplayName("Missing variable in an ordering comparison is not an error")
    void missingVariableInOrdering() {
        BooleanExpression expr = new BooleanExpression("age >= 18");

        assertFalse(expr.matches(Map.of()));
        assertTrue(new BooleanExpression("age < 18").matches(Map.of()));
        assertTrue(new BooleanExpression("flag == 1").matches(Map.of("flag", true)));
    }

    @Test
    @DisplayName("Evaluation failure does not affect later evaluations")
    void evaluationFailureIsPerCall() {
        BooleanExpression expr = new BooleanExpression("age < 18");

        assertThrows(EvaluationException.class, () -> expr.evaluate(Map.of("age", "ten")));
        assertTrue(expr.matches(Map.of("age", 10)));
    }

    @Test
    @DisplayName("Null binding behaves as empty binding")
    void nullBinding() {
        assertTrue(new BooleanExpression("!x").matches(null));
    }

    @Test
    @DisplayName("One compiled expression evaluates concurrently")
    void concurrentEvaluation() throws Exception {
        BooleanExpression expr = new BooleanExpression("n >= 500 and tag .* 't'");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 1000; i++) {
                Map<String, Object> binding = new HashMap<>();
                binding.put("n", i);
                binding.put("tag", "t" + i);
                results.add(pool.submit(() -> expr.matches(binding)));
            }
            for (int i = 0; i < results.size(); i++) {
                assertEquals(i >= 500, results.get(i).get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Exposes source text and tree")
    void accessors() {
        BooleanExpression expr = new BooleanExpression("a or b");

        assertEquals("a or b", expr.getExpression());
        assertEquals(BooleanExpression.parse("a or b"), expr.getRoot());
        assertEquals("a or b", expr.toString());
    }
}
