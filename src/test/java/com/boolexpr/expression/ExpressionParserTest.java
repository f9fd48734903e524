package com.boolexpr.expression;

import com.boolexpr.condition.ComparisonOperator;
import com.boolexpr.condition.ExpressionNode;
import com.boolexpr.condition.ExpressionNode.Comparison;
import com.boolexpr.condition.ExpressionNode.Logical;
import com.boolexpr.condition.ExpressionNode.NumberLiteral;
import com.boolexpr.condition.ExpressionNode.StringLiteral;
import com.boolexpr.condition.ExpressionNode.VariableRef;
import com.boolexpr.condition.LogicalOperator;
import com.boolexpr.exception.ExpressionSyntaxException;
import com.boolexpr.exception.UnrecognizedTokenException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExpressionParser.
 */
class ExpressionParserTest {

    private static ExpressionNode parse(String input) {
        return new ExpressionParser(input, new ExpressionTokenizer(input).tokenize()).parse();
    }

    private static VariableRef var(String name) {
        return new VariableRef(name, false);
    }

    private static Logical and(ExpressionNode left, ExpressionNode right) {
        return new Logical(LogicalOperator.AND, left, right);
    }

    private static Logical or(ExpressionNode left, ExpressionNode right) {
        return new Logical(LogicalOperator.OR, left, right);
    }

    @Nested
    @DisplayName("Tree shape")
    class TreeShape {

        @Test
        @DisplayName("Comparison of variable and number")
        void comparison() {
            assertEquals(new Comparison(ComparisonOperator.GTE, var("age"), new NumberLiteral(18)),
                    parse("age >= 18"));
        }

        @Test
        @DisplayName("String prefix test")
        void stringPrefix() {
            assertEquals(new Comparison(ComparisonOperator.STRING_PREFIX, var("name"), new StringLiteral("ab")),
                    parse("name .* \"ab\""));
        }

        @Test
        @DisplayName("Bare terminal is a complete condition")
        void bareTerminal() {
            assertEquals(var("is_active"), parse("is_active"));
            assertEquals(new NumberLiteral(42), parse("42"));
            assertEquals(new StringLiteral("x"), parse("'x'"));
        }

        @Test
        @DisplayName("Leading ! marks the variable as negated")
        void negatedVariable() {
            assertEquals(new VariableRef("flag", true), parse("!flag"));
        }

        @Test
        @DisplayName("Literals may appear on either side of a comparison")
        void literalOnLeft() {
            assertEquals(new Comparison(ComparisonOperator.LT, new NumberLiteral(1), new NumberLiteral(2)),
                    parse("1 < 2"));
        }

        @Test
        @DisplayName("Redundant parentheses leave the tree unchanged")
        void redundantParentheses() {
            assertEquals(parse("a == 1"), parse("((a == 1))"));
        }
    }

    @Nested
    @DisplayName("Precedence and associativity")
    class Precedence {

        @Test
        @DisplayName("and binds tighter than or")
        void andBeforeOr() {
            assertEquals(or(and(var("A"), var("B")), var("C")), parse("A and B or C"));
            assertEquals(or(var("A"), and(var("B"), var("C"))), parse("A or B and C"));
        }

        @Test
        @DisplayName("or folds to the left")
        void orLeftAssociative() {
            assertEquals(or(or(var("A"), var("B")), var("C")), parse("A or B or C"));
        }

        @Test
        @DisplayName("and folds to the left")
        void andLeftAssociative() {
            assertEquals(and(and(var("A"), var("B")), var("C")), parse("A and B and C"));
        }

        @Test
        @DisplayName("Parentheses override precedence")
        void parenthesesOverride() {
            ExpressionNode grouped = parse("A and (B or C)");

            assertEquals(and(var("A"), or(var("B"), var("C"))), grouped);
            assertNotEquals(parse("A and B or C"), grouped);
        }

        @Test
        @DisplayName("Comparisons bind tighter than and")
        void comparisonBeforeAnd() {
            assertEquals(
                    and(new Comparison(ComparisonOperator.EQ, var("a"), new NumberLiteral(1)),
                            new Comparison(ComparisonOperator.NEQ, var("b"), new StringLiteral("x"))),
                    parse("a == 1 and b != 'x'"));
        }

        @Test
        @DisplayName("Parsing the same text twice yields equal trees")
        void deterministic() {
            String text = "(a > 1 or b .* 'x') and !c or d <= 2.5";
            assertEquals(parse(text), parse(text));
        }
    }

    @Nested
    @DisplayName("Syntax errors")
    class Errors {

        @Test
        @DisplayName("Unterminated group")
        void unterminatedGroup() {
            ExpressionSyntaxException e = assertThrows(ExpressionSyntaxException.class, () -> parse("(a == 1"));

            assertTrue(e.getMessage().contains("Closing ) expected"), e.getMessage());
            assertEquals(7, e.getPosition());
            assertEquals("(a == 1", e.getExpression());
        }

        @Test
        @DisplayName("Dangling operator")
        void danglingOperator() {
            ExpressionSyntaxException e = assertThrows(ExpressionSyntaxException.class, () -> parse("a =="));

            assertTrue(e.getMessage().contains("Number, string or variable expected"), e.getMessage());
            assertTrue(e.getMessage().contains("end of input"), e.getMessage());
        }

        @Test
        @DisplayName("Operator where a terminal is expected")
        void operatorInsteadOfTerminal() {
            ExpressionSyntaxException e = assertThrows(ExpressionSyntaxException.class, () -> parse("a == and"));

            assertTrue(e.getMessage().contains("'and'"), e.getMessage());
            assertEquals(5, e.getPosition());
        }

        @ParameterizedTest
        @DisplayName("Malformed inputs are rejected")
        @ValueSource(strings = {"", "   ", "and", "a or", "a and", "()", "(", ")", "a == 1 )", "a == b == c", "a < > b"})
        void rejected(String input) {
            assertThrows(ExpressionSyntaxException.class, () -> parse(input));
        }

        @Test
        @DisplayName("Trailing tokens after a complete expression")
        void trailingToken() {
            ExpressionSyntaxException e = assertThrows(ExpressionSyntaxException.class, () -> parse("a == 1 )"));

            assertTrue(e.getMessage().contains("End of input expected"), e.getMessage());
        }

        @Test
        @DisplayName("Unrecognized fragment consumed as operand")
        void unrecognizedOperand() {
            UnrecognizedTokenException e = assertThrows(UnrecognizedTokenException.class,
                    () -> parse("a == #x"));

            assertEquals("#x", e.getFragment());
            assertEquals(5, e.getPosition());
        }

        @Test
        @DisplayName("Unrecognized fragment in operator position")
        void unrecognizedOperator() {
            UnrecognizedTokenException e = assertThrows(UnrecognizedTokenException.class,
                    () -> parse("a and b c"));

            assertEquals("b c", e.getFragment());
        }

        @Test
        @DisplayName("Unrecognized fragment after a terminal")
        void unrecognizedAfterTerminal() {
            assertThrows(UnrecognizedTokenException.class, () -> parse("(a ~)"));
        }
    }
}
