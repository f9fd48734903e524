package com.boolexpr.expression;

import com.boolexpr.condition.ComparisonOperator;
import com.boolexpr.condition.ExpressionNode;
import com.boolexpr.condition.LogicalOperator;
import com.boolexpr.exception.ExpressionSyntaxException;
import com.boolexpr.exception.UnrecognizedTokenException;

import java.util.List;

import static com.boolexpr.expression.ExpressionConfig.NEGATION;

/**
 * Parser for boolean expressions.
 * Converts tokens into an ExpressionNode tree using recursive descent parsing.
 * <p>
 * Grammar (precedence: comparison > AND > OR):
 * <pre>
 * expression := andTerm ('or' andTerm)*
 * andTerm    := condition ('and' condition)*
 * condition  := '(' expression ')' | terminal [operator terminal]
 * terminal   := NUMBER | STRING | VARIABLE
 * operator   := '>' | '>=' | '<' | '<=' | '==' | '!=' | '.*'
 * </pre>
 * Binary operators of equal precedence fold to the left.
 * Instances hold a cursor and are single-use.
 */
public final class ExpressionParser {

    private final String input;
    private final List<Token> tokens;
    private int index;

    public ExpressionParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse the token stream into an expression tree.
     *
     * @return Root node
     * @throws ExpressionSyntaxException if the tokens do not form an expression
     */
    public ExpressionNode parse() {
        ExpressionNode result = parseExpression();
        if (!isAtEnd()) {
            throw unexpected("End of input expected");
        }
        return result;
    }

    private ExpressionNode parseExpression() {
        ExpressionNode left = parseAndTerm();
        while (match(TokenType.OR)) {
            ExpressionNode right = parseAndTerm();
            left = new ExpressionNode.Logical(LogicalOperator.OR, left, right);
        }
        return left;
    }

    private ExpressionNode parseAndTerm() {
        ExpressionNode left = parseCondition();
        while (match(TokenType.AND)) {
            ExpressionNode right = parseCondition();
            left = new ExpressionNode.Logical(LogicalOperator.AND, left, right);
        }
        return left;
    }

    private ExpressionNode parseCondition() {
        // Parenthesized expression
        if (match(TokenType.LPAREN)) {
            ExpressionNode expr = parseExpression();
            if (!match(TokenType.RPAREN)) {
                throw unexpected("Closing ) expected");
            }
            return expr;
        }

        ExpressionNode left = parseTerminal();

        // A terminal on its own is a complete condition
        ComparisonOperator operator = comparisonOperator(peek().type());
        if (operator == null) {
            return left;
        }
        advance();

        ExpressionNode right = parseTerminal();
        return new ExpressionNode.Comparison(operator, left, right);
    }

    private ExpressionNode parseTerminal() {
        Token token = peek();
        return switch (token.type()) {
            case NUMBER -> {
                advance();
                yield new ExpressionNode.NumberLiteral((Double) token.literal());
            }
            case STRING -> {
                advance();
                yield new ExpressionNode.StringLiteral((String) token.literal());
            }
            case VARIABLE -> {
                advance();
                yield variableRef(token.text());
            }
            default -> throw unexpected("Number, string or variable expected");
        };
    }

    private ExpressionNode.VariableRef variableRef(String text) {
        if (text.charAt(0) == NEGATION) {
            return new ExpressionNode.VariableRef(text.substring(1), true);
        }
        return new ExpressionNode.VariableRef(text, false);
    }

    private ComparisonOperator comparisonOperator(TokenType type) {
        return switch (type) {
            case GT -> ComparisonOperator.GT;
            case GTE -> ComparisonOperator.GTE;
            case LT -> ComparisonOperator.LT;
            case LTE -> ComparisonOperator.LTE;
            case EQ -> ComparisonOperator.EQ;
            case NEQ -> ComparisonOperator.NEQ;
            case STRING_PREFIX -> ComparisonOperator.STRING_PREFIX;
            default -> null;
        };
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return tokens.get(index - 1);
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private ExpressionSyntaxException unexpected(String message) {
        Token token = peek();
        if (token.type() == TokenType.UNRECOGNIZED) {
            return unrecognized(token);
        }
        String found = token.type() == TokenType.EOF
                ? "end of input"
                : "'" + token.text() + "'";
        return new ExpressionSyntaxException(message + ", but got " + found, input, token.position());
    }

    private UnrecognizedTokenException unrecognized(Token token) {
        return new UnrecognizedTokenException(token.text(), input, token.position());
    }
}
