package com.boolexpr.expression;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Lexical configuration: operator table and fragment shapes.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * Operator and keyword text mapped to token types.
     */
    public static final Map<String, TokenType> OPERATORS = Map.ofEntries(
            // Logical
            Map.entry("and", TokenType.AND),
            Map.entry("or", TokenType.OR),

            // Comparison
            Map.entry("!=", TokenType.NEQ),
            Map.entry("==", TokenType.EQ),
            Map.entry("<=", TokenType.LTE),
            Map.entry(">=", TokenType.GTE),
            Map.entry("<", TokenType.LT),
            Map.entry(">", TokenType.GT),
            Map.entry(".*", TokenType.STRING_PREFIX),

            // Grouping
            Map.entry("(", TokenType.LPAREN),
            Map.entry(")", TokenType.RPAREN)
    );

    /**
     * Delimiters the input is split on, kept as tokens.
     * Quoted strings come first so their content is never split;
     * two-character operators precede their one-character prefixes.
     */
    public static final Pattern SPLIT_PATTERN = Pattern.compile(
            "\"[^\"]*\"|'[^']*'|\\band\\b|\\bor\\b|!=|==|<=|>=|<|>|\\(|\\)|\\.\\*");

    /**
     * Decimal floating-point literal: optional sign, digits with optional fraction
     * or a leading-dot fraction, optional exponent. Special spellings such as
     * {@code nan}, {@code inf} or {@code Infinity} are not numbers; they match
     * {@link #VARIABLE_PATTERN} and read as variable references.
     */
    public static final Pattern NUMBER_PATTERN = Pattern.compile(
            "[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    /**
     * Variable name, optionally prefixed with the negation marker.
     */
    public static final Pattern VARIABLE_PATTERN = Pattern.compile("[-!A-Za-z0-9_]+");

    public static final char NEGATION = '!';
    public static final char QUOTE_DOUBLE = '"';
    public static final char QUOTE_SINGLE = '\'';
}
