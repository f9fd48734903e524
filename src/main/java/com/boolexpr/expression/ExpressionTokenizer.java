package com.boolexpr.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

import static com.boolexpr.expression.ExpressionConfig.*;

/**
 * Tokenizer for boolean expressions.
 * <p>
 * Splits the input on operators, keeping the operators as tokens, then
 * classifies the remaining fragments. Never fails: fragments matching no
 * known shape become {@link TokenType#UNRECOGNIZED} tokens and are left
 * for the parser to reject.
 */
public final class ExpressionTokenizer {

    private final String input;

    public ExpressionTokenizer(String input) {
        this.input = input;
    }

    /**
     * Tokenize the input string.
     *
     * @return Tokens in source order, terminated by an EOF token
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = SPLIT_PATTERN.matcher(input);
        int last = 0;

        while (matcher.find()) {
            addFragment(tokens, last, matcher.start());

            String delimiter = matcher.group();
            TokenType operator = OPERATORS.get(delimiter);
            if (operator != null) {
                tokens.add(new Token(operator, delimiter, null, matcher.start()));
            } else {
                // quoted string
                tokens.add(classify(delimiter, matcher.start()));
            }
            last = matcher.end();
        }
        addFragment(tokens, last, input.length());

        tokens.add(new Token(TokenType.EOF, "", null, input.length()));
        return tokens;
    }

    private void addFragment(List<Token> tokens, int start, int end) {
        String raw = input.substring(start, end);
        String text = raw.strip();
        if (text.isEmpty()) {
            return;
        }
        tokens.add(classify(text, start + raw.indexOf(text)));
    }

    private Token classify(String text, int position) {
        if (isQuoted(text)) {
            String content = text.substring(1, text.length() - 1);
            return new Token(TokenType.STRING, text, content, position);
        }
        if (NUMBER_PATTERN.matcher(text).matches()) {
            return new Token(TokenType.NUMBER, text, Double.parseDouble(text), position);
        }
        if (VARIABLE_PATTERN.matcher(text).matches()) {
            return new Token(TokenType.VARIABLE, text, null, position);
        }
        return new Token(TokenType.UNRECOGNIZED, text, null, position);
    }

    private boolean isQuoted(String text) {
        if (text.length() < 2) {
            return false;
        }
        char first = text.charAt(0);
        return (first == QUOTE_DOUBLE || first == QUOTE_SINGLE) && text.charAt(text.length() - 1) == first;
    }
}
