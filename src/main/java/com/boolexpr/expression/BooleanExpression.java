package com.boolexpr.expression;

import com.boolexpr.condition.DefaultExpressionEvaluator;
import com.boolexpr.condition.ExpressionEvaluator;
import com.boolexpr.condition.ExpressionNode;
import com.boolexpr.value.Value;
import com.boolexpr.variable.DefaultVariableResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A compiled boolean expression.
 * <p>
 * Supports:
 * <ul>
 *   <li>Logical operators: and, or</li>
 *   <li>Comparisons: ==, !=, >, >=, <, <=</li>
 *   <li>String prefix test: .*</li>
 *   <li>Variable negation: !name</li>
 *   <li>Parentheses for grouping</li>
 * </ul>
 * <p>
 * Precedence: comparison > and > or (parentheses override)
 * <p>
 * The text is tokenized and parsed once, in the constructor, so syntax errors
 * surface immediately. The resulting tree is immutable: one instance may be
 * evaluated any number of times, from any number of threads.
 *
 * <pre>
 * BooleanExpression expr = new BooleanExpression("age >= 18 and country == 'NL'");
 * boolean allowed = expr.matches(Map.of("age", 21, "country", "NL"));
 * </pre>
 */
public final class BooleanExpression {

    private static final Logger log = LoggerFactory.getLogger(BooleanExpression.class);

    private static final ExpressionEvaluator DEFAULT_EVALUATOR =
            new DefaultExpressionEvaluator(DefaultVariableResolver.INSTANCE);

    private final String expression;
    private final ExpressionNode root;
    private final ExpressionEvaluator evaluator;

    /**
     * Compile an expression.
     *
     * @param expression Expression text
     * @throws com.boolexpr.exception.ExpressionSyntaxException if the text is not a valid expression
     */
    public BooleanExpression(String expression) {
        this(expression, DEFAULT_EVALUATOR);
    }

    public BooleanExpression(String expression, ExpressionEvaluator evaluator) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.root = parse(expression);
        log.debug("Compiled expression '{}' as {}", expression, root);
    }

    /**
     * Parse an expression into a tree.
     *
     * @param expression Expression text
     * @return Root node
     * @throws com.boolexpr.exception.ExpressionSyntaxException if the text is not a valid expression
     */
    public static ExpressionNode parse(String expression) {
        // Tokenize
        List<Token> tokens = new ExpressionTokenizer(expression).tokenize();

        // Parse
        return new ExpressionParser(expression, tokens).parse();
    }

    /**
     * Evaluate against a binding.
     *
     * @param binding Variable name to value; missing variables read as false
     * @return Result; a boolean for predicates, the raw terminal for a bare number or string
     * @throws com.boolexpr.exception.EvaluationException if operand types are incompatible
     */
    public Value evaluate(Map<String, ?> binding) {
        return evaluator.evaluate(root, binding);
    }

    /**
     * Evaluate against a binding and interpret the result as a boolean.
     */
    public boolean matches(Map<String, ?> binding) {
        return evaluator.test(root, binding);
    }

    public String getExpression() {
        return expression;
    }

    public ExpressionNode getRoot() {
        return root;
    }

    @Override
    public String toString() {
        return expression;
    }
}
