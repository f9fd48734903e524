package com.boolexpr.rule;

import com.boolexpr.config.RuleConfig;
import com.boolexpr.config.RuleSetConfig;
import com.boolexpr.exception.ConfigurationException;
import com.boolexpr.exception.EvaluationException;
import com.boolexpr.exception.ExpressionSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * RuleEngine over compiled boolean expressions.
 * Evaluates rules sequentially (first match wins). A rule whose evaluation
 * fails on the given binding counts as not matched.
 */
public class ExpressionRuleEngine implements RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(ExpressionRuleEngine.class);

    private final String name;
    private final List<Rule> rules;

    public ExpressionRuleEngine(RuleSetConfig config) {
        this(config.name(), buildRules(config));
    }

    public ExpressionRuleEngine(String name, List<Rule> rules) {
        this.name = name;
        this.rules = List.copyOf(rules);
        validateNames(this.rules);

        log.info("ExpressionRuleEngine '{}' initialized with {} rules", name, this.rules.size());
    }

    private static List<Rule> buildRules(RuleSetConfig config) {
        List<Rule> rulesList = new ArrayList<>();
        for (RuleConfig ruleConfig : config.rules()) {
            try {
                rulesList.add(Rule.of(ruleConfig.name(), ruleConfig.expression()));
            } catch (ExpressionSyntaxException e) {
                throw new ConfigurationException("Rule '" + ruleConfig.name()
                        + "' has an invalid expression: " + e.getMessage(), e);
            }
            log.debug("Built rule '{}'", ruleConfig.name());
        }
        return rulesList;
    }

    private static void validateNames(List<Rule> rules) {
        Set<String> names = new HashSet<>();
        for (Rule rule : rules) {
            if (!names.add(rule.name())) {
                throw new ConfigurationException("Duplicate rule name '" + rule.name() + "'");
            }
        }
    }

    @Override
    public RuleEvaluationResult evaluate(Map<String, ?> binding) {
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            if (matches(rule, binding)) {
                log.debug("Rule set '{}' matched rule {} ({})", name, i, rule.name());
                return DefaultRuleEvaluationResult.matched(rule, i);
            }
        }

        log.debug("Rule set '{}': no rule matched", name);
        return DefaultRuleEvaluationResult.unmatched(rules.size());
    }

    @Override
    public List<String> evaluateAll(Map<String, ?> binding) {
        List<String> matched = new ArrayList<>();
        for (Rule rule : rules) {
            if (matches(rule, binding)) {
                matched.add(rule.name());
            }
        }
        return matched;
    }

    @Override
    public List<Rule> getRules() {
        return rules;
    }

    public String getName() {
        return name;
    }

    private boolean matches(Rule rule, Map<String, ?> binding) {
        try {
            return rule.expression().matches(binding);
        } catch (EvaluationException e) {
            log.warn("Rule '{}' could not be evaluated, treating as not matched: {}", rule.name(), e.getMessage());
            return false;
        }
    }
}
