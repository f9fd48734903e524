package com.boolexpr.config;

import com.boolexpr.exception.ConfigurationException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Root configuration for a rule set.
 *
 * @param name    Rule set name identifier
 * @param version Configuration version
 * @param rules   Rules in evaluation order
 */
public record RuleSetConfig(
        String name,
        String version,
        List<RuleConfig> rules
) {
    public RuleSetConfig {
        rules = rules == null ? List.of() : List.copyOf(rules);

        Set<String> names = new HashSet<>();
        for (int i = 0; i < rules.size(); i++) {
            RuleConfig rule = rules.get(i);
            if (rule.name() == null || rule.name().isBlank()) {
                throw new ConfigurationException("Rule " + i + " in '" + name + "' requires a name");
            }
            if (rule.expression() == null || rule.expression().isBlank()) {
                throw new ConfigurationException("Rule '" + rule.name() + "' requires an expression");
            }
            if (!names.add(rule.name())) {
                throw new ConfigurationException("Duplicate rule name '" + rule.name() + "' in '" + name + "'");
            }
        }
    }

    /**
     * Get a rule by name.
     */
    public RuleConfig getRule(String ruleName) {
        return rules.stream()
                .filter(r -> r.name().equals(ruleName))
                .findFirst()
                .orElse(null);
    }
}
