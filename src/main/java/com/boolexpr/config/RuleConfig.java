package com.boolexpr.config;

/**
 * Configuration for a single named rule.
 *
 * @param name       Unique rule name
 * @param expression Expression text (e.g., {@code role == "admin" or age >= 18})
 */
public record RuleConfig(String name, String expression) {
}
