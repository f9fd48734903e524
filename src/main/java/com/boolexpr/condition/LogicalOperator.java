package com.boolexpr.condition;

/**
 * Binary operators that combine conditions. AND binds tighter than OR.
 */
public enum LogicalOperator {
    AND("and"),
    OR("or");

    private final String keyword;

    LogicalOperator(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
