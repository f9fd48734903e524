package com.boolexpr.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the rule engine.
 */
@ConfigurationProperties(prefix = "boolexpr")
public class BoolExprProperties {

    /**
     * Whether the rule engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the rule set file.
     * Supports classpath: prefix for classpath resources.
     */
    private String rulesPath = "classpath:boolexpr-rules.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getRulesPath() {
        return rulesPath;
    }

    public void setRulesPath(String rulesPath) {
        this.rulesPath = rulesPath;
    }
}
