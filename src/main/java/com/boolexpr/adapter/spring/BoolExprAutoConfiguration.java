package com.boolexpr.adapter.spring;

import com.boolexpr.config.ConfigLoader;
import com.boolexpr.config.RuleSetConfig;
import com.boolexpr.rule.ExpressionRuleEngine;
import com.boolexpr.rule.RuleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration for the rule engine.
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "boolexpr", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(BoolExprProperties.class)
public class BoolExprAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(BoolExprAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public RuleSetConfig ruleSetConfig(BoolExprProperties properties) {
        log.info("Loading rule set from: {}", properties.getRulesPath());
        return ConfigLoader.load(properties.getRulesPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleEngine ruleEngine(RuleSetConfig config) {
        log.info("Creating RuleEngine: {}", config.name());
        return new ExpressionRuleEngine(config);
    }
}
