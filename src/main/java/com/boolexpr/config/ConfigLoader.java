package com.boolexpr.config;

import com.boolexpr.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads rule sets from YAML files.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String CLASSPATH_PREFIX = "classpath:";
    private static final String ROOT_KEY = "boolexpr";

    private ConfigLoader() {
    }

    /**
     * Load a rule set from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static RuleSetConfig load(String path) {
        log.info("Loading rule set from: {}", path);

        Resource resource = getResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Load a rule set from an already opened stream. The stream is not closed.
     */
    public static RuleSetConfig load(InputStream inputStream) {
        return parseYaml(inputStream);
    }

    private static Resource getResource(String path) {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            return new ClassPathResource(path.substring(CLASSPATH_PREFIX.length()));
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static RuleSetConfig parseYaml(InputStream inputStream) {
        Object document;
        try {
            document = new Yaml().load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed YAML: " + e.getMessage(), e);
        }

        if (document == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        if (!(document instanceof Map)) {
            throw new ConfigurationException("Configuration root must be a mapping");
        }

        Map<String, Object> root = (Map<String, Object>) document;

        // The rule set may sit at the root or under a 'boolexpr' key
        Map<String, Object> ruleSet = root;
        if (root.containsKey(ROOT_KEY)) {
            Object nested = root.get(ROOT_KEY);
            if (!(nested instanceof Map)) {
                throw new ConfigurationException("'" + ROOT_KEY + "' must be a mapping");
            }
            ruleSet = (Map<String, Object>) nested;
        }

        String name = getString(ruleSet, "name", "default-rules");
        String version = getString(ruleSet, "version", "1.0");
        List<RuleConfig> rules = parseRules(ruleSet.get("rules"));

        if (rules.isEmpty()) {
            log.warn("Rule set '{}' declares no rules", name);
        }

        RuleSetConfig config = new RuleSetConfig(name, version, rules);
        log.info("Loaded rule set: {} v{} with {} rules", name, version, rules.size());
        return config;
    }

    @SuppressWarnings("unchecked")
    private static List<RuleConfig> parseRules(Object rulesNode) {
        if (rulesNode == null) {
            return List.of();
        }
        if (!(rulesNode instanceof List)) {
            throw new ConfigurationException("'rules' must be a list");
        }

        List<RuleConfig> rules = new ArrayList<>();
        List<Object> list = (List<Object>) rulesNode;
        for (int i = 0; i < list.size(); i++) {
            Object item = list.get(i);
            if (!(item instanceof Map)) {
                throw new ConfigurationException("Rule " + i + " must be a mapping");
            }
            Map<String, Object> ruleMap = (Map<String, Object>) item;
            String name = getString(ruleMap, "name", null);
            String expression = getExpression(ruleMap, i);
            rules.add(new RuleConfig(name, expression));
            log.debug("Parsed rule: name={}, expression={}", name, expression);
        }
        return rules;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        throw new ConfigurationException("'" + key + "' must be a scalar value, got: " + value);
    }

    /**
     * Expressions must be YAML strings: other scalars lose their source spelling
     * ({@code yes} loads as {@code true}, {@code 1e3} as a number).
     */
    private static String getExpression(Map<String, Object> ruleMap, int index) {
        Object value = ruleMap.get("expression");
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new ConfigurationException("Rule " + index + ": 'expression' must be a string, got "
                + value.getClass().getSimpleName() + " " + value + " (quote it)");
    }
}
