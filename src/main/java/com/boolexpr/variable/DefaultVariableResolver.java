package com.boolexpr.variable;

import com.boolexpr.exception.EvaluationException;
import com.boolexpr.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Default implementation of VariableResolver: a flat map lookup.
 */
public class DefaultVariableResolver implements VariableResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultVariableResolver.class);

    public static final DefaultVariableResolver INSTANCE = new DefaultVariableResolver();

    @Override
    public Optional<Object> resolve(String name, Map<String, ?> binding) {
        if (name == null || name.isEmpty() || binding == null) {
            return Optional.empty();
        }

        Object value = binding.get(name);
        if (value == null) {
            log.trace("Variable '{}' not bound", name);
            return Optional.empty();
        }
        return Optional.of(value);
    }

    @Override
    public Optional<Value> resolveAsValue(String name, Map<String, ?> binding) {
        Optional<Object> raw = resolve(name, binding);
        try {
            return raw.map(Value::from);
        } catch (EvaluationException e) {
            log.warn("Variable '{}' has unsupported type {}", name, raw.get().getClass().getName());
            throw e;
        }
    }
}
