package com.boolexpr.variable;

import com.boolexpr.value.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves variable references against a caller-supplied binding.
 */
public interface VariableResolver {

    /**
     * Resolve a variable to its raw binding value.
     *
     * @param name    Variable name (without negation marker)
     * @param binding Variable binding, may be null
     * @return Bound value, or empty if absent or bound to null
     */
    Optional<Object> resolve(String name, Map<String, ?> binding);

    /**
     * Resolve a variable and convert it to a runtime value.
     *
     * @param name    Variable name (without negation marker)
     * @param binding Variable binding, may be null
     * @return Runtime value, or empty if absent
     * @throws com.boolexpr.exception.EvaluationException if the bound type has no runtime variant
     */
    default Optional<Value> resolveAsValue(String name, Map<String, ?> binding) {
        return resolve(name, binding).map(Value::from);
    }
}
