package com.formula.evaluator;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Map-backed VariableResolver.
 */
public class DefaultVariableResolver implements VariableResolver {

    private final Map<String, Object> bindings;

    public DefaultVariableResolver(Map<String, ?> bindings) {
        this.bindings = bindings == null ? Collections.emptyMap() : new HashMap<>(bindings);
    }

    @Override
    public Optional<Object> resolve(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(bindings.get(name));
    }

    public Map<String, Object> bindings() {
        return Collections.unmodifiableMap(bindings);
    }

    static Optional<Object> convert(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Boolean b) {
            return Optional.of(b);
        }
        if (value instanceof Double d) {
            return Optional.of(d);
        }
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            if ("true".equalsIgnoreCase(trimmed) || "false".equalsIgnoreCase(trimmed)) {
                return Optional.of(Boolean.parseBoolean(trimmed));
            }
            try {
                return Optional.of(Double.parseDouble(trimmed));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
