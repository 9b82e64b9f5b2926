package com.openforge.connectors.tool;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Validated, coerced arguments handed to a {@link ToolHandler}.
 * Getters return null for absent optional parameters without a default.
 */
public final class ToolArguments {

    private final Map<String, Object> values;

    public ToolArguments(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public boolean has(String name) {
        return values.get(name) != null;
    }

    public String string(String name) {
        Object v = values.get(name);
        return v == null ? null : v.toString();
    }

    public Integer integer(String name) {
        Object v = values.get(name);
        return v == null ? null : Math.toIntExact(((Number) v).longValue());
    }

    public Long longValue(String name) {
        Object v = values.get(name);
        return v == null ? null : ((Number) v).longValue();
    }

    public Double number(String name) {
        Object v = values.get(name);
        return v == null ? null : ((Number) v).doubleValue();
    }

    public Boolean bool(String name) {
        return (Boolean) values.get(name);
    }

    @SuppressWarnings("unchecked")
    public List<Object> list(String name) {
        return (List<Object>) values.get(name);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> object(String name) {
        return (Map<String, Object>) values.get(name);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
