package com.openforge.connectors.tool;

import java.util.List;

/**
 * One named input of a tool.
 *
 * @param defaultValue applied when an optional parameter is absent
 * @param allowed      enumeration of permitted values (compared as strings), empty for any
 * @param minimum      inclusive lower bound for numeric types
 * @param maximum      inclusive upper bound for numeric types
 * @param itemType     element type for arrays, null for untyped arrays
 */
public record ToolParameter(
        String name,
        ParamType type,
        String description,
        boolean required,
        Object defaultValue,
        List<String> allowed,
        Double minimum,
        Double maximum,
        ParamType itemType
) {

    public ToolParameter {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Parameter name must not be blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("Parameter '%s' has no type".formatted(name));
        }
        allowed = allowed == null ? List.of() : List.copyOf(allowed);
        if (required && defaultValue != null) {
            throw new IllegalArgumentException(
                    "Required parameter '%s' cannot declare a default".formatted(name));
        }
    }
}
