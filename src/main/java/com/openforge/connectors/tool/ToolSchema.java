package com.openforge.connectors.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.connectors.error.ToolArgumentException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Declared input of a tool: an ordered list of typed parameters.
 *
 * Two jobs:
 *  - {@link #toJson()} renders a JSON Schema object. Keys follow declaration
 *    order, so the same declaration always yields byte-identical output.
 *  - {@link #validate(String, Map)} checks caller arguments, applies lax
 *    coercion (numeric/boolean strings, integral doubles) and defaults, and
 *    reports every violation at once.
 *
 * Wire format:
 * {
 *   "type": "object",
 *   "properties": { "a": { "type": "integer", "description": "..." }, ... },
 *   "required": ["a"],
 *   "additionalProperties": false
 * }
 */
public final class ToolSchema {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final List<ToolParameter> parameters;
    private final Map<String, ToolParameter> byName;
    private final ObjectNode json;

    private ToolSchema(List<ToolParameter> parameters) {
        this.parameters = List.copyOf(parameters);
        Map<String, ToolParameter> index = new LinkedHashMap<>();
        for (ToolParameter p : parameters) {
            if (index.put(p.name(), p) != null) {
                throw new IllegalArgumentException("Duplicate parameter name: " + p.name());
            }
        }
        this.byName = index;
        this.json = render(this.parameters);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ToolSchema empty() {
        return new ToolSchema(List.of());
    }

    public List<ToolParameter> parameters() {
        return parameters;
    }

    /** A fresh copy of the JSON Schema; callers may mutate it. */
    public ObjectNode toJson() {
        return json.deepCopy();
    }

    // ── Validation ───────────────────────────────────────────────────────────

    /**
     * Validate and normalize arguments.
     *
     * @return arguments in declaration order with defaults filled and values coerced
     * @throws ToolArgumentException listing every violation; nothing is invoked
     */
    public Map<String, Object> validate(String toolName, Map<String, ?> arguments) {
        Map<String, ?> args = arguments == null ? Map.of() : arguments;
        List<String> violations = new ArrayList<>();
        Map<String, Object> normalized = new LinkedHashMap<>();

        for (String key : args.keySet()) {
            if (!byName.containsKey(key)) {
                violations.add("unexpected argument '%s'".formatted(key));
            }
        }

        for (ToolParameter p : parameters) {
            Object raw = args.get(p.name());
            if (raw == null) {
                if (p.required()) {
                    violations.add("missing required argument '%s'".formatted(p.name()));
                } else if (p.defaultValue() != null) {
                    normalized.put(p.name(), p.defaultValue());
                }
                continue;
            }
            Object value = coerce(p.name(), raw, p.type(), p.itemType(), violations);
            if (value == null) {
                continue;
            }
            if (!p.allowed().isEmpty() && !p.allowed().contains(String.valueOf(value))) {
                violations.add("'%s' must be one of %s, got '%s'".formatted(p.name(), p.allowed(), value));
                continue;
            }
            if (value instanceof Number n) {
                if (p.minimum() != null && n.doubleValue() < p.minimum()) {
                    violations.add("'%s' must be >= %s, got %s".formatted(p.name(), format(p.minimum()), value));
                    continue;
                }
                if (p.maximum() != null && n.doubleValue() > p.maximum()) {
                    violations.add("'%s' must be <= %s, got %s".formatted(p.name(), format(p.maximum()), value));
                    continue;
                }
            }
            normalized.put(p.name(), value);
        }

        if (!violations.isEmpty()) {
            throw new ToolArgumentException(toolName, violations);
        }
        return normalized;
    }

    /** Returns the coerced value, or null after recording a violation. */
    private static Object coerce(String path, Object raw, ParamType type, ParamType itemType, List<String> violations) {
        Object value = switch (type) {
            case STRING -> raw instanceof String || raw instanceof Number || raw instanceof Boolean
                    ? String.valueOf(raw) : null;
            case INTEGER -> toLong(raw);
            case NUMBER -> toDouble(raw);
            case BOOLEAN -> toBoolean(raw);
            case ARRAY -> raw instanceof Collection<?> c ? coerceItems(path, c, itemType, violations) : null;
            case OBJECT -> raw instanceof Map<?, ?> ? raw : null;
        };
        if (value == null && !(type == ParamType.ARRAY && raw instanceof Collection<?>)) {
            violations.add("'%s' must be of type %s, got %s".formatted(path, type.jsonType(), describe(raw)));
        }
        return value;
    }

    private static List<Object> coerceItems(String path, Collection<?> items, ParamType itemType, List<String> violations) {
        List<Object> out = new ArrayList<>(items.size());
        if (itemType == null) {
            out.addAll(items);
            return out;
        }
        int before = violations.size();
        int i = 0;
        for (Object item : items) {
            String itemPath = "%s[%d]".formatted(path, i++);
            if (item == null) {
                violations.add("'%s' must not be null".formatted(itemPath));
                continue;
            }
            out.add(coerce(itemPath, item, itemType, null, violations));
        }
        return violations.size() == before ? out : null;
    }

    private static Long toLong(Object raw) {
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof BigInteger b) {
            return b.bitLength() < 64 ? b.longValue() : null;
        }
        if (raw instanceof Number n) {
            double d = n.doubleValue();
            return d == Math.rint(d) && !Double.isInfinite(d) ? (long) d : null;
        }
        if (raw instanceof String s) {
            try {
                return new BigDecimal(s.trim()).longValueExact();
            } catch (NumberFormatException | ArithmeticException e) {
                return null;
            }
        }
        return null;
    }

    private static Double toDouble(Object raw) {
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        if (raw instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Boolean toBoolean(Object raw) {
        if (raw instanceof Boolean b) {
            return b;
        }
        if (raw instanceof String s) {
            String v = s.trim().toLowerCase(Locale.ROOT);
            if (v.equals("true")) return Boolean.TRUE;
            if (v.equals("false")) return Boolean.FALSE;
        }
        return null;
    }

    private static String describe(Object raw) {
        if (raw instanceof String) return "string";
        if (raw instanceof Boolean) return "boolean";
        if (raw instanceof Number) return "number";
        if (raw instanceof Collection<?>) return "array";
        if (raw instanceof Map<?, ?>) return "object";
        return raw.getClass().getSimpleName();
    }

    private static String format(double d) {
        return d == Math.rint(d) ? String.valueOf((long) d) : String.valueOf(d);
    }

    // ── JSON rendering ───────────────────────────────────────────────────────

    private static ObjectNode render(List<ToolParameter> parameters) {
        ObjectNode schema = NODES.objectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        ArrayNode required = NODES.arrayNode();
        for (ToolParameter p : parameters) {
            ObjectNode prop = properties.putObject(p.name());
            prop.put("type", p.type().jsonType());
            if (p.description() != null && !p.description().isBlank()) {
                prop.put("description", p.description());
            }
            if (!p.allowed().isEmpty()) {
                ArrayNode values = prop.putArray("enum");
                p.allowed().forEach(values::add);
            }
            if (p.minimum() != null) {
                prop.put("minimum", p.minimum());
            }
            if (p.maximum() != null) {
                prop.put("maximum", p.maximum());
            }
            if (p.type() == ParamType.ARRAY && p.itemType() != null) {
                prop.putObject("items").put("type", p.itemType().jsonType());
            }
            if (p.defaultValue() != null) {
                prop.set("default", toNode(p.defaultValue()));
            }
            if (p.required()) {
                required.add(p.name());
            }
        }
        schema.set("required", required);
        schema.put("additionalProperties", false);
        return schema;
    }

    private static JsonNode toNode(Object value) {
        if (value instanceof String s) return NODES.textNode(s);
        if (value instanceof Boolean b) return NODES.booleanNode(b);
        if (value instanceof Integer i) return NODES.numberNode(i);
        if (value instanceof Long l) return NODES.numberNode(l);
        if (value instanceof Number n) return NODES.numberNode(n.doubleValue());
        if (value instanceof Collection<?> c) {
            ArrayNode array = NODES.arrayNode();
            c.forEach(item -> array.add(toNode(item)));
            return array;
        }
        if (value instanceof Map<?, ?> m) {
            ObjectNode object = NODES.objectNode();
            m.forEach((k, v) -> object.set(String.valueOf(k), toNode(v)));
            return object;
        }
        return NODES.textNode(String.valueOf(value));
    }

    // ── Builder ──────────────────────────────────────────────────────────────

    /**
     * Parameters are added in order; the refinement methods
     * ({@link #oneOf}, {@link #between}, {@link #items}) apply to the most
     * recently added parameter.
     */
    public static final class Builder {

        private final List<ToolParameter> parameters = new ArrayList<>();
        private final Set<String> names = new HashSet<>();

        public Builder required(String name, ParamType type, String description) {
            return add(new ToolParameter(name, type, description, true, null, List.of(), null, null, null));
        }

        public Builder optional(String name, ParamType type, String description) {
            return optional(name, type, description, null);
        }

        public Builder optional(String name, ParamType type, String description, Object defaultValue) {
            return add(new ToolParameter(name, type, description, false, defaultValue, List.of(), null, null, null));
        }

        public Builder param(ToolParameter parameter) {
            return add(parameter);
        }

        public Builder oneOf(String... values) {
            ToolParameter last = last();
            return replaceLast(new ToolParameter(last.name(), last.type(), last.description(), last.required(),
                    last.defaultValue(), List.of(values), last.minimum(), last.maximum(), last.itemType()));
        }

        public Builder between(Number minimum, Number maximum) {
            ToolParameter last = last();
            return replaceLast(new ToolParameter(last.name(), last.type(), last.description(), last.required(),
                    last.defaultValue(), last.allowed(),
                    minimum == null ? null : minimum.doubleValue(),
                    maximum == null ? null : maximum.doubleValue(),
                    last.itemType()));
        }

        public Builder items(ParamType itemType) {
            ToolParameter last = last();
            if (last.type() != ParamType.ARRAY) {
                throw new IllegalStateException("items() applies to array parameters, '%s' is %s"
                        .formatted(last.name(), last.type()));
            }
            return replaceLast(new ToolParameter(last.name(), last.type(), last.description(), last.required(),
                    last.defaultValue(), last.allowed(), last.minimum(), last.maximum(), itemType));
        }

        public ToolSchema build() {
            return new ToolSchema(parameters);
        }

        private Builder add(ToolParameter parameter) {
            if (!names.add(parameter.name())) {
                throw new IllegalArgumentException("Duplicate parameter name: " + parameter.name());
            }
            parameters.add(parameter);
            return this;
        }

        private ToolParameter last() {
            if (parameters.isEmpty()) {
                throw new IllegalStateException("No parameter declared yet");
            }
            return parameters.get(parameters.size() - 1);
        }

        private Builder replaceLast(ToolParameter parameter) {
            parameters.set(parameters.size() - 1, parameter);
            return this;
        }
    }
}
