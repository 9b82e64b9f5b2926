package com.openforge.connectors.tool;

import java.util.Map;
import java.util.UUID;

/**
 * One request to run a tool.
 *
 * When a model emits arguments that are not a JSON object, the raw text is
 * kept under {@link #RAW_ARGUMENTS_KEY} so validation reports it instead of
 * the caller crashing on a parse error.
 */
public record ToolInvocation(
        String id,
        String toolName,
        Map<String, Object> arguments,
        Map<String, Object> context
) {

    public static final String RAW_ARGUMENTS_KEY = "__raw_arguments";

    public ToolInvocation {
        id = id == null || id.isBlank() ? UUID.randomUUID().toString() : id;
        arguments = arguments == null ? Map.of() : arguments;
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public static ToolInvocation of(String toolName, Map<String, Object> arguments) {
        return new ToolInvocation(null, toolName, arguments, null);
    }

    public static ToolInvocation malformed(String id, String toolName, String rawArguments) {
        return new ToolInvocation(id, toolName,
                Map.of(RAW_ARGUMENTS_KEY, rawArguments == null ? "" : rawArguments), null);
    }

    public boolean isMalformed() {
        return arguments.containsKey(RAW_ARGUMENTS_KEY);
    }
}
