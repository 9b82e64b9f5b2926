package com.openforge.connectors.ai.provider.openai;

/**
 * The "function" sub-object inside a {@link ToolCall}.
 *
 * "arguments" is a raw JSON string, not a parsed object:
 *   name      = "slack_send_message"
 *   arguments = "{\"channel\":\"general\",\"text\":\"hi\"}"
 */
public record FunctionCallResult(
        String name,
        String arguments
) {}
