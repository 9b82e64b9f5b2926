package com.openforge.connectors.tool;

/**
 * Body of a tool. Receives arguments that already passed schema validation.
 * The returned value is serialized to JSON for callers and models.
 */
@FunctionalInterface
public interface ToolHandler {

    Object handle(ToolArguments arguments) throws Exception;
}
