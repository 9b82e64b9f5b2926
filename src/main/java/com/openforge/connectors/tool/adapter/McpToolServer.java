package com.openforge.connectors.tool.adapter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.connectors.error.UnknownToolException;
import com.openforge.connectors.tool.ToolDescriptor;
import com.openforge.connectors.tool.ToolOutcome;
import com.openforge.connectors.tool.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * MCP-style RPC projection of the registry.
 *
 * Two surfaces over the same logic:
 *  - plain: {@link #listTools()} / {@link #callTool(String, Map)}
 *  - JSON-RPC 2.0: {@link #handle(JsonNode)} serving
 *      initialize, ping, tools/list, tools/call
 *
 * Tool failures are reported as data ({@code isError: true} with the
 * structured error as content); only protocol problems (bad envelope,
 * unknown method, unknown tool, malformed params) become JSON-RPC errors.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class McpToolServer {

    public static final String PROTOCOL_VERSION = "2024-11-05";

    static final int INVALID_REQUEST = -32600;
    static final int METHOD_NOT_FOUND = -32601;
    static final int INVALID_PARAMS = -32602;

    private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() {};

    private final ToolRegistry registry;
    private final ObjectMapper objectMapper;

    // ── Plain surface ────────────────────────────────────────────────────────

    /** {@code [{name, description, inputSchema}]} for the current snapshot. */
    public ArrayNode listTools() {
        ArrayNode tools = objectMapper.createArrayNode();
        for (ToolDescriptor tool : registry.snapshot()) {
            ObjectNode entry = tools.addObject();
            entry.put("name", tool.name());
            entry.put("description", tool.description());
            entry.set("inputSchema", tool.inputSchema());
        }
        return tools;
    }

    /** {@code {result}} or {@code {error: {kind, message}}}; never throws for tool failures. */
    public ObjectNode callTool(String name, Map<String, Object> arguments) {
        return invoke(name, arguments).toJson();
    }

    public ToolOutcome invoke(String name, Map<String, Object> arguments) {
        ToolDescriptor tool;
        try {
            tool = registry.require(name);
        } catch (UnknownToolException e) {
            return ToolOutcome.failure(e);
        }
        ToolOutcome outcome = ToolOutcome.run(tool, arguments, objectMapper);
        if (outcome.isError()) {
            log.warn("[MCP] Tool {} failed: {}", name, outcome.failure().getMessage());
        }
        return outcome;
    }

    // ── JSON-RPC 2.0 ─────────────────────────────────────────────────────────

    /**
     * @return the response envelope, or {@code null} for notifications (no id)
     */
    public ObjectNode handle(JsonNode request) {
        JsonNode id = request == null ? null : request.get("id");
        if (request == null || !request.isObject()
                || !"2.0".equals(request.path("jsonrpc").asText())
                || !request.path("method").isTextual()) {
            return error(id, INVALID_REQUEST, "Invalid Request");
        }
        String method = request.get("method").asText();
        JsonNode params = request.path("params");
        boolean notification = id == null || id.isNull();

        log.debug("[MCP] ← {} id={}", method, id);
        ObjectNode response = switch (method) {
            case "initialize" -> result(id, initializeResult());
            case "ping" -> result(id, objectMapper.createObjectNode());
            case "tools/list" -> {
                ObjectNode body = objectMapper.createObjectNode();
                body.set("tools", listTools());
                yield result(id, body);
            }
            case "tools/call" -> callFromRpc(id, params);
            default -> method.startsWith("notifications/")
                    ? null
                    : error(id, METHOD_NOT_FOUND, "Method not found: " + method);
        };
        return notification ? null : response;
    }

    private ObjectNode callFromRpc(JsonNode id, JsonNode params) {
        if (!params.path("name").isTextual()) {
            return error(id, INVALID_PARAMS, "params.name is required");
        }
        String name = params.get("name").asText();
        JsonNode rawArgs = params.get("arguments");
        if (rawArgs != null && !rawArgs.isNull() && !rawArgs.isObject()) {
            return error(id, INVALID_PARAMS, "params.arguments must be an object");
        }
        if (registry.find(name).isEmpty()) {
            return error(id, INVALID_PARAMS, "Unknown tool: " + name);
        }
        Map<String, Object> arguments = rawArgs == null || rawArgs.isNull()
                ? Map.of()
                : objectMapper.convertValue(rawArgs, ARGUMENTS);

        ObjectNode structured = invoke(name, arguments).toJson();
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode text = body.putArray("content").addObject();
        text.put("type", "text");
        text.put("text", structured.toString());
        body.set("structuredContent", structured);
        body.put("isError", structured.has("error"));
        return result(id, body);
    }

    private ObjectNode initializeResult() {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("protocolVersion", PROTOCOL_VERSION);
        body.putObject("capabilities").putObject("tools").put("listChanged", false);
        ObjectNode server = body.putObject("serverInfo");
        server.put("name", "vendor-connectors");
        server.put("version", "0.1.0");
        return body;
    }

    private ObjectNode result(JsonNode id, ObjectNode result) {
        ObjectNode envelope = envelope(id);
        envelope.set("result", result);
        return envelope;
    }

    private ObjectNode error(JsonNode id, int code, String message) {
        ObjectNode envelope = envelope(id);
        ObjectNode error = envelope.putObject("error");
        error.put("code", code);
        error.put("message", message);
        return envelope;
    }

    private ObjectNode envelope(JsonNode id) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("jsonrpc", "2.0");
        envelope.set("id", id == null ? NullNode.getInstance() : id);
        return envelope;
    }
}
