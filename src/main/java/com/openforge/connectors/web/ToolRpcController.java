package com.openforge.connectors.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.connectors.tool.ToolDescriptor;
import com.openforge.connectors.tool.ToolOutcome;
import com.openforge.connectors.tool.ToolRegistry;
import com.openforge.connectors.tool.adapter.McpToolServer;
import com.openforge.connectors.web.dto.InvokeToolRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Tool RPC over HTTP.
 *
 * Endpoints:
 *   GET  /api/tools         : current tool snapshot: [{name, description, inputSchema}]
 *   GET  /api/tools/{name}  : one tool's descriptor
 *   POST /api/tools/invoke  : {name, arguments} → {result} | {error: {kind, message}}
 *   POST /mcp               : JSON-RPC 2.0 (initialize, ping, tools/list, tools/call)
 *
 * A failed invocation answers with the error body and the status its kind
 * maps to; the tool's own failure is never rethrown.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ToolRpcController {

    private final McpToolServer mcpToolServer;
    private final ToolRegistry  toolRegistry;
    private final ObjectMapper  objectMapper;

    // ── Plain RPC ────────────────────────────────────────────────────────────

    @GetMapping("/api/tools")
    public ArrayNode listTools() {
        return mcpToolServer.listTools();
    }

    @GetMapping("/api/tools/{name}")
    public ObjectNode getTool(@PathVariable String name) {
        ToolDescriptor tool = toolRegistry.require(name);
        ObjectNode node = objectMapper.createObjectNode();
        node.put("name", tool.name());
        node.put("connector", tool.connector());
        node.put("operation", tool.operation());
        node.put("description", tool.description());
        node.put("category", tool.category().name());
        node.put("concurrencySafe", tool.concurrencySafe());
        node.set("inputSchema", tool.inputSchema());
        return node;
    }

    @PostMapping("/api/tools/invoke")
    public ResponseEntity<ObjectNode> invoke(@Valid @RequestBody InvokeToolRequest request) {
        log.info("[ToolRpc] invoke {}", request.name());
        ToolOutcome outcome = mcpToolServer.invoke(request.name(), request.argumentsOrEmpty());
        if (outcome.isError()) {
            return ResponseEntity.status(ApiExceptionHandler.statusFor(outcome.failure().kind()))
                    .body(outcome.toJson());
        }
        return ResponseEntity.ok(outcome.toJson());
    }

    // ── JSON-RPC ─────────────────────────────────────────────────────────────

    /**
     * Notifications get 204 with no body, per JSON-RPC.
     */
    @PostMapping("/mcp")
    public ResponseEntity<ObjectNode> mcp(@RequestBody JsonNode request) {
        ObjectNode response = mcpToolServer.handle(request);
        return response == null ? ResponseEntity.noContent().build() : ResponseEntity.ok(response);
    }
}
