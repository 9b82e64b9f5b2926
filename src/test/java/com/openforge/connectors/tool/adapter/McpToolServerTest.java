package com.openforge.connectors.tool.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.connectors.support.TestTools;
import com.openforge.connectors.tool.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class McpToolServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private McpToolServer server;

    @BeforeEach
    void setUp() {
        ToolRegistry registry = new ToolRegistry();
        registry.registerSource(TestTools.source("math", TestTools.doubler()));
        server = new McpToolServer(registry, mapper);
    }

    private JsonNode rpc(String json) throws Exception {
        return server.handle(mapper.readTree(json));
    }

    @Test
    void listsToolsWithTheirInputSchema() {
        JsonNode tools = server.listTools();

        assertThat(tools).hasSize(1);
        assertThat(tools.get(0).path("name").asText()).isEqualTo("math_double");
        assertThat(tools.get(0).path("inputSchema").path("properties").has("a")).isTrue();
    }

    @Test
    void plainCallReturnsResultOrStructuredError() {
        ObjectNode ok = server.callTool("math_double", Map.of("a", 4));
        ObjectNode bad = server.callTool("math_double", Map.of("b", "x"));
        ObjectNode unknown = server.callTool("math_halve", Map.of());

        assertThat(ok.path("result").path("value").asLong()).isEqualTo(8L);
        assertThat(bad.path("error").path("kind").asText()).isEqualTo("tool_argument");
        assertThat(unknown.path("error").path("kind").asText()).isEqualTo("unknown_tool");
    }

    @Test
    void initializeAdvertisesToolsCapability() throws Exception {
        JsonNode response = rpc("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{}}");

        assertThat(response.path("id").asInt()).isEqualTo(1);
        assertThat(response.path("result").path("protocolVersion").asText()).isEqualTo(McpToolServer.PROTOCOL_VERSION);
        assertThat(response.path("result").path("capabilities").has("tools")).isTrue();
    }

    @Test
    void toolsCallReportsToolFailuresAsData() throws Exception {
        JsonNode success = rpc("{\"jsonrpc\":\"2.0\",\"id\":\"a\",\"method\":\"tools/call\","
                + "\"params\":{\"name\":\"math_double\",\"arguments\":{\"a\":3}}}");
        JsonNode failure = rpc("{\"jsonrpc\":\"2.0\",\"id\":\"b\",\"method\":\"tools/call\","
                + "\"params\":{\"name\":\"math_double\",\"arguments\":{\"b\":\"x\"}}}");

        assertThat(success.path("result").path("isError").asBoolean()).isFalse();
        assertThat(success.path("result").path("structuredContent").path("result").path("value").asInt()).isEqualTo(6);
        assertThat(failure.path("result").path("isError").asBoolean()).isTrue();
        assertThat(failure.has("error")).isFalse();
    }

    @Test
    void protocolProblemsBecomeJsonRpcErrors() throws Exception {
        assertThat(rpc("{\"jsonrpc\":\"1.0\",\"id\":1,\"method\":\"ping\"}").path("error").path("code").asInt())
                .isEqualTo(McpToolServer.INVALID_REQUEST);
        assertThat(rpc("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"resources/list\"}").path("error").path("code").asInt())
                .isEqualTo(McpToolServer.METHOD_NOT_FOUND);
        assertThat(rpc("{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"tools/call\",\"params\":{\"name\":\"nope\"}}")
                .path("error").path("code").asInt())
                .isEqualTo(McpToolServer.INVALID_PARAMS);
    }

    @Test
    void notificationsGetNoResponse() throws Exception {
        assertThat(rpc("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}")).isNull();
    }
}
