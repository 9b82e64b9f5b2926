package com.openforge.connectors.ai.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.connectors.ai.ProviderSettings;
import com.openforge.connectors.ai.ProviderType;
import com.openforge.connectors.ai.model.AIMessage;
import com.openforge.connectors.ai.model.AIResponse;
import com.openforge.connectors.ai.model.StopReason;
import com.openforge.connectors.ai.provider.anthropic.AnthropicChatProvider;
import com.openforge.connectors.connector.ConnectorContext;
import com.openforge.connectors.connector.ConnectorSettings;
import com.openforge.connectors.support.FakeClock;
import com.openforge.connectors.support.Json;
import com.openforge.connectors.tool.ToolInvocation;
import com.openforge.connectors.transport.ConnectorRequest;
import com.openforge.connectors.transport.ConnectorResponse;
import com.openforge.connectors.transport.HttpTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnthropicChatProviderTest {

    @Mock
    private HttpTransport transport;

    private AnthropicChatProvider provider;

    @BeforeEach
    void setUp() {
        FakeClock clock = new FakeClock();
        ConnectorContext context = new ConnectorContext(transport, Json.MAPPER, List.of(), clock, clock);
        ProviderSettings settings = new ProviderSettings(ProviderType.ANTHROPIC, null, null, 0.5, 1024, null, "ant-key");
        provider = new AnthropicChatProvider(settings, ConnectorSettings.defaults(), context);
    }

    @Test
    void liftsSystemPromptAndMergesConsecutiveToolResults() throws Exception {
        when(transport.send(any())).thenReturn(ConnectorResponse.of(200, """
                {"model":"claude-sonnet-4-20250514","stop_reason":"end_turn",
                 "content":[{"type":"text","text":"Both done."}],
                 "usage":{"input_tokens":30,"output_tokens":5}}
                """));
        ToolInvocation first = new ToolInvocation("toolu_1", "math_double", Map.of("a", 1), null);
        ToolInvocation second = new ToolInvocation("toolu_2", "math_double", Map.of("a", 2), null);

        AIResponse response = provider.complete(List.of(
                AIMessage.system("Use tools."),
                AIMessage.user("double 1 and 2"),
                AIMessage.assistant("", List.of(first, second)),
                AIMessage.toolResult("toolu_1", "math_double", "{\"result\":2}"),
                AIMessage.toolResult("toolu_2", "math_double", "{\"result\":4}")), "Be brief.", List.of());

        ArgumentCaptor<ConnectorRequest> captor = ArgumentCaptor.forClass(ConnectorRequest.class);
        verify(transport).send(captor.capture());
        ConnectorRequest request = captor.getValue();
        JsonNode body = Json.parse(request.body());

        assertThat(request.uri().toString()).isEqualTo("https://api.anthropic.com/v1/messages");
        assertThat(request.headers()).containsEntry("x-api-key", "ant-key").containsEntry("anthropic-version", "2023-06-01");
        assertThat(body.path("system").asText()).isEqualTo("Be brief.\n\nUse tools.");
        assertThat(body.path("messages")).hasSize(3);
        assertThat(body.path("messages").get(1).path("content")).hasSize(2);
        assertThat(body.path("messages").get(2).path("role").asText()).isEqualTo("user");
        assertThat(body.path("messages").get(2).path("content").get(1).path("tool_use_id").asText()).isEqualTo("toolu_2");

        assertThat(response.content()).isEqualTo("Both done.");
        assertThat(response.stopReason()).isEqualTo(StopReason.STOP);
        assertThat(response.usage().totalTokens()).isEqualTo(35);
    }

    @Test
    void toolUseBlocksBecomeToolCalls() throws Exception {
        when(transport.send(any())).thenReturn(ConnectorResponse.of(200, """
                {"stop_reason":"tool_use","content":[
                  {"type":"tool_use","id":"toolu_9","name":"slack_list_users","input":{"limit":5}}]}
                """));

        AIResponse response = provider.complete(List.of(AIMessage.user("who is here?")), null, List.of());

        assertThat(response.stopReason()).isEqualTo(StopReason.TOOL_CALLS);
        assertThat(response.toolCalls()).extracting(ToolInvocation::toolName).containsExactly("slack_list_users");
    }

    @Test
    void maxTokensStopIsReportedAsLength() throws Exception {
        when(transport.send(any()))
                .thenReturn(ConnectorResponse.of(200,
                        "{\"stop_reason\":\"max_tokens\",\"content\":[{\"type\":\"text\",\"text\":\"cut\"}]}"))
                .thenReturn(ConnectorResponse.of(200,
                        "{\"stop_reason\":\"end_turn\",\"content\":[{\"type\":\"text\",\"text\":\"done\"}]}"));

        AIResponse truncated = provider.complete(List.of(AIMessage.user("x")), null, List.of());
        AIResponse finished = provider.complete(List.of(AIMessage.user("x")), null, List.of());

        assertThat(truncated.stopReason()).isEqualTo(StopReason.LENGTH);
        assertThat(finished.stopReason()).isEqualTo(StopReason.STOP);
        assertThat(finished.model()).isEqualTo("claude-sonnet-4-20250514");
    }
}
