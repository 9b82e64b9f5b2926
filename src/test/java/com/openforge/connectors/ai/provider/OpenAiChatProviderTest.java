package com.openforge.connectors.ai.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.connectors.ai.ProviderSettings;
import com.openforge.connectors.ai.ProviderType;
import com.openforge.connectors.ai.model.AIMessage;
import com.openforge.connectors.ai.model.AIResponse;
import com.openforge.connectors.ai.model.StopReason;
import com.openforge.connectors.ai.provider.openai.OpenAiChatProvider;
import com.openforge.connectors.connector.ConnectorContext;
import com.openforge.connectors.connector.ConnectorSettings;
import com.openforge.connectors.error.ProviderAuthenticationException;
import com.openforge.connectors.error.ProviderModelException;
import com.openforge.connectors.error.ProviderParameterException;
import com.openforge.connectors.support.FakeClock;
import com.openforge.connectors.support.Json;
import com.openforge.connectors.support.TestTools;
import com.openforge.connectors.tool.ToolDescriptor;
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

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OpenAiChatProviderTest {

    private static final String TOOL_CALL_REPLY = """
            {"id":"chatcmpl-1","model":"gpt-4o-2024-08-06",
             "choices":[{"index":0,"finish_reason":"tool_calls","message":{"role":"assistant","content":null,
               "tool_calls":[{"id":"call_1","type":"function","function":{"name":"math_double","arguments":"{\\"a\\":21}"}}]}}],
             "usage":{"prompt_tokens":50,"completion_tokens":10,"total_tokens":60}}
            """;

    @Mock
    private HttpTransport transport;

    private OpenAiChatProvider provider;

    @BeforeEach
    void setUp() {
        FakeClock clock = new FakeClock();
        ConnectorContext context = new ConnectorContext(transport, Json.MAPPER, List.of(), clock, clock);
        ProviderSettings settings = new ProviderSettings(ProviderType.OPENAI, "gpt-4o", null, 0.2, 512,
                Duration.ofSeconds(30), "sk-test");
        provider = new OpenAiChatProvider(settings, ConnectorSettings.defaults(), context);
    }

    private ConnectorRequest sent() throws Exception {
        ArgumentCaptor<ConnectorRequest> captor = ArgumentCaptor.forClass(ConnectorRequest.class);
        verify(transport, atLeastOnce()).send(captor.capture());
        return captor.getValue();
    }

    @Test
    void sendsConversationToolsAndBearerKey() throws Exception {
        when(transport.send(any())).thenReturn(ConnectorResponse.of(200, TOOL_CALL_REPLY));
        ToolDescriptor doubler = ToolDescriptor.of("math", TestTools.doubler());

        provider.complete(List.of(AIMessage.user("What is 21 doubled?")), "Be brief.", List.of(doubler));

        ConnectorRequest request = sent();
        JsonNode body = Json.parse(request.body());
        assertThat(request.uri().toString()).isEqualTo("https://api.openai.com/v1/chat/completions");
        assertThat(request.headers()).containsEntry("Authorization", "Bearer sk-test");
        assertThat(request.idempotent()).isTrue();
        assertThat(body.path("model").asText()).isEqualTo("gpt-4o");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(512);
        assertThat(body.path("messages").get(0).path("role").asText()).isEqualTo("system");
        assertThat(body.path("messages").get(1).path("content").asText()).isEqualTo("What is 21 doubled?");
        assertThat(body.path("tools").get(0).path("function").path("name").asText()).isEqualTo("math_double");
        assertThat(body.path("tool_choice").asText()).isEqualTo("auto");
    }

    @Test
    void parsesToolCallsAndUsage() throws Exception {
        when(transport.send(any())).thenReturn(ConnectorResponse.of(200, TOOL_CALL_REPLY));

        AIResponse response = provider.complete(List.of(AIMessage.user("hi")), null, List.of());

        assertThat(response.stopReason()).isEqualTo(StopReason.TOOL_CALLS);
        assertThat(response.toolCalls()).singleElement().satisfies(call -> {
            assertThat(call.id()).isEqualTo("call_1");
            assertThat(call.arguments()).containsEntry("a", 21);
        });
        assertThat(response.usage().totalTokens()).isEqualTo(60);
        assertThat(response.model()).isEqualTo("gpt-4o-2024-08-06");
        assertThat(response.content()).isEmpty();
    }

    @Test
    void replaysToolTurnsInOpenAiShape() throws Exception {
        when(transport.send(any())).thenReturn(ConnectorResponse.of(200,
                "{\"choices\":[{\"message\":{\"content\":\"42\"},\"finish_reason\":\"stop\"}]}"));
        ToolInvocation call = new ToolInvocation("call_1", "math_double", Map.of("a", 21), null);

        AIResponse response = provider.complete(List.of(
                AIMessage.user("double 21"),
                AIMessage.assistant(null, List.of(call)),
                AIMessage.toolResult("call_1", "math_double", "{\"result\":{\"value\":42}}")), null, List.of());

        JsonNode messages = Json.parse(sent().body()).path("messages");
        assertThat(messages.get(1).path("tool_calls").get(0).path("function").path("arguments").asText())
                .isEqualTo("{\"a\":21}");
        assertThat(messages.get(2).path("role").asText()).isEqualTo("tool");
        assertThat(messages.get(2).path("tool_call_id").asText()).isEqualTo("call_1");
        assertThat(response.content()).isEqualTo("42");
        assertThat(response.stopReason()).isEqualTo(StopReason.STOP);
    }

    @Test
    void mapsHttpErrorsOntoTheProviderTaxonomy() throws Exception {
        when(transport.send(any()))
                .thenReturn(ConnectorResponse.of(401, "{\"error\":{\"message\":\"Incorrect API key\"}}"))
                .thenReturn(ConnectorResponse.of(400, "{\"error\":{\"message\":\"bad temperature\"}}"))
                .thenReturn(ConnectorResponse.of(404, "{\"error\":{\"message\":\"no such model\"}}"));
        List<AIMessage> conversation = List.of(AIMessage.user("hi"));

        assertThatThrownBy(() -> provider.complete(conversation, null, List.of()))
                .isInstanceOf(ProviderAuthenticationException.class)
                .hasMessageContaining("Incorrect API key");
        assertThatThrownBy(() -> provider.complete(conversation, null, List.of()))
                .isInstanceOf(ProviderParameterException.class);
        assertThatThrownBy(() -> provider.complete(conversation, null, List.of()))
                .isInstanceOf(ProviderModelException.class)
                .hasMessageContaining("gpt-4o");
    }

    @Test
    void keylessProviderSendsNoAuthorizationHeader() throws Exception {
        FakeClock clock = new FakeClock();
        ConnectorContext context = new ConnectorContext(transport, Json.MAPPER, List.of(), clock, clock);
        OpenAiChatProvider ollama = new OpenAiChatProvider(ProviderSettings.defaults(ProviderType.OLLAMA),
                ConnectorSettings.defaults(), context);
        when(transport.send(any())).thenReturn(ConnectorResponse.of(200,
                "{\"choices\":[{\"message\":{\"content\":\"hi\"},\"finish_reason\":\"stop\"}]}"));

        ollama.complete(List.of(AIMessage.user("hi")), null, List.of());

        ConnectorRequest request = sent();
        assertThat(request.uri().toString()).startsWith("http://localhost:11434/v1");
        assertThat(request.headers()).doesNotContainKey("Authorization");
    }
}
