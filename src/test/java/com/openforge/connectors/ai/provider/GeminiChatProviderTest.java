package com.openforge.connectors.ai.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.connectors.ai.ProviderSettings;
import com.openforge.connectors.ai.ProviderType;
import com.openforge.connectors.ai.model.AIMessage;
import com.openforge.connectors.ai.model.AIResponse;
import com.openforge.connectors.ai.model.StopReason;
import com.openforge.connectors.ai.provider.google.GeminiChatProvider;
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
class GeminiChatProviderTest {

    @Mock
    private HttpTransport transport;

    private GeminiChatProvider provider;

    @BeforeEach
    void setUp() {
        FakeClock clock = new FakeClock();
        ConnectorContext context = new ConnectorContext(transport, Json.MAPPER, List.of(), clock, clock);
        ProviderSettings settings = new ProviderSettings(ProviderType.GOOGLE, "gemini-1.5-flash", null, 0.3, 256, null, "g-key");
        provider = new GeminiChatProvider(settings, ConnectorSettings.defaults(), context);
    }

    @Test
    void buildsGenerateContentRequestWithFunctionResponses() throws Exception {
        when(transport.send(any())).thenReturn(ConnectorResponse.of(200, """
                {"candidates":[{"content":{"role":"model","parts":[{"text":"It is 42."}]},"finishReason":"STOP"}],
                 "usageMetadata":{"promptTokenCount":12,"candidatesTokenCount":4,"totalTokenCount":16}}
                """));
        ToolInvocation call = new ToolInvocation("call_0", "math_double", Map.of("a", 21), null);

        AIResponse response = provider.complete(List.of(
                AIMessage.user("double 21"),
                AIMessage.assistant(null, List.of(call)),
                AIMessage.toolResult("call_0", "math_double", "42")), "Answer tersely.", List.of());

        ArgumentCaptor<ConnectorRequest> captor = ArgumentCaptor.forClass(ConnectorRequest.class);
        verify(transport).send(captor.capture());
        ConnectorRequest request = captor.getValue();
        JsonNode body = Json.parse(request.body());

        assertThat(request.uri().toString())
                .isEqualTo("https://generativelanguage.googleapis.com/v1beta/models/gemini-1.5-flash:generateContent");
        assertThat(request.headers()).containsEntry("x-goog-api-key", "g-key");
        assertThat(body.path("systemInstruction").path("parts").get(0).path("text").asText()).isEqualTo("Answer tersely.");
        assertThat(body.path("contents").get(1).path("role").asText()).isEqualTo("model");
        assertThat(body.path("contents").get(1).path("parts").get(0).path("functionCall").path("args").path("a").asInt())
                .isEqualTo(21);
        JsonNode functionResponse = body.path("contents").get(2).path("parts").get(0).path("functionResponse");
        assertThat(functionResponse.path("name").asText()).isEqualTo("math_double");
        assertThat(functionResponse.path("response").path("result").asInt()).isEqualTo(42);
        assertThat(body.path("generationConfig").path("maxOutputTokens").asInt()).isEqualTo(256);

        assertThat(response.content()).isEqualTo("It is 42.");
        assertThat(response.usage().totalTokens()).isEqualTo(16);
        assertThat(response.stopReason()).isEqualTo(StopReason.STOP);
    }

    @Test
    void functionCallsAndTruncationAreReported() throws Exception {
        when(transport.send(any()))
                .thenReturn(ConnectorResponse.of(200, """
                        {"candidates":[{"content":{"parts":[{"functionCall":{"name":"math_double","args":{"a":1}}}]},
                          "finishReason":"STOP"}]}
                        """))
                .thenReturn(ConnectorResponse.of(200, """
                        {"candidates":[{"content":{"parts":[{"text":"cut"}]},"finishReason":"MAX_TOKENS"}]}
                        """));

        AIResponse withCall = provider.complete(List.of(AIMessage.user("go")), null, List.of());
        AIResponse truncated = provider.complete(List.of(AIMessage.user("go")), null, List.of());

        assertThat(withCall.stopReason()).isEqualTo(StopReason.TOOL_CALLS);
        assertThat(withCall.toolCalls().get(0).id()).isEqualTo("call_0");
        assertThat(truncated.stopReason()).isEqualTo(StopReason.LENGTH);
    }
}
