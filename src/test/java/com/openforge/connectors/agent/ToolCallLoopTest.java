package com.openforge.connectors.agent;

import com.openforge.connectors.ai.ChatClient;
import com.openforge.connectors.ai.model.AIMessage;
import com.openforge.connectors.ai.model.AIResponse;
import com.openforge.connectors.ai.model.AIRole;
import com.openforge.connectors.ai.model.AIUsage;
import com.openforge.connectors.error.ConnectorException;
import com.openforge.connectors.error.CredentialNotFoundException;
import com.openforge.connectors.error.ErrorKind;
import com.openforge.connectors.error.ToolLoopBudgetExceededException;
import com.openforge.connectors.error.ToolLoopFatalException;
import com.openforge.connectors.support.Json;
import com.openforge.connectors.support.TestTools;
import com.openforge.connectors.tool.ToolInvocation;
import com.openforge.connectors.tool.ToolOperation;
import com.openforge.connectors.tool.ToolRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ToolCallLoopTest {

    @Mock
    private ChatClient chatClient;

    private ToolRegistry registry;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry();
        registry.registerSource(TestTools.source("math", TestTools.doubler()));
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void plainAnswerTakesOneRoundTrip() {
        when(chatClient.complete(anyList(), any(), anyList())).thenReturn(answer("Hello!"));

        ToolLoopResult result = loop(5, false).run(List.of(AIMessage.user("hi")), null);

        assertThat(result.content()).isEqualTo("Hello!");
        assertThat(result.roundTrips()).isEqualTo(1);
        assertThat(result.toolCalls()).isEmpty();
        assertThat(result.conversation()).extracting(AIMessage::role).containsExactly(AIRole.USER, AIRole.ASSISTANT);
    }

    @Test
    void toolResultsAreFedBackInRequestedOrder() {
        when(chatClient.complete(anyList(), any(), anyList()))
                .thenReturn(toolCalls(call("c1", 2), call("c2", 5)))
                .thenReturn(answer("4 and 10"));

        ToolLoopResult result = loop(5, false).run(List.of(AIMessage.user("double 2 and 5")), "sys");

        assertThat(result.roundTrips()).isEqualTo(2);
        assertThat(result.usage().totalTokens()).isEqualTo(30);
        assertThat(result.toolCalls()).extracting(ExecutedToolCall::id).containsExactly("c1", "c2");
        assertThat(result.toolCalls().get(1).outcome().path("result").path("value").asLong()).isEqualTo(10);
        assertThat(result.conversation()).extracting(AIMessage::role)
                .containsExactly(AIRole.USER, AIRole.ASSISTANT, AIRole.TOOL, AIRole.TOOL, AIRole.ASSISTANT);
        assertThat(result.conversation().get(2).toolCallId()).isEqualTo("c1");
        assertThat(result.conversation().get(2).content()).isEqualTo("{\"result\":{\"value\":4}}");
    }

    @Test
    void failingToolBecomesAnErrorResultTheModelCanSee() {
        when(chatClient.complete(anyList(), any(), anyList()))
                .thenReturn(toolCalls(new ToolInvocation("c1", "math_double", Map.of("a", "not a number"), null)))
                .thenReturn(answer("Sorry, that was not a number."));

        ToolLoopResult result = loop(5, false).run(List.of(AIMessage.user("double it")), null);

        ExecutedToolCall executed = result.toolCalls().get(0);
        assertThat(executed.error()).isTrue();
        assertThat(executed.outcome().path("error").path("kind").asText()).isEqualTo(ErrorKind.TOOL_ARGUMENT.code());
        assertThat(result.content()).startsWith("Sorry");
    }

    @Test
    void unknownToolIsReportedNotThrown() {
        when(chatClient.complete(anyList(), any(), anyList()))
                .thenReturn(toolCalls(new ToolInvocation("c1", "math_sqrt", Map.of(), null)))
                .thenReturn(answer("No such tool."));

        ToolLoopResult result = loop(5, false).run(List.of(AIMessage.user("sqrt 9")), null);

        assertThat(result.toolCalls().get(0).outcome().path("error").path("kind").asText())
                .isEqualTo(ErrorKind.UNKNOWN_TOOL.code());
    }

    @Test
    void lastRoundTripWithToolCallsExceedsTheBudgetWithoutExecuting() {
        when(chatClient.complete(anyList(), any(), anyList())).thenReturn(toolCalls(call("c1", 1)));
        RecordingListener listener = new RecordingListener();

        assertThatThrownBy(() -> loop(2, false).run("conv-1", List.of(AIMessage.user("loop")), null, listener))
                .isInstanceOf(ToolLoopBudgetExceededException.class)
                .satisfies(e -> assertThat(((ToolLoopBudgetExceededException) e).maxRoundTrips()).isEqualTo(2));

        verify(chatClient, times(2)).complete(anyList(), any(), anyList());
        assertThat(listener.results).hasSize(1);
        assertThat(listener.errors).containsExactly(ErrorKind.TOOL_LOOP_BUDGET_EXCEEDED);
    }

    @Test
    void fatalToolFailureEndsTheLoop() {
        registry.registerSource(TestTools.source("vault",
                TestTools.failing("read", new CredentialNotFoundException("VAULT_TOKEN", List.of("environment")))));
        when(chatClient.complete(anyList(), any(), anyList()))
                .thenReturn(toolCalls(new ToolInvocation("c1", "vault_read", Map.of(), null)));

        assertThatThrownBy(() -> loop(5, false).run(List.of(AIMessage.user("read")), null))
                .isInstanceOf(ToolLoopFatalException.class)
                .satisfies(e -> {
                    ToolLoopFatalException fatal = (ToolLoopFatalException) e;
                    assertThat(fatal.toolName()).isEqualTo("vault_read");
                    assertThat(fatal.causeKind()).isEqualTo(ErrorKind.CREDENTIAL_NOT_FOUND);
                });
        verify(chatClient, times(1)).complete(anyList(), any(), anyList());
    }

    @Test
    void fatalFailureStopsTheRemainingCallsOfTheTurn() {
        AtomicInteger sent = new AtomicInteger();
        registry.registerSource(TestTools.source("vault",
                TestTools.failing("read", new CredentialNotFoundException("VAULT_TOKEN", List.of("environment")))));
        registry.registerSource(TestTools.source("slack", ToolOperation.builder()
                .name("send")
                .handler(args -> Map.of("sent", sent.incrementAndGet()))
                .build()));
        when(chatClient.complete(anyList(), any(), anyList()))
                .thenReturn(toolCalls(
                        new ToolInvocation("c1", "vault_read", Map.of(), null),
                        new ToolInvocation("c2", "slack_send", Map.of(), null)));
        RecordingListener listener = new RecordingListener();

        assertThatThrownBy(() -> loop(5, false).run("conv-2", List.of(AIMessage.user("read then send")), null, listener))
                .isInstanceOf(ToolLoopFatalException.class);

        assertThat(sent).hasValue(0);
        assertThat(listener.results).extracting(ExecutedToolCall::toolName).containsExactly("vault_read");
        assertThat(listener.errors).containsExactly(ErrorKind.TOOL_LOOP_FATAL);
    }

    @Test
    void threeToolRoundTripsThenAnAnswerTakeFourCompletions() {
        when(chatClient.complete(anyList(), any(), anyList()))
                .thenReturn(toolCalls(call("c1", 1)))
                .thenReturn(toolCalls(call("c2", 2)))
                .thenReturn(toolCalls(call("c3", 3)))
                .thenReturn(answer("2, 4, 6"));

        ToolLoopResult result = loop(5, false).run(List.of(AIMessage.user("double 1, 2, 3")), null);

        verify(chatClient, times(4)).complete(anyList(), any(), anyList());
        assertThat(result.roundTrips()).isEqualTo(4);
        assertThat(result.toolCalls()).extracting(ExecutedToolCall::roundTrip).containsExactly(1, 2, 3);
        assertThat(result.conversation()).extracting(AIMessage::role).containsExactly(
                AIRole.USER,
                AIRole.ASSISTANT, AIRole.TOOL,
                AIRole.ASSISTANT, AIRole.TOOL,
                AIRole.ASSISTANT, AIRole.TOOL,
                AIRole.ASSISTANT);
        assertThat(result.conversation()).extracting(AIMessage::toolCallId)
                .filteredOn(id -> id != null)
                .containsExactly("c1", "c2", "c3");
    }

    @Test
    void answerOnTheLastAllowedRoundTripAfterMultiCallTurnsSucceeds() {
        when(chatClient.complete(anyList(), any(), anyList()))
                .thenReturn(toolCalls(call("c1", 1), call("c2", 2)))
                .thenReturn(toolCalls(call("c3", 3), call("c4", 4)))
                .thenReturn(answer("done"));

        ToolLoopResult result = loop(3, false).run(List.of(AIMessage.user("go")), null);

        assertThat(result.roundTrips()).isEqualTo(3);
        assertThat(result.toolCalls()).extracting(ExecutedToolCall::id).containsExactly("c1", "c2", "c3", "c4");
        assertThat(result.conversation()).extracting(AIMessage::toolCallId)
                .filteredOn(id -> id != null)
                .containsExactly("c1", "c2", "c3", "c4");
    }

    @Test
    void multiCallTurnsThatSpendTheBudgetExactlyFailWithoutRunningTheLastTurn() {
        when(chatClient.complete(anyList(), any(), anyList()))
                .thenReturn(toolCalls(call("c1", 1), call("c2", 2)))
                .thenReturn(toolCalls(call("c3", 3), call("c4", 4)))
                .thenReturn(toolCalls(call("c5", 5), call("c6", 6)));
        RecordingListener listener = new RecordingListener();

        assertThatThrownBy(() -> loop(3, false).run("conv-3", List.of(AIMessage.user("go")), null, listener))
                .isInstanceOf(ToolLoopBudgetExceededException.class);

        verify(chatClient, times(3)).complete(anyList(), any(), anyList());
        assertThat(listener.results).extracting(ExecutedToolCall::id).containsExactly("c1", "c2", "c3", "c4");
    }

    @Test
    void parallelExecutionKeepsRequestOrder() {
        executor = Executors.newFixedThreadPool(4);
        when(chatClient.complete(anyList(), any(), anyList()))
                .thenReturn(toolCalls(call("c1", 1), call("c2", 2), call("c3", 3)))
                .thenReturn(answer("done"));

        ToolLoopResult result = loop(3, true).run(List.of(AIMessage.user("go")), null);

        assertThat(result.toolCalls()).extracting(ExecutedToolCall::id).containsExactly("c1", "c2", "c3");
        assertThat(result.toolCalls()).extracting(call -> call.outcome().path("result").path("value").asLong())
                .containsExactly(2L, 4L, 6L);
    }

    @Test
    void toolsRegisteredMidConversationAreOfferedNextRoundTrip() {
        List<Integer> offered = new ArrayList<>();
        when(chatClient.complete(anyList(), any(), anyList())).thenAnswer(invocation -> {
            List<?> tools = invocation.getArgument(2);
            offered.add(tools.size());
            if (offered.size() == 1) {
                registry.register("math", TestTools.failing("noop", new IllegalStateException("unused")));
                return toolCalls(call("c1", 1));
            }
            return answer("ok");
        });

        loop(3, false).run(List.of(AIMessage.user("go")), null);

        assertThat(offered).containsExactly(1, 2);
    }

    @Test
    void budgetMustBePositive() {
        assertThatThrownBy(() -> new ToolCallLoop(chatClient, registry, Json.MAPPER, 0, false, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ToolCallLoop(chatClient, registry, Json.MAPPER, 1, true, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private ToolCallLoop loop(int maxRoundTrips, boolean parallel) {
        return new ToolCallLoop(chatClient, registry, Json.MAPPER, maxRoundTrips, parallel, executor);
    }

    private static ToolInvocation call(String id, int a) {
        return new ToolInvocation(id, "math_double", Map.of("a", a), null);
    }

    private static AIResponse answer(String content) {
        return new AIResponse(content, AIUsage.of(10, 5), null, null, "openai", "gpt-4o");
    }

    private static AIResponse toolCalls(ToolInvocation... calls) {
        return new AIResponse("", AIUsage.of(10, 5), List.of(calls), null, "openai", "gpt-4o");
    }

    private static final class RecordingListener implements ToolLoopListener {
        final List<ExecutedToolCall> results = new ArrayList<>();
        final List<ErrorKind> errors = new ArrayList<>();

        @Override
        public void onToolResult(ExecutedToolCall result) {
            results.add(result);
        }

        @Override
        public void onError(ConnectorException error, int roundTrip) {
            errors.add(error.kind());
        }
    }
}
