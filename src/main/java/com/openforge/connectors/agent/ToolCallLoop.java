package com.openforge.connectors.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.connectors.ai.ChatClient;
import com.openforge.connectors.ai.model.AIMessage;
import com.openforge.connectors.ai.model.AIResponse;
import com.openforge.connectors.ai.model.AIUsage;
import com.openforge.connectors.error.ConnectorException;
import com.openforge.connectors.error.OperationCancelledException;
import com.openforge.connectors.error.ToolExecutionException;
import com.openforge.connectors.error.ToolLoopBudgetExceededException;
import com.openforge.connectors.error.ToolLoopFatalException;
import com.openforge.connectors.error.UnknownToolException;
import com.openforge.connectors.tool.ToolDescriptor;
import com.openforge.connectors.tool.ToolInvocation;
import com.openforge.connectors.tool.ToolOutcome;
import com.openforge.connectors.tool.ToolRegistry;
import com.openforge.connectors.tool.adapter.CallableTool;
import com.openforge.connectors.tool.adapter.GenericToolAdapter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * The bounded reasoning loop.
 *
 * Loop shape:
 *   for each round trip (at most maxRoundTrips model calls):
 *     1. SNAPSHOT  take the current registry snapshot, so tools registered
 *                  mid-conversation are offered from the next round trip on
 *     2. ASK       send the whole conversation plus the snapshot to the model
 *     3. DECIDE    no tool calls → DONE
 *                  tool calls on the last permitted round trip → budget exceeded,
 *                  nothing executed
 *     4. ACT       validate and run each call through the generic-callable
 *                  adapter; results are appended as tool-role turns in the
 *                  order the model requested them
 *
 * A failing tool becomes a {@code {"error": {...}}} result the model can
 * react to, unless the failure is fatal (missing credential, provider
 * authentication, configuration), which ends the loop.
 */
@Slf4j
public class ToolCallLoop {

    private final ChatClient chatClient;
    private final ToolRegistry registry;
    private final ObjectMapper objectMapper;
    private final int maxRoundTrips;
    private final boolean parallelToolExecution;
    private final ExecutorService toolExecutor;

    /**
     * @param toolExecutor used only when {@code parallelToolExecution} is set; may be null otherwise
     */
    public ToolCallLoop(ChatClient chatClient,
                        ToolRegistry registry,
                        ObjectMapper objectMapper,
                        int maxRoundTrips,
                        boolean parallelToolExecution,
                        ExecutorService toolExecutor) {
        if (maxRoundTrips < 1) {
            throw new IllegalArgumentException("maxRoundTrips must be at least 1, was " + maxRoundTrips);
        }
        if (parallelToolExecution && toolExecutor == null) {
            throw new IllegalArgumentException("Parallel tool execution needs an executor");
        }
        this.chatClient = chatClient;
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.maxRoundTrips = maxRoundTrips;
        this.parallelToolExecution = parallelToolExecution;
        this.toolExecutor = toolExecutor;
    }

    // ── Entry point ──────────────────────────────────────────────────────────

    public ToolLoopResult run(List<AIMessage> conversation, String systemPrompt) {
        return run("local", conversation, systemPrompt, ToolLoopListener.NOOP);
    }

    /**
     * @param conversationId only used to tag logs and events
     * @throws ToolLoopBudgetExceededException when the model still wants tools on the last round trip
     * @throws ToolLoopFatalException          when a tool fails with a fatal error
     */
    public ToolLoopResult run(String conversationId,
                              List<AIMessage> conversation,
                              String systemPrompt,
                              ToolLoopListener listener) {
        List<AIMessage> messages = new ArrayList<>(conversation);
        List<ExecutedToolCall> executed = new ArrayList<>();
        AIUsage usage = AIUsage.empty();
        log.info("[ToolLoop:{}] Started with {} message(s), budget {} round trip(s)",
                conversationId, messages.size(), maxRoundTrips);

        int roundTrip = 0;
        try {
            while (true) {
                roundTrip++;
                LoopState state = LoopState.AWAITING_MODEL;
                listener.onRoundTripStart(roundTrip);

                List<ToolDescriptor> snapshot = registry.snapshot();
                AIResponse response = chatClient.complete(List.copyOf(messages), systemPrompt, snapshot);
                usage = usage.plus(response.usage());
                state = transition(conversationId, state, LoopState.MODEL_RESPONDED);

                // ── DONE ─────────────────────────────────────────────────────
                if (!response.hasToolCalls()) {
                    messages.add(AIMessage.assistant(response.content()));
                    transition(conversationId, state, LoopState.DONE);
                    ToolLoopResult result = new ToolLoopResult(response.content(), List.copyOf(messages),
                            List.copyOf(executed), roundTrip, usage, response.stopReason(),
                            response.provider(), response.model());
                    log.info("[ToolLoop:{}] Completed in {} round trip(s), {} tool call(s), {} tokens",
                            conversationId, roundTrip, executed.size(), usage.totalTokens());
                    listener.onFinalAnswer(result);
                    return result;
                }

                if (roundTrip >= maxRoundTrips) {
                    log.warn("[ToolLoop:{}] Budget of {} round trip(s) spent; model still requests {} tool call(s)",
                            conversationId, maxRoundTrips, response.toolCalls().size());
                    throw new ToolLoopBudgetExceededException(maxRoundTrips);
                }

                // ── ACT ──────────────────────────────────────────────────────
                messages.add(response.toMessage());
                state = transition(conversationId, state, LoopState.TOOL_CALL_REQUESTED);
                for (ToolInvocation call : response.toolCalls()) {
                    listener.onToolCall(call, roundTrip);
                }
                state = transition(conversationId, state, LoopState.TOOL_EXECUTING);

                List<Execution> results = execute(conversationId, response.toolCalls(), snapshot, roundTrip);
                for (Execution result : results) {
                    ExecutedToolCall call = result.call();
                    messages.add(AIMessage.toolResult(call.id(), call.toolName(), call.outcome().toString()));
                    executed.add(call);
                    listener.onToolResult(call);
                }
                transition(conversationId, state, LoopState.TOOL_RESULT_APPENDED);

                for (Execution result : results) {
                    if (result.isFatal()) {
                        log.warn("[ToolLoop:{}] Fatal failure in {}: {}", conversationId,
                                result.call().toolName(), result.failure().getMessage());
                        throw new ToolLoopFatalException(result.call().toolName(), roundTrip, result.failure());
                    }
                }
            }
        } catch (ConnectorException e) {
            listener.onError(e, roundTrip);
            throw e;
        }
    }

    public int maxRoundTrips() {
        return maxRoundTrips;
    }

    // ── Tool execution ───────────────────────────────────────────────────────

    private List<Execution> execute(String conversationId, List<ToolInvocation> calls,
                                    List<ToolDescriptor> snapshot, int roundTrip) {
        Map<String, CallableTool> tools = new LinkedHashMap<>();
        GenericToolAdapter.project(snapshot).forEach(tool -> tools.put(tool.name(), tool));

        boolean parallel = parallelToolExecution && calls.size() > 1
                && calls.stream().allMatch(call -> tools.containsKey(call.toolName())
                        && tools.get(call.toolName()).concurrencySafe());
        if (!parallel) {
            List<Execution> results = new ArrayList<>(calls.size());
            for (ToolInvocation call : calls) {
                Execution execution = executeOne(conversationId, call, tools, roundTrip);
                results.add(execution);
                if (execution.isFatal()) {
                    // later calls in the turn must not run their side effects
                    break;
                }
            }
            return results;
        }

        log.debug("[ToolLoop:{}] Running {} concurrency-safe call(s) in parallel", conversationId, calls.size());
        List<Callable<Execution>> tasks = calls.stream()
                .<Callable<Execution>>map(call -> () -> executeOne(conversationId, call, tools, roundTrip))
                .toList();
        try {
            // invokeAll returns futures in task order
            List<Execution> results = new ArrayList<>(calls.size());
            for (Future<Execution> future : toolExecutor.invokeAll(tasks)) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted while running tools in parallel", e);
        } catch (ExecutionException e) {
            throw new ToolExecutionException(calls.get(0).toolName(), e.getCause());
        }
    }

    private Execution executeOne(String conversationId, ToolInvocation call,
                                 Map<String, CallableTool> tools, int roundTrip) {
        long started = System.nanoTime();
        CallableTool tool = tools.get(call.toolName());
        ToolOutcome outcome = tool == null
                ? ToolOutcome.failure(new UnknownToolException(call.toolName()))
                : ToolOutcome.capture(call.toolName(), () -> tool.call(call.arguments()), objectMapper);
        long durationMs = (System.nanoTime() - started) / 1_000_000;

        if (outcome.isError()) {
            log.warn("[ToolLoop:{}] Tool {} failed ({}): {}", conversationId, call.toolName(),
                    outcome.failure().kind().code(), outcome.failure().getMessage());
        } else {
            log.debug("[ToolLoop:{}] Tool {} succeeded in {} ms", conversationId, call.toolName(), durationMs);
        }
        ExecutedToolCall executed = new ExecutedToolCall(call.id(), call.toolName(), call.arguments(),
                outcome.toJson(), outcome.isError(), roundTrip, durationMs);
        return new Execution(executed, outcome.failure());
    }

    private static LoopState transition(String conversationId, LoopState from, LoopState to) {
        log.trace("[ToolLoop:{}] {} → {}", conversationId, from, to);
        return to;
    }

    private record Execution(ExecutedToolCall call, ConnectorException failure) {

        boolean isFatal() {
            return failure != null && failure.isFatal();
        }
    }
}
