package com.openforge.connectors.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.connectors.error.DuplicateToolNameException;
import com.openforge.connectors.error.ToolArgumentException;
import com.openforge.connectors.error.UnknownToolException;
import com.openforge.connectors.support.TestTools;
import com.openforge.connectors.tool.adapter.CallableTool;
import com.openforge.connectors.tool.adapter.GenericToolAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolRegistryTest {

    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry();
        registry.registerSource(TestTools.source("math", TestTools.doubler()));
    }

    @Test
    void registeredToolsAreNamespacedByTheirSource() {
        assertThat(registry.snapshot()).extracting(ToolDescriptor::name).containsExactly("math_double");
        assertThat(registry.require("math_double").connector()).isEqualTo("math");
    }

    @Test
    void duplicateNameLeavesTheRegistryUnchanged() {
        ToolOperation fresh = ToolOperation.builder()
                .name("triple")
                .handler(args -> 3)
                .build();

        assertThatThrownBy(() -> registry.registerAll("math", List.of(fresh, TestTools.doubler())))
                .isInstanceOf(DuplicateToolNameException.class)
                .satisfies(e -> assertThat(((DuplicateToolNameException) e).toolName()).isEqualTo("math_double"));

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.find("math_triple")).isEmpty();
    }

    @Test
    void duplicateInsideOneBatchIsRejected() {
        assertThatThrownBy(() -> registry.registerSource(
                TestTools.source("text", TestTools.doubler(), TestTools.doubler())))
                .isInstanceOf(DuplicateToolNameException.class);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void snapshotIsImmutableAndDoesNotSeeLaterRegistrations() {
        List<ToolDescriptor> before = registry.snapshot();

        registry.register("text", ToolOperation.builder().name("upper").handler(args -> "X").build());

        assertThat(before).hasSize(1);
        assertThat(registry.snapshot()).hasSize(2);
        assertThatThrownBy(() -> before.add(before.get(0))).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void invokeValidatesBeforeRunningTheHandler() {
        AtomicInteger calls = new AtomicInteger();
        registry.register("counter", ToolOperation.builder()
                .name("bump")
                .schema(ToolSchema.builder().required("by", ParamType.INTEGER, null).build())
                .handler(args -> calls.addAndGet(args.integer("by")))
                .build());

        assertThatThrownBy(() -> registry.invoke(ToolInvocation.of("counter_bump", Map.of("by", "many"))))
                .isInstanceOf(ToolArgumentException.class);
        assertThat(calls.get()).isZero();

        assertThat(registry.invoke(ToolInvocation.of("counter_bump", Map.of("by", 2)))).isEqualTo(2);
    }

    @Test
    void malformedArgumentsAreReportedAsArgumentErrors() {
        assertThatThrownBy(() -> registry.invoke(ToolInvocation.malformed("c1", "math_double", "{a: 3")))
                .isInstanceOf(ToolArgumentException.class)
                .hasMessageContaining("{a: 3");
    }

    @Test
    void unknownToolIsRejected() {
        assertThatThrownBy(() -> registry.require("nope")).isInstanceOf(UnknownToolException.class);
    }

    @Test
    void outcomeCapturesResultsAndFailuresAsData() {
        ObjectMapper mapper = new ObjectMapper();
        ToolDescriptor doubler = registry.require("math_double");

        assertThat(ToolOutcome.run(doubler, Map.of("a", 21), mapper).toJson().toString())
                .isEqualTo("{\"result\":{\"value\":42}}");
        assertThat(ToolOutcome.run(doubler, Map.of(), mapper).toJson().path("error").path("kind").asText())
                .isEqualTo("tool_argument");

        registry.register("broken", TestTools.failing("explode", new IllegalStateException("boom")));
        ToolOutcome failure = ToolOutcome.run(registry.require("broken_explode"), Map.of(), mapper);
        assertThat(failure.isError()).isTrue();
        assertThat(failure.toJson().path("error").path("kind").asText()).isEqualTo("tool_execution");
    }

    @Test
    void genericAdapterProjectsEveryToolAsACallable() {
        GenericToolAdapter adapter = new GenericToolAdapter(registry);

        List<CallableTool> tools = adapter.tools();

        assertThat(tools).singleElement().satisfies(tool -> {
            assertThat(tool.name()).isEqualTo("math_double");
            assertThat(tool.schema().path("required").get(0).asText()).isEqualTo("a");
            assertThat(tool.concurrencySafe()).isTrue();
            assertThat(tool.call(Map.of("a", 5))).isEqualTo(Map.of("value", 10L));
        });
        assertThat(adapter.find("missing")).isEmpty();
    }
}
