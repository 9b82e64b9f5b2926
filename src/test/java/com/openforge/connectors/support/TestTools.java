package com.openforge.connectors.support;

import com.openforge.connectors.tool.ParamType;
import com.openforge.connectors.tool.ToolCategory;
import com.openforge.connectors.tool.ToolOperation;
import com.openforge.connectors.tool.ToolSchema;
import com.openforge.connectors.tool.ToolSource;

import java.util.List;
import java.util.Map;

/**
 * Small in-memory tool sources for registry, adapter and loop tests.
 */
public final class TestTools {

    private TestTools() {
    }

    /** {@code double(a: integer)} → {@code {"value": 2a}} */
    public static ToolOperation doubler() {
        return ToolOperation.builder()
                .name("double")
                .description("Double an integer")
                .category(ToolCategory.READ)
                .schema(ToolSchema.builder()
                        .required("a", ParamType.INTEGER, "Value to double")
                        .build())
                .handler(args -> Map.of("value", args.longValue("a") * 2))
                .concurrencySafe(true)
                .build();
    }

    /** Always fails with the given exception. */
    public static ToolOperation failing(String name, RuntimeException failure) {
        return ToolOperation.builder()
                .name(name)
                .description("Fails on purpose")
                .handler(args -> {
                    throw failure;
                })
                .build();
    }

    public static ToolSource source(String name, ToolOperation... operations) {
        return new ToolSource() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public List<ToolOperation> operations() {
                return List.of(operations);
            }
        };
    }
}
