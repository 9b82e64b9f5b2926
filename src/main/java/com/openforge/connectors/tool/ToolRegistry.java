package com.openforge.connectors.tool;

import com.openforge.connectors.error.DuplicateToolNameException;
import com.openforge.connectors.error.UnknownToolException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Process-wide registry of tools, keyed by namespaced name.
 *
 * Registration is all-or-nothing: a batch is checked in full (against the
 * registry and against itself) before anything is inserted, so a
 * {@link DuplicateToolNameException} leaves the registry exactly as it was.
 *
 * Adapters never hold on to the map; they take a {@link #snapshot()} per
 * request, so tools registered later show up without a restart.
 */
@Slf4j
@Component
public class ToolRegistry {

    private final Map<String, ToolDescriptor> tools = new LinkedHashMap<>();

    // ── Registration ─────────────────────────────────────────────────────────

    public ToolDescriptor register(String connector, ToolOperation operation) {
        return registerAll(connector, List.of(operation)).get(0);
    }

    public List<ToolDescriptor> registerSource(ToolSource source) {
        return registerAll(source.name(), source.operations());
    }

    public synchronized List<ToolDescriptor> registerAll(String connector, List<ToolOperation> operations) {
        List<ToolDescriptor> batch = new ArrayList<>(operations.size());
        Set<String> batchNames = new HashSet<>();
        for (ToolOperation operation : operations) {
            ToolDescriptor descriptor = ToolDescriptor.of(connector, operation);
            if (tools.containsKey(descriptor.name()) || !batchNames.add(descriptor.name())) {
                log.warn("[ToolRegistry] Rejected registration from '{}': duplicate tool name '{}'",
                        connector, descriptor.name());
                throw new DuplicateToolNameException(descriptor.name());
            }
            batch.add(descriptor);
        }
        batch.forEach(d -> tools.put(d.name(), d));
        log.info("[ToolRegistry] Registered {} tool(s) from '{}'", batch.size(), connector);
        return List.copyOf(batch);
    }

    // ── Lookup ───────────────────────────────────────────────────────────────

    /** Immutable copy in registration order. */
    public synchronized List<ToolDescriptor> snapshot() {
        return List.copyOf(tools.values());
    }

    public synchronized Optional<ToolDescriptor> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public ToolDescriptor require(String name) {
        return find(name).orElseThrow(() -> new UnknownToolException(name));
    }

    public synchronized int size() {
        return tools.size();
    }

    /** Validate and run. Handlers execute outside the registry lock. */
    public Object invoke(ToolInvocation invocation) {
        return require(invocation.toolName()).invoke(invocation.arguments());
    }
}
