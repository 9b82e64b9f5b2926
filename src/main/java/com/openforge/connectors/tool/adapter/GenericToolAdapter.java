package com.openforge.connectors.tool.adapter;

import com.openforge.connectors.tool.ToolDescriptor;
import com.openforge.connectors.tool.ToolRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Generic-callable projection of the registry.
 */
@Component
@RequiredArgsConstructor
public class GenericToolAdapter {

    private final ToolRegistry registry;

    public List<CallableTool> tools() {
        return project(registry.snapshot());
    }

    public Optional<CallableTool> find(String name) {
        return registry.find(name).map(GenericToolAdapter::toCallable);
    }

    public static List<CallableTool> project(List<ToolDescriptor> descriptors) {
        return descriptors.stream().map(GenericToolAdapter::toCallable).toList();
    }

    static CallableTool toCallable(ToolDescriptor descriptor) {
        return new CallableTool(
                descriptor.name(),
                descriptor.description(),
                descriptor.inputSchema(),
                descriptor.concurrencySafe(),
                descriptor::invoke);
    }
}
