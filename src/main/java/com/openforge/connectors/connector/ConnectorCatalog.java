package com.openforge.connectors.connector;

import com.openforge.connectors.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Every enabled connector in the process, by name.
 *
 * Constructing the catalog registers each connector's operations with the
 * {@link ToolRegistry}; a duplicate tool name aborts startup.
 */
@Slf4j
public class ConnectorCatalog {

    private final Map<String, VendorConnector> connectors;

    public ConnectorCatalog(List<VendorConnector> connectors, ToolRegistry toolRegistry) {
        Map<String, VendorConnector> byName = new LinkedHashMap<>();
        for (VendorConnector connector : connectors) {
            if (byName.putIfAbsent(connector.name(), connector) != null) {
                throw new IllegalStateException("Two connectors share the name '%s'".formatted(connector.name()));
            }
            toolRegistry.registerSource(connector);
        }
        this.connectors = Collections.unmodifiableMap(byName);
        log.info("[ConnectorCatalog] {} connector(s) registered: {}", byName.size(), byName.keySet());
    }

    public List<VendorConnector> list() {
        return List.copyOf(connectors.values());
    }

    public Optional<VendorConnector> find(String name) {
        return Optional.ofNullable(connectors.get(name));
    }

    public Optional<ConnectorInfo> info(String name) {
        return find(name).map(VendorConnector::info);
    }

    public List<ConnectorInfo> infos() {
        return connectors.values().stream().map(VendorConnector::info).toList();
    }
}
