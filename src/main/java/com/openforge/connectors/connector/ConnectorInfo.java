package com.openforge.connectors.connector;

import java.util.List;

/** Catalog view of one connector. */
public record ConnectorInfo(
        String name,
        String description,
        String baseUrl,
        List<String> credentials,
        List<String> tools
) {}
