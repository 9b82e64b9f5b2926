package com.openforge.connectors.tool;

import java.util.List;

/**
 * Anything that declares tool operations under a namespace, typically a connector.
 */
public interface ToolSource {

    String name();

    List<ToolOperation> operations();
}
