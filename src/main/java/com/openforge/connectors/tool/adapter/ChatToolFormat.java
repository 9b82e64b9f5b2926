package com.openforge.connectors.tool.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.openforge.connectors.tool.ToolDescriptor;
import com.openforge.connectors.tool.ToolInvocation;

import java.util.List;

/**
 * Chat-tool-call projection: how one provider family wants tools declared,
 * and how it reports the calls it wants made.
 */
public interface ChatToolFormat {

    /** Value for the provider's tools field. */
    ArrayNode formatTools(List<ToolDescriptor> tools);

    /**
     * Extract requested calls from a raw provider response, in the order the
     * model emitted them. Unparseable arguments become a malformed invocation
     * rather than an exception.
     */
    List<ToolInvocation> parseToolCalls(JsonNode providerResponse);
}
