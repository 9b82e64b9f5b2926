package com.openforge.connectors.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Request body for POST /api/chat.
 *
 * {@code conversation_id} is optional; when absent a UUID is generated and
 * returned so the client can follow the WebSocket topic.
 */
public record ChatApiRequest(
        @NotBlank String message,
        List<@Valid HistoryMessage> history,
        String systemPrompt,
        Boolean useTools,
        String conversationId
) {

    public boolean toolsEnabled() {
        return useTools == null || useTools;
    }

    public List<HistoryMessage> historyOrEmpty() {
        return history == null ? List.of() : history;
    }
}
