package com.openforge.connectors.web.dto;

import com.openforge.connectors.ai.model.AIMessage;
import com.openforge.connectors.ai.model.AIRole;
import jakarta.validation.constraints.NotNull;

/**
 * A prior plain-text turn supplied by the client. Tool turns are not
 * accepted from outside; the loop produces those itself.
 */
public record HistoryMessage(
        @NotNull AIRole role,
        String content
) {

    public AIMessage toMessage() {
        return switch (role) {
            case SYSTEM -> AIMessage.system(content);
            case USER -> AIMessage.user(content);
            case ASSISTANT -> AIMessage.assistant(content);
            case TOOL -> throw new IllegalArgumentException("Tool turns cannot be supplied as history");
        };
    }
}
