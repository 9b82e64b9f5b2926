package com.openforge.connectors.web;

import com.openforge.connectors.agent.ToolLoopResult;
import com.openforge.connectors.ai.AIConnector;
import com.openforge.connectors.web.dto.ChatApiRequest;
import com.openforge.connectors.web.dto.ChatApiResponse;
import com.openforge.connectors.web.dto.HistoryMessage;
import com.openforge.connectors.websocket.ToolLoopEventPublisher;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Synchronous chat endpoint.
 *
 *   POST /api/chat: answer a message, using the registered tools unless use_tools=false
 *
 * Progress of the tool-call loop is pushed while the request runs:
 *   the client subscribes to /topic/tool-loop/{conversationId} (the topic is
 *   echoed in the response) and receives ToolLoopEvent frames.
 */
@Slf4j
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatController {

    private final AIConnector            aiConnector;
    private final ToolLoopEventPublisher eventPublisher;

    @PostMapping
    public ChatApiResponse chat(@Valid @RequestBody ChatApiRequest request) {
        String conversationId = request.conversationId() != null && !request.conversationId().isBlank()
                ? request.conversationId()
                : UUID.randomUUID().toString();

        log.info("[Chat] conversation {} tools={}: {}", conversationId, request.toolsEnabled(),
                request.message().substring(0, Math.min(80, request.message().length())));

        ToolLoopResult result = aiConnector.invoke(
                conversationId,
                request.message(),
                request.historyOrEmpty().stream().map(HistoryMessage::toMessage).toList(),
                request.systemPrompt(),
                request.toolsEnabled(),
                eventPublisher.listenerFor(conversationId));

        return ChatApiResponse.from(conversationId, result, ToolLoopEventPublisher.topicFor(conversationId));
    }
}
