package com.openforge.connectors.web;

import com.openforge.connectors.ai.ChatClient;
import com.openforge.connectors.config.ConnectorProperties;
import com.openforge.connectors.connector.ConnectorCatalog;
import com.openforge.connectors.connector.ConnectorInfo;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * What is wired in, plus credential refresh.
 *
 *   GET  /api/connectors                              : every vendor connector with its credential and tool names
 *   GET  /api/connectors/{name}                       : one connector
 *   GET  /api/connectors/chat                         : the chat provider behind /api/chat
 *   POST /api/connectors/{name}/credentials/refresh   : drop cached credentials; the next call resolves again
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/connectors")
public class ConnectorController {

    private final ConnectorCatalog    catalog;
    private final ChatClient          chatClient;
    private final ConnectorProperties properties;

    public record ChatProviderInfo(String provider, String model, String fallback) {}

    @GetMapping
    public List<ConnectorInfo> list() {
        return catalog.infos();
    }

    @GetMapping("/chat")
    public ChatProviderInfo chat() {
        ConnectorProperties.Ai ai = properties.ai();
        return new ChatProviderInfo(chatClient.providerName(), chatClient.model(),
                ai.hasFallback() ? ai.fallback().provider() : null);
    }

    @GetMapping("/{name}")
    public ConnectorInfo get(@PathVariable String name) {
        return catalog.info(name).orElseThrow(() -> unknown(name));
    }

    @PostMapping("/{name}/credentials/refresh")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void refreshCredentials(@PathVariable String name) {
        catalog.find(name).orElseThrow(() -> unknown(name)).refreshCredentials();
    }

    private static ResponseStatusException unknown(String name) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown connector: " + name);
    }
}
