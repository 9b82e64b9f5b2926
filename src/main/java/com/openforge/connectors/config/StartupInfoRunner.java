package com.openforge.connectors.config;

import com.openforge.connectors.ai.ChatClient;
import com.openforge.connectors.connector.ConnectorCatalog;
import com.openforge.connectors.connector.ConnectorInfo;
import com.openforge.connectors.tool.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Reports connectors and their tool counts, the chat provider in use and the
 * transport defaults. Credential values are never printed, only their names.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final ConnectorCatalog    catalog;
    private final ToolRegistry        toolRegistry;
    private final ChatClient          chatClient;
    private final ConnectorProperties properties;
    private final Environment         env;

    @Override
    public void run(ApplicationArguments args) {
        String port        = env.getProperty("server.port", "8080");
        String javaVersion = System.getProperty("java.version");

        ConnectorProperties.Ai ai        = properties.ai();
        ConnectorProperties.RateLimit rl = properties.defaults().rateLimit();
        ConnectorProperties.Retry retry  = properties.defaults().retry();

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║           Vendor Connectors  -  Startup Summary          ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Connectors                                              ║
                ║    {}
                ║    Tools          : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Chat                                                    ║
                ║    Primary        : {}  [{}]
                ║    Fallback       : {}
                ║    Max round trips: {}  parallel={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Defaults                                                ║
                ║    Rate limit     : capacity={} refill={}/s mode={}
                ║    Retry          : attempts={} base={} x{} jitter={}
                ║    Credentials    : prompt={} vault={}
                ╚══════════════════════════════════════════════════════════╝
                """,
                port,
                javaVersion,

                describeConnectors(),
                toolRegistry.size(),

                chatClient.providerName(), chatClient.model(),
                ai.hasFallback() ? ai.fallback().provider() : "(none)",
                properties.agent().maxRoundTrips(), properties.agent().parallelToolExecution(),

                rl.capacity(), rl.refillPerSecond(), rl.mode(),
                retry.maxAttempts(), retry.baseBackoff(), retry.multiplier(), retry.jitter(),
                properties.credentials().allowPrompt(),
                properties.credentials().vault().isConfigured() ? properties.credentials().vault().address() : "off"
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /** One "name(n tools; credentials a,b)" entry per connector. */
    private String describeConnectors() {
        if (catalog.list().isEmpty()) {
            return "(none enabled)";
        }
        return catalog.infos().stream()
                .map(StartupInfoRunner::describe)
                .collect(Collectors.joining("\n║    "));
    }

    private static String describe(ConnectorInfo info) {
        return "%s (%d tools; credentials %s)".formatted(
                info.name(), info.tools().size(), String.join(",", info.credentials()));
    }
}
