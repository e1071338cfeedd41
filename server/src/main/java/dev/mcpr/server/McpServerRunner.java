package dev.mcpr.server;

import dev.mcpr.transport.Transport;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Serves the configured transport on the main thread once the context is up. A fatal loop error
 * propagates and fails the application.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "mcp.server", name = "auto-start", havingValue = "true", matchIfMissing = true)
public class McpServerRunner implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(McpServerRunner.class);

    private final McpServer mcpServer;
    private final Transport mcpTransport;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        LOGGER.info("Serving {} over {}", mcpServer.serverInfo().name(), mcpTransport.getClass().getSimpleName());
        mcpServer.start(mcpTransport);
    }
}
