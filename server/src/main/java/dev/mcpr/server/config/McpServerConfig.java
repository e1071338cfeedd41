package dev.mcpr.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mcpr.server.McpServer;
import dev.mcpr.server.PromptsProvider;
import dev.mcpr.server.ResourcesProvider;
import dev.mcpr.server.ToolsProvider;
import dev.mcpr.transport.SocketTransport;
import dev.mcpr.transport.StreamTransport;
import dev.mcpr.transport.Transport;
import dev.mcpr.transport.sse.EventStreamTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the server engine with the registered providers and the configured transport.
 */
@Configuration
@EnableConfigurationProperties(McpServerProperties.class)
public class McpServerConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(McpServerConfig.class);

    @Bean
    McpServer mcpServer(McpServerProperties properties, ObjectMapper objectMapper,
            ObjectProvider<ToolsProvider> toolsProvider, ObjectProvider<PromptsProvider> promptsProvider,
            ObjectProvider<ResourcesProvider> resourcesProvider) {
        return McpServer.builder()
            .name(properties.getName())
            .version(properties.getVersion())
            .maxErrors(properties.getMaxErrors())
            .retryDelay(properties.getRetryDelay())
            .objectMapper(objectMapper)
            .toolsProvider(toolsProvider.getIfAvailable())
            .promptsProvider(promptsProvider.getIfAvailable())
            .resourcesProvider(resourcesProvider.getIfAvailable())
            .build();
    }

    @Bean
    Transport mcpTransport(McpServerProperties properties) {
        McpServerProperties.Transport transport = properties.getTransport();
        LOGGER.info("Using {} transport", transport.getType());
        return switch (transport.getType()) {
            case STDIO -> StreamTransport.stdio();
            case TCP -> SocketTransport.bind(transport.getHost(), transport.getPort());
            case SSE -> EventStreamTransport.server(transport.getHost(), transport.getPort())
                .drainDelay(transport.getDrainDelay());
        };
    }
}
