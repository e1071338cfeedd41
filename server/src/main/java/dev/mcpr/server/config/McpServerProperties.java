package dev.mcpr.server.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration of the hosted MCP server and the transport it serves.
 */
@ConfigurationProperties(prefix = "mcp.server")
public class McpServerProperties {

    /**
     * Server name reported in the initialize response.
     */
    private String name = "MCP Server";

    /**
     * Server version reported in the initialize response.
     */
    private String version = "1.0.0";

    /**
     * Run the server loop when the application starts.
     */
    private boolean autoStart = true;

    /**
     * Consecutive non-transient failures tolerated before the loop gives up.
     */
    private int maxErrors = 5;

    /**
     * Pause between retries of the server loop.
     */
    private Duration retryDelay = Duration.ofMillis(100);

    private final Transport transport = new Transport();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public int getMaxErrors() {
        return maxErrors;
    }

    public void setMaxErrors(int maxErrors) {
        this.maxErrors = maxErrors;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public void setRetryDelay(Duration retryDelay) {
        this.retryDelay = retryDelay;
    }

    public Transport getTransport() {
        return transport;
    }

    public enum TransportType {
        STDIO, TCP, SSE
    }

    public static class Transport {

        private TransportType type = TransportType.STDIO;

        /**
         * Listen address for the TCP and SSE transports.
         */
        private String host = "127.0.0.1";

        private int port = 7071;

        /**
         * How long the SSE transport keeps serving queued responses after close.
         */
        private Duration drainDelay = Duration.ofMillis(500);

        public TransportType getType() {
            return type;
        }

        public void setType(TransportType type) {
            this.type = type;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public Duration getDrainDelay() {
            return drainDelay;
        }

        public void setDrainDelay(Duration drainDelay) {
            this.drainDelay = drainDelay;
        }
    }
}
