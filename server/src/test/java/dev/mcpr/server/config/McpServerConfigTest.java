package dev.mcpr.server.config;

import static org.assertj.core.api.Assertions.assertThat;

import dev.mcpr.server.McpServer;
import dev.mcpr.transport.SocketTransport;
import dev.mcpr.transport.StreamTransport;
import dev.mcpr.transport.Transport;
import dev.mcpr.transport.sse.EventStreamServerTransport;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class McpServerConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
        .withUserConfiguration(McpServerConfig.class);

    @Test
    void defaultsToStdio() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(McpServer.class);
            assertThat(context.getBean(Transport.class)).isInstanceOf(StreamTransport.class);
            McpServerProperties properties = context.getBean(McpServerProperties.class);
            assertThat(properties.getMaxErrors()).isEqualTo(5);
            assertThat(properties.getRetryDelay()).isEqualTo(Duration.ofMillis(100));
            assertThat(properties.getTransport().getPort()).isEqualTo(7071);
        });
    }

    @Test
    void bindsTcpTransport() {
        contextRunner
            .withPropertyValues("mcp.server.transport.type=tcp", "mcp.server.transport.port=0")
            .run(context -> {
                Transport transport = context.getBean(Transport.class);
                assertThat(transport).isInstanceOf(SocketTransport.class);
                assertThat(((SocketTransport) transport).localPort()).isZero();
            });
    }

    @Test
    void bindsEventStreamTransport() {
        contextRunner
            .withPropertyValues("mcp.server.transport.type=sse", "mcp.server.transport.drain-delay=1s",
                "mcp.server.max-errors=3", "mcp.server.name=sse-server")
            .run(context -> {
                assertThat(context.getBean(Transport.class)).isInstanceOf(EventStreamServerTransport.class);
                assertThat(context.getBean(McpServerProperties.class).getMaxErrors()).isEqualTo(3);
                assertThat(context.getBean(McpServer.class).serverInfo().name()).isEqualTo("sse-server");
            });
    }

    @Test
    void serverWithoutProvidersStillBuilds() {
        contextRunner.run(context -> assertThat(context.getBean(McpServer.class).serverInfo().version()).isEqualTo("1.0.0"));
    }
}
