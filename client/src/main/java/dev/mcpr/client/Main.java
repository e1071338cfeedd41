package dev.mcpr.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.mcpr.error.McpException;
import dev.mcpr.schema.Implementation;
import dev.mcpr.schema.Prompt;
import dev.mcpr.schema.PromptMessage;
import dev.mcpr.schema.Resource;
import dev.mcpr.schema.ResourceContents;
import dev.mcpr.schema.Tool;
import dev.mcpr.transport.QueueingTransport;
import dev.mcpr.transport.SocketTransport;
import dev.mcpr.transport.StreamTransport;
import dev.mcpr.transport.Transport;
import dev.mcpr.transport.framed.FramedTransport;
import dev.mcpr.transport.sse.EventStreamTransport;
import java.io.PrintStream;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class Main {

    private static final Duration RECEIVE_TIMEOUT = Duration.ofSeconds(30);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private Main() {
    }

    public static void main(String[] args) {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Run one console command.
     * @return the process exit status: 0 on success, 1 on an MCP failure, 2 on a usage error
     */
    static int run(String[] args) {
        List<String> arguments = new ArrayList<>(Arrays.asList(args));
        Options options;
        Transport transport;
        try {
            options = Options.parse(arguments);
            transport = arguments.isEmpty() ? null : createTransport(options);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            return 2;
        }
        if (transport == null) {
            printUsage();
            return 0;
        }
        String command = arguments.remove(0);
        // stdout is the wire when talking to a server over our own stdio
        PrintStream out = options.usesOwnStdio() ? System.err : System.out;

        McpClient client = McpClient.builder(transport).build();
        try {
            Implementation server = client.initialize();
            switch (command) {
                case "init" -> out.println("INIT server=" + server.name() + " " + server.version()
                    + " capabilities=" + client.getServerCapabilities());
                case "tools" -> handleTools(client, out);
                case "call" -> handleCall(client, arguments, out);
                case "prompts" -> handlePrompts(client, out);
                case "prompt" -> handlePrompt(client, arguments, out);
                case "resources" -> handleResources(client, out);
                case "resource" -> handleResource(client, arguments, out);
                default -> {
                    System.err.println("Unknown command: " + command);
                    printUsage();
                }
            }
            client.shutdown();
            return 0;
        } catch (McpException e) {
            System.err.println(e.getMessage());
            client.close();
            return 1;
        } catch (IllegalArgumentException | JsonProcessingException e) {
            String message = e instanceof JsonProcessingException json
                ? "Invalid JSON argument: " + json.getOriginalMessage()
                : e.getMessage();
            System.err.println(message);
            printUsage();
            client.close();
            return 2;
        }
    }

    static Transport createTransport(Options options) {
        return switch (options.transport) {
            case "stdio" -> options.command.isEmpty()
                ? StreamTransport.stdio()
                : StreamTransport.forProcess(options.command);
            case "tcp" -> SocketTransport.connect(options.host, options.port).receiveTimeout(RECEIVE_TIMEOUT);
            case "sse" -> EventStreamTransport.client(URI.create(options.url("http"))).receiveTimeout(RECEIVE_TIMEOUT);
            case "ws" -> new QueueingTransport(new FramedTransport(URI.create(options.url("ws"))), RECEIVE_TIMEOUT);
            default -> throw new IllegalArgumentException("Unknown transport: " + options.transport);
        };
    }

    private static void handleTools(McpClient client, PrintStream out) throws McpException {
        List<Tool> tools = client.listTools();
        out.println("TOOLS (" + tools.size() + "):");
        for (Tool tool : tools) {
            out.println("  " + tool.name() + (tool.description() == null ? "" : " - " + tool.description()));
        }
    }

    private static void handleCall(McpClient client, List<String> arguments, PrintStream out)
        throws McpException, JsonProcessingException {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("call requires a tool name");
        }
        JsonNode params = arguments.size() > 1 ? MAPPER.readTree(arguments.get(1)) : null;
        JsonNode result = client.callTool(arguments.get(0), params);
        out.println(MAPPER.writeValueAsString(result));
    }

    private static void handlePrompts(McpClient client, PrintStream out) throws McpException {
        List<Prompt> prompts = client.getPrompts();
        out.println("PROMPTS (" + prompts.size() + "):");
        for (Prompt prompt : prompts) {
            out.println("  " + prompt.name() + (prompt.description() == null ? "" : " - " + prompt.description()));
        }
    }

    private static void handlePrompt(McpClient client, List<String> arguments, PrintStream out)
        throws McpException, JsonProcessingException {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("prompt requires a prompt name");
        }
        JsonNode promptArgs = arguments.size() > 1 ? MAPPER.readTree(arguments.get(1)) : null;
        for (PromptMessage message : client.getPromptMessages(arguments.get(0), promptArgs)) {
            out.println("[" + message.role() + "] " + message.content());
        }
    }

    private static void handleResources(McpClient client, PrintStream out) throws McpException {
        List<Resource> resources = client.getResources();
        out.println("RESOURCES (" + resources.size() + "):");
        for (Resource resource : resources) {
            out.println("  " + resource.uri() + " (" + resource.name() + ")");
        }
    }

    private static void handleResource(McpClient client, List<String> arguments, PrintStream out) throws McpException {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("resource requires a uri");
        }
        ResourceContents contents = client.getResource(arguments.get(0));
        out.println("RESOURCE " + contents.uri() + " [" + contents.mimeType() + "]\n" + contents.text());
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar mcpr-client.jar [options] <command> [args]\n" +
            "Options:\n" +
            "  --transport stdio|tcp|sse|ws   (default stdio)\n" +
            "  --host <host> --port <port>    (tcp, default localhost:7071)\n" +
            "  --url <url>                    (sse, ws)\n" +
            "  --command \"<server command>\"   (stdio, launch the server as a child process)\n" +
            "Commands:\n" +
            "  init\n" +
            "  tools\n" +
            "  call <name> [json]\n" +
            "  prompts\n" +
            "  prompt <name> [json]\n" +
            "  resources\n" +
            "  resource <uri>");
    }

    /**
     * Leading {@code --option value} pairs; everything after them is the command.
     */
    static final class Options {

        String transport = "stdio";
        String host = "localhost";
        int port = 7071;
        String url;
        List<String> command = List.of();

        static Options parse(List<String> arguments) {
            Options options = new Options();
            while (!arguments.isEmpty() && arguments.get(0).startsWith("--")) {
                String option = arguments.remove(0);
                if (arguments.isEmpty()) {
                    throw new IllegalArgumentException(option + " requires a value");
                }
                String value = arguments.remove(0);
                switch (option) {
                    case "--transport" -> options.transport = value;
                    case "--host" -> options.host = value;
                    case "--port" -> options.port = parsePort(value);
                    case "--url" -> options.url = value;
                    case "--command" -> options.command = Arrays.asList(value.trim().split("\\s+"));
                    default -> throw new IllegalArgumentException("Unknown option: " + option);
                }
            }
            return options;
        }

        boolean usesOwnStdio() {
            return "stdio".equals(transport) && command.isEmpty();
        }

        String url(String scheme) {
            return url != null ? url : scheme + "://" + host + ":" + port;
        }

        private static int parsePort(String value) {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port: " + value, e);
            }
        }
    }
}
