package dev.jsonrpc.client;

import com.fasterxml.jackson.databind.JsonNode;
import dev.jsonrpc.client.transport.SocketRpcTransport;
import dev.jsonrpc.transport.Credential;
import dev.jsonrpc.transport.Envelope;
import dev.jsonrpc.transport.JsonRpcCodec;
import dev.jsonrpc.transport.JsonRpcTransportException;
import dev.jsonrpc.transport.ServiceAddress;
import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public final class Main {

    private Main() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        List<String> arguments = new ArrayList<>(Arrays.asList(args));
        if (arguments.isEmpty()) {
            printUsage(out);
            return 0;
        }
        String command = arguments.remove(0);
        if (!"call".equals(command)) {
            err.println("Unknown command: " + command);
            printUsage(err);
            return 2;
        }

        ClientOptions.Builder options = ClientOptions.builder();
        Optional<Credential> credential = Optional.empty();
        try {
            while (!arguments.isEmpty() && arguments.get(0).startsWith("--")) {
                String flag = arguments.remove(0);
                if (arguments.isEmpty()) {
                    throw new IllegalArgumentException(flag + " requires a value");
                }
                String value = arguments.remove(0);
                switch (flag) {
                    case "--timeout" -> options.timeout(Duration.ofSeconds(Long.parseLong(value)));
                    case "--api-key" -> credential = Optional.of(Credential.parse(value));
                    case "--user-agent" -> options.userAgent(value);
                    default -> throw new IllegalArgumentException("Unknown option: " + flag);
                }
            }
            if (arguments.size() < 4) {
                throw new IllegalArgumentException("call requires <host:port> <path> <method> <params-json>");
            }
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage(err);
            return 2;
        }

        JsonRpcCodec codec = new JsonRpcCodec();
        try (SocketRpcTransport transport = new SocketRpcTransport(options.build(), codec)) {
            ServiceAddress address = new ServiceAddress(arguments.get(0), arguments.get(1));
            JsonNode params = codec.decode(arguments.get(3));
            Envelope envelope = arguments.size() > 4
                ? idEnvelope(arguments.get(2), params, arguments.get(4))
                : Envelope.build(arguments.get(2), params, 0L);
            JsonNode reply = transport.send(envelope, address, credential);
            out.println(reply.toPrettyString());
            return 0;
        } catch (JsonRpcTransportException e) {
            err.println("ERROR " + e.kind() + ": " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return 2;
        }
    }

    private static Envelope idEnvelope(String method, JsonNode params, String id) {
        try {
            return Envelope.build(method, params, Long.parseLong(id));
        } catch (NumberFormatException e) {
            return Envelope.build(method, params, id);
        }
    }

    private static void printUsage(PrintStream stream) {
        stream.println("Usage: java -jar jsonrpc-client.jar call [options] <host:port> <path> <method> <params-json> [id]\n" +
            "Options:\n" +
            "  --timeout <seconds>\n" +
            "  --api-key <NAME=VALUE>\n" +
            "  --user-agent <identifier>");
    }
}
