package dev.jsonrpc.server.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.jsonrpc.server.service.MathService;
import dev.jsonrpc.transport.Credential;
import dev.jsonrpc.transport.HttpFrameCodec;
import dev.jsonrpc.transport.HttpMessage;
import dev.jsonrpc.transport.InvalidResponseException;
import dev.jsonrpc.transport.JsonRpcError;
import dev.jsonrpc.transport.Wire;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers JSON-RPC calls framed as minimal HTTP/1.1 POST requests. Each connection carries a
 * single request; the reply always announces {@code Connection: close} and the socket is closed
 * right after it is written.
 */
public class HttpRpcServer implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpRpcServer.class);
    private static final int UNAUTHORIZED = -32001;
    private static final int READ_TIMEOUT_MILLIS = 30_000;

    private final int port;
    private final String requestTarget;
    private final Optional<Credential> apiKey;
    private final MathService service;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ExecutorService clientExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "http-rpc-server-client");
        t.setDaemon(true);
        return t;
    });
    private final Set<ClientConnection> connections = ConcurrentHashMap.newKeySet();

    private ServerSocket serverSocket;
    private Thread acceptThread;
    private volatile boolean running;

    public HttpRpcServer(int port, String path, Optional<Credential> apiKey, MathService service) {
        this.port = port;
        this.requestTarget = "/" + trimSlashes(Objects.requireNonNull(path, "path"));
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        this.service = Objects.requireNonNull(service, "service");
    }

    public synchronized void start() throws IOException {
        if (running) {
            return;
        }
        serverSocket = new ServerSocket(port);
        running = true;
        acceptThread = new Thread(this::acceptLoop, "http-rpc-server-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        LOGGER.info("JSON-RPC server listening on port {} at {}", getPort(), requestTarget);
    }

    /**
     * Port actually bound, which differs from the configured one when that was {@code 0}.
     */
    public int getPort() {
        return serverSocket != null ? serverSocket.getLocalPort() : port;
    }

    private void acceptLoop() {
        while (running) {
            try {
                Socket socket = serverSocket.accept();
                socket.setTcpNoDelay(true);
                socket.setSoTimeout(READ_TIMEOUT_MILLIS);
                ClientConnection connection = new ClientConnection(socket);
                connections.add(connection);
                clientExecutor.submit(connection::serve);
            } catch (IOException e) {
                if (running) {
                    LOGGER.error("Error accepting connection", e);
                }
            } catch (RejectedExecutionException e) {
                LOGGER.warn("Client executor rejected connection", e);
            }
        }
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            serverSocket.close();
        } catch (IOException e) {
            LOGGER.warn("Error closing server socket", e);
        }
        try {
            acceptThread.join(Duration.ofSeconds(1).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        for (ClientConnection connection : new ArrayList<>(connections)) {
            connection.close();
        }
        clientExecutor.shutdown();
        try {
            if (!clientExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                clientExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOGGER.info("JSON-RPC server stopped");
    }

    @Override
    public void close() {
        stop();
    }

    private static String trimSlashes(String path) {
        int start = 0;
        int end = path.length();
        while (start < end && path.charAt(start) == '/') {
            start++;
        }
        while (end > start && path.charAt(end - 1) == '/') {
            end--;
        }
        return path.substring(start, end);
    }

    private final class ClientConnection implements Closeable {

        private final Socket socket;
        private final String connectionId;

        ClientConnection(Socket socket) {
            this.socket = socket;
            this.connectionId = socket.getRemoteSocketAddress().toString();
            LOGGER.debug("Accepted connection {}", connectionId);
        }

        void serve() {
            try (InputStream in = socket.getInputStream(); OutputStream out = socket.getOutputStream()) {
                HttpMessage request;
                try {
                    request = HttpFrameCodec.split(HttpFrameCodec.readMessage(in));
                } catch (InvalidResponseException e) {
                    LOGGER.warn("Malformed request from {}: {}", connectionId, e.getMessage());
                    reply(out, 400, "Bad Request", service.error(null, JsonRpcError.parseError()));
                    return;
                }
                Wire.rx(connectionId, request.startLine(), request.body());
                handle(request, out);
            } catch (IOException e) {
                if (running) {
                    LOGGER.error("Connection error {}", connectionId, e);
                }
            } finally {
                close();
            }
        }

        private void handle(HttpMessage request, OutputStream out) throws IOException {
            String[] startLine = request.startLine().split(" ");
            if (startLine.length != 3 || !startLine[2].startsWith("HTTP/")) {
                reply(out, 400, "Bad Request", service.error(null, JsonRpcError.invalidRequest()));
                return;
            }
            if (!"POST".equals(startLine[0])) {
                reply(out, 405, "Method Not Allowed", service.error(null, JsonRpcError.invalidRequest()));
                return;
            }
            if (!requestTarget.equals(startLine[1])) {
                reply(out, 404, "Not Found", service.error(null, JsonRpcError.methodNotFound()));
                return;
            }
            if (apiKey.isPresent() && !authorized(request, apiKey.get())) {
                LOGGER.warn("Rejected unauthorized request from {}", connectionId);
                reply(out, 401, "Unauthorized",
                    service.error(null, new JsonRpcError(UNAUTHORIZED, "Unauthorized", null)));
                return;
            }
            reply(out, 200, "OK", service.handle(request.body()));
        }

        private boolean authorized(HttpMessage request, Credential expected) {
            return request.header(expected.name()).map(expected.value()::equals).orElse(false);
        }

        private void reply(OutputStream out, int status, String reason, ObjectNode body) throws IOException {
            String json;
            try {
                json = mapper.writeValueAsString(body);
            } catch (JsonProcessingException e) {
                throw new IOException("Failed to encode reply", e);
            }
            Wire.tx(connectionId, HttpFrameCodec.HTTP_VERSION + " " + status + " " + reason, json);
            HttpFrameCodec.writeFrame(out, HttpFrameCodec.encodeResponse(status, reason, json));
        }

        @Override
        public void close() {
            connections.remove(this);
            if (!socket.isClosed()) {
                try {
                    socket.close();
                } catch (IOException e) {
                    LOGGER.warn("Error closing connection {}", connectionId, e);
                }
            }
            LOGGER.debug("Connection {} closed", connectionId);
        }
    }
}
