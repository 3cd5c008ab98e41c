package dev.jsonrpc.client.transport;

import com.fasterxml.jackson.databind.JsonNode;
import dev.jsonrpc.client.ClientOptions;
import dev.jsonrpc.transport.ConnectionException;
import dev.jsonrpc.transport.Credential;
import dev.jsonrpc.transport.Envelope;
import dev.jsonrpc.transport.HttpFrameCodec;
import dev.jsonrpc.transport.HttpMessage;
import dev.jsonrpc.transport.JsonRpcCodec;
import dev.jsonrpc.transport.JsonRpcTransportException;
import dev.jsonrpc.transport.ResponseException;
import dev.jsonrpc.transport.ServiceAddress;
import dev.jsonrpc.transport.Wire;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends JSON-RPC envelopes as minimal HTTP/1.1 POST requests over a plain socket, one connection
 * per call.
 *
 * <p>{@link #sendAsync} is the canonical entry point: the round trip runs on a worker thread and
 * the returned future completes with the decoded reply or exceptionally with a
 * {@link JsonRpcTransportException}. {@link #send} runs the same exchange to completion on behalf
 * of the caller. Cancelling the future closes the call's socket.
 *
 * <p>A JSON-RPC {@code error} member in the reply is returned as data, not raised.
 */
public class SocketRpcTransport implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(SocketRpcTransport.class);

    private final ClientOptions options;
    private final JsonRpcCodec codec;
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final AtomicInteger callCounter = new AtomicInteger();
    private final ExecutorService workers;
    private final ScheduledExecutorService watchdog;

    public SocketRpcTransport() {
        this(ClientOptions.defaults());
    }

    public SocketRpcTransport(ClientOptions options) {
        this(options, new JsonRpcCodec());
    }

    public SocketRpcTransport(ClientOptions options, JsonRpcCodec codec) {
        this.options = Objects.requireNonNull(options, "options");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "rpc-transport-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "rpc-transport-watchdog");
            t.setDaemon(true);
            return t;
        });
    }

    public ClientOptions options() {
        return options;
    }

    public CompletableFuture<JsonNode> sendAsync(Envelope envelope, ServiceAddress address) {
        return sendAsync(envelope, address, Optional.empty());
    }

    public CompletableFuture<JsonNode> sendAsync(Envelope envelope, ServiceAddress address,
                                                 Optional<Credential> credential) {
        Exchange exchange = new Exchange(
            Objects.requireNonNull(envelope, "envelope"),
            Objects.requireNonNull(address, "address"),
            Objects.requireNonNull(credential, "credential"),
            address.hostPort() + "#" + callCounter.incrementAndGet());
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        future.whenComplete((reply, error) -> {
            if (future.isCancelled()) {
                exchange.abort();
            }
        });
        try {
            workers.execute(() -> exchange.run(future));
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(new ConnectionException("Transport is closed", e));
        }
        return future;
    }

    public JsonNode send(Envelope envelope, ServiceAddress address) throws JsonRpcTransportException {
        return send(envelope, address, Optional.empty());
    }

    /**
     * Blocking variant of {@link #sendAsync(Envelope, ServiceAddress, Optional)}.
     */
    public JsonNode send(Envelope envelope, ServiceAddress address, Optional<Credential> credential)
        throws JsonRpcTransportException {
        CompletableFuture<JsonNode> future = sendAsync(envelope, address, credential);
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ResponseException("Interrupted while waiting for " + address, e);
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        }
    }

    @Override
    public void close() {
        workers.shutdown();
        watchdog.shutdownNow();
        try {
            if (!workers.awaitTermination(1, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static JsonRpcTransportException rethrow(Throwable cause) {
        if (cause instanceof JsonRpcTransportException transportException) {
            return transportException;
        }
        if (cause instanceof RuntimeException runtimeException) {
            throw runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        throw new IllegalStateException("Unexpected failure", cause);
    }

    private static void closeQuietly(Socket socket, String connectionId) {
        if (socket == null || socket.isClosed()) {
            return;
        }
        try {
            socket.close();
        } catch (IOException e) {
            LOGGER.debug("Error closing connection {}", connectionId, e);
        }
    }

    private static int millis(Duration duration) {
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, duration.toMillis()));
    }

    /**
     * One request/response pair on its own socket.
     */
    private final class Exchange {

        private final Envelope envelope;
        private final ServiceAddress address;
        private final Optional<Credential> credential;
        private final String connectionId;

        private volatile Socket socket;
        private volatile boolean aborted;
        private volatile boolean writeTimedOut;
        private volatile boolean readTimedOut;

        Exchange(Envelope envelope, ServiceAddress address, Optional<Credential> credential, String connectionId) {
            this.envelope = envelope;
            this.address = address;
            this.credential = credential;
            this.connectionId = connectionId;
        }

        void run(CompletableFuture<JsonNode> future) {
            if (future.isDone()) {
                return;
            }
            try {
                future.complete(execute());
            } catch (JsonRpcTransportException e) {
                if (aborted) {
                    LOGGER.debug("Call {} on {} abandoned: {}", envelope.method(), connectionId, e.getMessage());
                } else {
                    LOGGER.debug("Call {} on {} failed with {}: {}", envelope.method(), connectionId, e.kind(),
                        e.getMessage());
                }
                future.completeExceptionally(e);
            } catch (RuntimeException e) {
                LOGGER.warn("Call {} on {} failed unexpectedly", envelope.method(), connectionId, e);
                future.completeExceptionally(e);
            }
        }

        void abort() {
            aborted = true;
            closeQuietly(socket, connectionId);
        }

        private JsonNode execute() throws JsonRpcTransportException {
            String json = codec.encode(envelope);
            byte[] frame = HttpFrameCodec.encodeRequest(address, credential, options.userAgent(), json);

            Socket connection = connect();
            try {
                Wire.tx(connectionId, "POST " + address.requestTarget(), json);
                transmit(connection, frame);
                byte[] raw = receive(connection);
                HttpMessage reply = HttpFrameCodec.split(raw);
                Wire.rx(connectionId, reply.startLine(), reply.body());
                return codec.decode(reply.body());
            } finally {
                closeQuietly(connection, connectionId);
            }
        }

        private Socket connect() throws ConnectionException {
            Socket connection = new Socket();
            socket = connection;
            if (aborted) {
                closeQuietly(connection, connectionId);
            }
            try {
                int connectTimeout = options.timeout().map(SocketRpcTransport::millis).orElse(0);
                connection.connect(new InetSocketAddress(address.host(), address.port()), connectTimeout);
                connection.setTcpNoDelay(true);
                LOGGER.debug("Connected to {}", connectionId);
                return connection;
            } catch (SocketTimeoutException e) {
                closeQuietly(connection, connectionId);
                throw new ConnectionException("Timed out connecting to " + address.hostPort(), e);
            } catch (IOException e) {
                closeQuietly(connection, connectionId);
                throw new ConnectionException("Unable to connect to " + address.hostPort() + ": " + e.getMessage(),
                    e);
            }
        }

        private void transmit(Socket connection, byte[] frame) throws ConnectionException {
            ScheduledFuture<?> guard = closeAtDeadline(connection, () -> writeTimedOut = true);
            try {
                HttpFrameCodec.writeFrame(connection.getOutputStream(), frame);
            } catch (IOException e) {
                if (writeTimedOut) {
                    throw new ConnectionException("Timed out writing request to " + address.hostPort(), e);
                }
                throw new ConnectionException("Unable to write request to " + address.hostPort() + ": "
                    + e.getMessage(), e);
            } finally {
                cancel(guard);
            }
        }

        /**
         * Reads the whole reply within the timeout. {@code SO_TIMEOUT} bounds each read; the
         * watchdog bounds the phase as a whole, so a peer trickling bytes cannot extend it.
         */
        private byte[] receive(Socket connection) throws ResponseException {
            ScheduledFuture<?> guard = closeAtDeadline(connection, () -> readTimedOut = true);
            try {
                connection.setSoTimeout(options.timeout().map(SocketRpcTransport::millis).orElse(0));
                byte[] raw = HttpFrameCodec.readMessage(connection.getInputStream());
                if (readTimedOut) {
                    throw new ResponseException("Timed out reading response from " + address.hostPort());
                }
                return raw;
            } catch (ResponseException e) {
                throw e;
            } catch (SocketTimeoutException e) {
                throw new ResponseException("Timed out reading response from " + address.hostPort(), e);
            } catch (IOException e) {
                if (readTimedOut) {
                    throw new ResponseException("Timed out reading response from " + address.hostPort(), e);
                }
                throw new ResponseException("Unable to read response from " + address.hostPort() + ": "
                    + e.getMessage(), e);
            } finally {
                cancel(guard);
            }
        }

        private ScheduledFuture<?> closeAtDeadline(Socket connection, Runnable onTimeout) {
            Optional<Duration> timeout = options.timeout();
            if (timeout.isEmpty()) {
                return null;
            }
            return watchdog.schedule(() -> {
                onTimeout.run();
                closeQuietly(connection, connectionId);
            }, timeout.get().toMillis(), TimeUnit.MILLISECONDS);
        }

        private void cancel(ScheduledFuture<?> guard) {
            if (guard != null) {
                guard.cancel(false);
            }
        }
    }
}
