package dev.jsonrpc.transport;

import java.io.IOException;
import java.util.Objects;

/**
 * Base class of every classified transport failure. Subclasses fix the {@link TransportErrorKind};
 * callers that only need the classification can switch on {@link #kind()}.
 *
 * @see ConnectionException
 * @see SerializationException
 * @see ResponseException
 * @see InvalidResponseException
 */
public abstract class JsonRpcTransportException extends IOException {

    private final TransportErrorKind kind;

    protected JsonRpcTransportException(TransportErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    protected JsonRpcTransportException(TransportErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public TransportErrorKind kind() {
        return kind;
    }
}
