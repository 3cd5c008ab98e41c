package dev.jsonrpc.transport;

/**
 * Socket could not be opened, or the request could not be written to it.
 */
public class ConnectionException extends JsonRpcTransportException {

    public ConnectionException(String message) {
        super(TransportErrorKind.CONNECTION, message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(TransportErrorKind.CONNECTION, message, cause);
    }
}
