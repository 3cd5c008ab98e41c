package dev.jsonrpc.transport;

/**
 * Reading the reply failed after a successful connect and write.
 */
public class ResponseException extends JsonRpcTransportException {

    public ResponseException(String message) {
        super(TransportErrorKind.RESPONSE, message);
    }

    public ResponseException(String message, Throwable cause) {
        super(TransportErrorKind.RESPONSE, message, cause);
    }
}
