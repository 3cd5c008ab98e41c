package dev.jsonrpc.transport;

/**
 * JSON encoding of a request or decoding of a reply body failed.
 */
public class SerializationException extends JsonRpcTransportException {

    public SerializationException(String message) {
        super(TransportErrorKind.SERIALIZATION, message);
    }

    public SerializationException(String message, Throwable cause) {
        super(TransportErrorKind.SERIALIZATION, message, cause);
    }
}
