package dev.jsonrpc.transport;

/**
 * Classification of a failed round trip.
 */
public enum TransportErrorKind {
    /** The socket could not be opened or the request could not be written. */
    CONNECTION,
    /** The envelope could not be encoded, or the reply body could not be decoded. */
    SERIALIZATION,
    /** Reading the reply failed after the connection was established. */
    RESPONSE,
    /** Bytes arrived but they do not contain a header/body separator. */
    INVALID_RESPONSE
}
