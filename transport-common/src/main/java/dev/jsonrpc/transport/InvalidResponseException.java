package dev.jsonrpc.transport;

/**
 * The peer sent bytes that do not contain the {@code \r\n\r\n} header/body separator, typically a
 * truncated or non-HTTP reply.
 */
public class InvalidResponseException extends JsonRpcTransportException {

    private final int receivedBytes;

    public InvalidResponseException(String message, int receivedBytes) {
        super(TransportErrorKind.INVALID_RESPONSE, message);
        this.receivedBytes = receivedBytes;
    }

    public int receivedBytes() {
        return receivedBytes;
    }
}
