package dev.jsonrpc.transport;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * Codec for the minimal HTTP/1.1 framing used on the wire: a start line, a fixed set of headers,
 * a blank line and a UTF-8 JSON body. No chunked encoding, no keep-alive.
 */
public final class HttpFrameCodec {

    public static final String CRLF = "\r\n";
    public static final String HEADER_SEPARATOR = "\r\n\r\n";
    public static final String MEDIA_TYPE = "application/json";
    public static final String HTTP_VERSION = "HTTP/1.1";
    public static final int MAX_HEAD_BYTES = 64 * 1024;

    private static final byte[] SEPARATOR_BYTES = HEADER_SEPARATOR.getBytes(StandardCharsets.US_ASCII);
    private static final int READ_BUFFER_SIZE = 4 * 1024;
    private static final int MAX_MESSAGE_BYTES = Integer.MAX_VALUE - 8;

    private HttpFrameCodec() {
    }

    /**
     * Frames a JSON body as a {@code POST} request. Headers are emitted in a fixed order; the
     * credential header is present only when a credential is given.
     */
    public static byte[] encodeRequest(ServiceAddress address, Optional<Credential> credential, String userAgent,
                                       String json) {
        byte[] payload = json.getBytes(StandardCharsets.UTF_8);
        StringBuilder head = new StringBuilder(256);
        head.append("POST ").append(address.requestTarget()).append(' ').append(HTTP_VERSION).append(CRLF);
        head.append("Host: ").append(address.hostPort()).append(CRLF);
        head.append("Content-Type: ").append(MEDIA_TYPE).append(CRLF);
        head.append("User-Agent: ").append(userAgent).append(CRLF);
        head.append("Accept: ").append(MEDIA_TYPE).append(CRLF);
        credential.ifPresent(c -> head.append(c.asHeader()).append(CRLF));
        head.append("Content-Length: ").append(payload.length).append(CRLF);
        head.append(CRLF);
        return concat(head.toString().getBytes(StandardCharsets.UTF_8), payload);
    }

    /**
     * Frames a JSON body as a response. The connection is always announced as closing.
     */
    public static byte[] encodeResponse(int status, String reason, String json) {
        byte[] payload = json.getBytes(StandardCharsets.UTF_8);
        String head = HTTP_VERSION + " " + status + " " + reason + CRLF
            + "Content-Type: " + MEDIA_TYPE + CRLF
            + "Content-Length: " + payload.length + CRLF
            + "Connection: close" + CRLF
            + CRLF;
        return concat(head.getBytes(StandardCharsets.US_ASCII), payload);
    }

    public static void writeFrame(OutputStream out, byte[] frame) throws IOException {
        out.write(frame);
        out.flush();
    }

    /**
     * Reads a message to completion: until end of stream, or until the body announced by a
     * {@code Content-Length} header has fully arrived. The header block may not exceed
     * {@link #MAX_HEAD_BYTES}.
     */
    public static byte[] readMessage(InputStream in) throws IOException {
        byte[] data = new byte[READ_BUFFER_SIZE];
        int size = 0;
        int separator = -1;
        long expectedTotal = Long.MAX_VALUE;
        while (size < expectedTotal) {
            if (size == data.length) {
                data = Arrays.copyOf(data, grow(data.length));
            }
            int read = in.read(data, size, data.length - size);
            if (read == -1) {
                break;
            }
            int scanFrom = Math.max(0, size - (SEPARATOR_BYTES.length - 1));
            size += read;
            if (separator < 0) {
                separator = indexOf(data, scanFrom, size, SEPARATOR_BYTES);
                if (separator > MAX_HEAD_BYTES || (separator < 0 && size > MAX_HEAD_BYTES)) {
                    throw new ResponseException("Header block exceeds " + MAX_HEAD_BYTES + " bytes");
                }
                if (separator < 0) {
                    continue;
                }
                expectedTotal = expectedTotal(data, separator);
            }
        }
        return Arrays.copyOf(data, size);
    }

    /**
     * Splits raw bytes on the first blank line. Malformed UTF-8 is replaced rather than rejected;
     * the body is trimmed.
     */
    public static HttpMessage split(byte[] raw) throws InvalidResponseException {
        String text = new String(raw, StandardCharsets.UTF_8);
        int separator = text.indexOf(HEADER_SEPARATOR);
        if (separator < 0) {
            throw new InvalidResponseException("No header/body separator in " + raw.length + " received bytes",
                raw.length);
        }
        return new HttpMessage(text.substring(0, separator),
            text.substring(separator + HEADER_SEPARATOR.length()).trim());
    }

    /**
     * Total message size implied by the header block ending at {@code separator}, or
     * {@link Long#MAX_VALUE} when no usable {@code Content-Length} is present.
     */
    private static long expectedTotal(byte[] data, int separator) {
        String head = new String(data, 0, separator, StandardCharsets.ISO_8859_1);
        Optional<String> contentLength = HttpMessage.header(head, "Content-Length");
        if (contentLength.isEmpty()) {
            return Long.MAX_VALUE; // no length announced, read until the peer closes
        }
        try {
            long length = Long.parseLong(contentLength.get());
            return length < 0 ? Long.MAX_VALUE : separator + (long) SEPARATOR_BYTES.length + length;
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }

    private static int indexOf(byte[] data, int from, int to, byte[] pattern) {
        outer:
        for (int i = from; i <= to - pattern.length; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (data[i + j] != pattern[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    private static int grow(int capacity) throws ResponseException {
        if (capacity >= MAX_MESSAGE_BYTES) {
            throw new ResponseException("Message exceeds " + MAX_MESSAGE_BYTES + " bytes");
        }
        return (int) Math.min(MAX_MESSAGE_BYTES, capacity * 2L);
    }

    private static byte[] concat(byte[] head, byte[] payload) {
        byte[] frame = new byte[head.length + payload.length];
        System.arraycopy(head, 0, frame, 0, head.length);
        System.arraycopy(payload, 0, frame, head.length, payload.length);
        return frame;
    }
}
