package dev.jsonrpc.transport;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class HttpFrameCodecTest {

    private static final ServiceAddress ADDRESS = new ServiceAddress("localhost:8082/", "/math-api");

    @Test
    void framesRequestWithoutCredential() {
        byte[] frame = HttpFrameCodec.encodeRequest(ADDRESS, Optional.empty(), "jsonrpc_v2_client", "{}");

        assertEquals("POST /math-api HTTP/1.1\r\n"
                + "Host: localhost:8082\r\n"
                + "Content-Type: application/json\r\n"
                + "User-Agent: jsonrpc_v2_client\r\n"
                + "Accept: application/json\r\n"
                + "Content-Length: 2\r\n"
                + "\r\n"
                + "{}",
            new String(frame, StandardCharsets.UTF_8));
    }

    @Test
    void placesCredentialHeaderBeforeContentLength() {
        byte[] frame = HttpFrameCodec.encodeRequest(ADDRESS, Optional.of(new Credential("API-KEY", "abcdef12345")),
            "test-agent", "[1]");

        assertEquals("POST /math-api HTTP/1.1\r\n"
                + "Host: localhost:8082\r\n"
                + "Content-Type: application/json\r\n"
                + "User-Agent: test-agent\r\n"
                + "Accept: application/json\r\n"
                + "API-KEY: abcdef12345\r\n"
                + "Content-Length: 3\r\n"
                + "\r\n"
                + "[1]",
            new String(frame, StandardCharsets.UTF_8));
    }

    @Test
    void contentLengthCountsUtf8Bytes() {
        String json = "{\"name\":\"żółw €\"}";
        byte[] frame = HttpFrameCodec.encodeRequest(ADDRESS, Optional.empty(), "ua", json);
        String text = new String(frame, StandardCharsets.UTF_8);
        int expected = json.getBytes(StandardCharsets.UTF_8).length;

        assertTrue(expected > json.length());
        assertTrue(text.contains("Content-Length: " + expected + "\r\n"));
        assertTrue(text.endsWith("\r\n\r\n" + json));
    }

    @Test
    void framesResponseWithConnectionClose() {
        String text = new String(HttpFrameCodec.encodeResponse(200, "OK", "{\"a\":1}"), StandardCharsets.UTF_8);

        assertEquals("HTTP/1.1 200 OK\r\n"
                + "Content-Type: application/json\r\n"
                + "Content-Length: 7\r\n"
                + "Connection: close\r\n"
                + "\r\n"
                + "{\"a\":1}",
            text);
    }

    @Test
    void splitsOnFirstBlankLine() throws Exception {
        byte[] raw = "HTTP/1.1 200 OK\r\nContent-Type: application/json\r\n\r\n{\"text\":\"a\\r\\n\\r\\nb\"}\r\n\r\n"
            .getBytes(StandardCharsets.UTF_8);

        HttpMessage message = HttpFrameCodec.split(raw);

        assertEquals("HTTP/1.1 200 OK\r\nContent-Type: application/json", message.head());
        assertEquals("{\"text\":\"a\\r\\n\\r\\nb\"}", message.body());
        assertEquals("HTTP/1.1 200 OK", message.startLine());
        assertEquals(OptionalInt.of(200), message.statusCode());
        assertEquals(Optional.of("application/json"), message.header("content-type"));
    }

    @Test
    void missingSeparatorIsInvalidResponse() {
        byte[] raw = "HTTP/1.1 200 OK\r\nContent-Type: application/json\r\n{}".getBytes(StandardCharsets.UTF_8);

        InvalidResponseException e = assertThrows(InvalidResponseException.class, () -> HttpFrameCodec.split(raw));
        assertEquals(TransportErrorKind.INVALID_RESPONSE, e.kind());
        assertEquals(raw.length, e.receivedBytes());
    }

    @Test
    void emptyInputIsInvalidResponse() {
        assertThrows(InvalidResponseException.class, () -> HttpFrameCodec.split(new byte[0]));
    }

    @Test
    void replacesMalformedUtf8() throws Exception {
        ByteArrayOutputStream raw = new ByteArrayOutputStream();
        raw.write("HTTP/1.1 200 OK\r\nX-Junk: ".getBytes(StandardCharsets.US_ASCII));
        raw.write(new byte[] {(byte) 0xC3, (byte) 0x28});
        raw.write("\r\n\r\n{}".getBytes(StandardCharsets.US_ASCII));

        HttpMessage message = HttpFrameCodec.split(raw.toByteArray());

        assertEquals("{}", message.body());
        assertTrue(message.head().contains("\uFFFD"));
    }

    @Test
    void statusCodeAbsentForRequestLine() {
        HttpMessage message = new HttpMessage("POST /math-api HTTP/1.1\r\nHost: x", "{}");

        assertFalse(message.statusCode().isPresent());
        assertEquals(Optional.empty(), message.header("Content-Length"));
    }

    @Test
    void readsUntilEndOfStreamWithoutContentLength() throws Exception {
        byte[] raw = "HTTP/1.1 200 OK\r\n\r\n{\"result\":1}".getBytes(StandardCharsets.UTF_8);

        assertArrayEquals(raw, HttpFrameCodec.readMessage(new ByteArrayInputStream(raw)));
    }

    @Test
    void stopsReadingOnceContentLengthArrived() throws Exception {
        byte[] head = "HTTP/1.1 200 OK\r\nContent-Length: 12\r\n\r\n".getBytes(StandardCharsets.US_ASCII);
        byte[] body = "{\"result\":1}".getBytes(StandardCharsets.US_ASCII);
        InputStream in = new ChunkedStream(head, body);

        byte[] read = HttpFrameCodec.readMessage(in);

        assertEquals(head.length + body.length, read.length);
        assertEquals("{\"result\":1}", HttpFrameCodec.split(read).body());
    }

    @Test
    void findsSeparatorSpanningReads() throws Exception {
        byte[] first = "HTTP/1.1 200 OK\r\nContent-Length: 2\r\n\r".getBytes(StandardCharsets.US_ASCII);
        byte[] second = "\n{}".getBytes(StandardCharsets.US_ASCII);

        byte[] read = HttpFrameCodec.readMessage(new ChunkedStream(first, second));

        assertEquals("{}", HttpFrameCodec.split(read).body());
    }

    @Test
    void oversizedHeaderBlockIsResponseError() {
        byte[] head = ("HTTP/1.1 200 OK\r\nX-Filler: " + "a".repeat(HttpFrameCodec.MAX_HEAD_BYTES))
            .getBytes(StandardCharsets.US_ASCII);

        ResponseException e = assertThrows(ResponseException.class,
            () -> HttpFrameCodec.readMessage(new ByteArrayInputStream(head)));
        assertEquals(TransportErrorKind.RESPONSE, e.kind());
    }

    @Test
    void hugeContentLengthReadsUntilEndOfStream() throws Exception {
        byte[] raw = ("HTTP/1.1 200 OK\r\nContent-Length: " + Integer.MAX_VALUE + "\r\n\r\n{\"result\":1}")
            .getBytes(StandardCharsets.US_ASCII);

        assertArrayEquals(raw, HttpFrameCodec.readMessage(new ChunkedStream(raw, new byte[0])));
    }

    @Test
    void writesWholeFrame() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] frame = HttpFrameCodec.encodeResponse(200, "OK", "{}");

        HttpFrameCodec.writeFrame(out, frame);

        assertArrayEquals(frame, out.toByteArray());
    }

    /**
     * Hands out the given chunks one read at a time, then fails as a peer that never closes would.
     * An empty chunk reads as end of stream.
     */
    private static final class ChunkedStream extends InputStream {

        private final byte[][] chunks;
        private int next;

        ChunkedStream(byte[]... chunks) {
            this.chunks = chunks;
        }

        @Override
        public int read() {
            throw new UnsupportedOperationException();
        }

        @Override
        public int read(byte[] buffer, int offset, int length) throws IOException {
            if (next >= chunks.length) {
                throw new IOException("read past the announced body");
            }
            byte[] chunk = chunks[next++];
            if (chunk.length == 0) {
                return -1;
            }
            System.arraycopy(chunk, 0, buffer, offset, chunk.length);
            return chunk.length;
        }
    }
}
