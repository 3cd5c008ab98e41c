package dev.jsonrpc.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

class JsonRpcCodecTest {

    private final JsonRpcCodec codec = new JsonRpcCodec();

    @Test
    void decodesReplyBody() throws Exception {
        JsonNode node = codec.decode("{\"jsonrpc\":\"2.0\",\"result\":8.75,\"error\":null,\"id\":0}");

        assertEquals(8.75, node.get("result").asDouble());
    }

    @Test
    void malformedJsonIsSerializationError() {
        SerializationException e = assertThrows(SerializationException.class, () -> codec.decode("{\"jsonrpc\":"));

        assertEquals(TransportErrorKind.SERIALIZATION, e.kind());
        assertNotNull(e.getCause());
    }

    @Test
    void trailingContentIsSerializationError() {
        assertThrows(SerializationException.class, () -> codec.decode("{\"result\":1} garbage"));
        assertThrows(SerializationException.class, () -> codec.decode("{\"result\":1}{\"result\":2}"));
        assertThrows(SerializationException.class,
            () -> codec.decode("{\"method\":\"mul\",\"id\":1} 2", Envelope.class));
    }

    @Test
    void surroundingWhitespaceIsAccepted() throws Exception {
        assertEquals(1, codec.decode("  {\"result\":1}\r\n").get("result").asInt());
    }

    @Test
    void emptyBodyIsSerializationError() {
        assertThrows(SerializationException.class, () -> codec.decode(""));
        assertThrows(SerializationException.class, () -> codec.decode("   "));
    }

    @Test
    void typedDecodeFailureIsSerializationError() {
        assertThrows(SerializationException.class, () -> codec.decode("{\"method\":\"\",\"id\":1}", Envelope.class));
    }
}
