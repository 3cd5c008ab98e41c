package dev.jsonrpc.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import java.util.Objects;

/**
 * Jackson-backed encoding of envelopes and decoding of reply bodies. Both directions report
 * failures as {@link SerializationException}. A body must consist of exactly one JSON value;
 * anything after it is a decoding failure.
 */
public class JsonRpcCodec {

    private final ObjectMapper mapper;
    private final ObjectReader reader;

    public JsonRpcCodec() {
        this(new ObjectMapper());
    }

    public JsonRpcCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.reader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public String encode(Object value) throws SerializationException {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Unable to encode " + value.getClass().getSimpleName() + ": "
                + e.getOriginalMessage(), e);
        }
    }

    public JsonNode decode(String text) throws SerializationException {
        JsonNode node;
        try {
            node = reader.readTree(text);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Unable to decode JSON body: " + e.getOriginalMessage(), e);
        }
        if (node == null || node.isMissingNode()) {
            throw new SerializationException("Empty JSON body");
        }
        return node;
    }

    public <T> T decode(String text, Class<T> type) throws SerializationException {
        try {
            return reader.forType(type).readValue(text);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Unable to decode " + type.getSimpleName() + ": "
                + e.getOriginalMessage(), e);
        }
    }
}
