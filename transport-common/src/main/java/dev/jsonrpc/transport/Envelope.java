package dev.jsonrpc.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.math.BigInteger;
import java.util.Objects;

/**
 * JSON-RPC 2.0 request object prior to serialization. The protocol version is fixed and is
 * exposed only through {@link #jsonrpc()}; callers choose the method, the params and the
 * correlation id.
 *
 * <p>The id keeps its JSON type: a {@link String} serializes as a JSON string, an integral
 * {@link Number} as a JSON integer.
 */
@JsonPropertyOrder({"jsonrpc", "method", "params", "id"})
@JsonIgnoreProperties(value = "jsonrpc", allowGetters = true)
public record Envelope(String method, Object params, Object id) {

    public static final String JSONRPC_VERSION = "2.0";

    public Envelope {
        Objects.requireNonNull(method, "method");
        if (method.isEmpty()) {
            throw new IllegalArgumentException("method must not be empty");
        }
        Objects.requireNonNull(id, "id");
        if (!(id instanceof String) && !isIntegral(id)) {
            throw new IllegalArgumentException("id must be a string or an integer: " + id.getClass().getName());
        }
        id = normalizeId(id);
    }

    public static Envelope build(String method, Object params, String id) {
        return new Envelope(method, params, id);
    }

    public static Envelope build(String method, Object params, long id) {
        return new Envelope(method, params, id);
    }

    @JsonProperty("jsonrpc")
    public String jsonrpc() {
        return JSONRPC_VERSION;
    }

    /**
     * Integral ids are held as {@link Long} whatever width they arrived in, so an envelope decoded
     * from JSON equals the one it was encoded from. Values beyond {@code long} stay {@link BigInteger}.
     */
    private static Object normalizeId(Object id) {
        if (id instanceof Integer || id instanceof Short || id instanceof Byte) {
            return ((Number) id).longValue();
        }
        if (id instanceof BigInteger big && big.bitLength() < Long.SIZE) {
            return big.longValue();
        }
        return id;
    }

    private static boolean isIntegral(Object id) {
        return id instanceof Long || id instanceof Integer || id instanceof Short || id instanceof Byte
            || id instanceof BigInteger;
    }
}
