package dev.jsonrpc.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view over a decoded JSON-RPC 2.0 reply. The transport hands back the raw tree; this
 * view is for callers that want typed access to {@code result} and {@code error}.
 */
public final class JsonRpcResponse {

    private final JsonNode node;

    private JsonRpcResponse(JsonNode node) {
        this.node = node;
    }

    public static JsonRpcResponse from(JsonNode node) {
        return new JsonRpcResponse(Objects.requireNonNull(node, "node"));
    }

    public String jsonrpc() {
        return node.path("jsonrpc").asText(null);
    }

    /**
     * The {@code result} member; JSON {@code null} when absent.
     */
    public JsonNode result() {
        JsonNode result = node.get("result");
        return result == null ? NullNode.getInstance() : result;
    }

    public Optional<JsonRpcError> error() {
        JsonNode error = node.get("error");
        if (error == null || error.isNull()) {
            return Optional.empty();
        }
        JsonNode data = error.get("data");
        return Optional.of(new JsonRpcError(error.path("code").asInt(), error.path("message").asText(null), data));
    }

    public boolean isError() {
        return error().isPresent();
    }

    public JsonNode id() {
        JsonNode id = node.get("id");
        return id == null ? NullNode.getInstance() : id;
    }

    public JsonNode raw() {
        return node;
    }

    @Override
    public String toString() {
        return node.toString();
    }
}
