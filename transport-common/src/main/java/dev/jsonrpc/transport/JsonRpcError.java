package dev.jsonrpc.transport;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The {@code error} member of a JSON-RPC 2.0 reply.
 */
public record JsonRpcError(int code, String message, JsonNode data) {

    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;

    public static JsonRpcError parseError() {
        return new JsonRpcError(PARSE_ERROR, "Parse error", null);
    }

    public static JsonRpcError invalidRequest() {
        return new JsonRpcError(INVALID_REQUEST, "Invalid Request", null);
    }

    public static JsonRpcError methodNotFound() {
        return new JsonRpcError(METHOD_NOT_FOUND, "Method not found", null);
    }

    public static JsonRpcError invalidParams() {
        return new JsonRpcError(INVALID_PARAMS, "Invalid params", null);
    }

    public static JsonRpcError internalError() {
        return new JsonRpcError(INTERNAL_ERROR, "Internal error", null);
    }
}
