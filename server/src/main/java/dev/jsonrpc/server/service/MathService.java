package dev.jsonrpc.server.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.jsonrpc.transport.Envelope;
import dev.jsonrpc.transport.JsonRpcError;
import java.util.function.DoubleBinaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Arithmetic over two numeric params. Every call produces a reply object carrying both
 * {@code result} and {@code error}, one of them {@code null}; the request id is echoed verbatim.
 */
public class MathService {

    private static final Logger LOGGER = LoggerFactory.getLogger(MathService.class);

    private final ObjectMapper mapper;
    private final ObjectReader reader;

    public MathService(ObjectMapper mapper) {
        this.mapper = mapper;
        this.reader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ObjectNode handle(String body) {
        JsonNode request;
        try {
            request = reader.readTree(body);
        } catch (JsonProcessingException e) {
            LOGGER.debug("Unparseable request body: {}", e.getOriginalMessage());
            return error(null, JsonRpcError.parseError());
        }
        if (request == null || !request.isObject()) {
            return error(null, JsonRpcError.invalidRequest());
        }
        JsonNode id = request.get("id");
        if (!Envelope.JSONRPC_VERSION.equals(request.path("jsonrpc").asText(null))
            || !request.path("method").isTextual()) {
            return error(id, JsonRpcError.invalidRequest());
        }
        String method = request.get("method").asText();
        return switch (method) {
            case "add" -> apply(id, request.path("params"), (a, b) -> a + b);
            case "sub" -> apply(id, request.path("params"), (a, b) -> a - b);
            case "mul" -> apply(id, request.path("params"), (a, b) -> a * b);
            case "div" -> divide(id, request.path("params"));
            default -> {
                LOGGER.debug("Unknown method {}", method);
                yield error(id, JsonRpcError.methodNotFound());
            }
        };
    }

    public ObjectNode error(JsonNode id, JsonRpcError error) {
        ObjectNode response = mapper.createObjectNode();
        response.put("jsonrpc", Envelope.JSONRPC_VERSION);
        response.putNull("result");
        ObjectNode errorNode = response.putObject("error");
        errorNode.put("code", error.code());
        errorNode.put("message", error.message());
        if (error.data() != null) {
            errorNode.set("data", error.data());
        }
        setId(response, id);
        return response;
    }

    private ObjectNode divide(JsonNode id, JsonNode params) {
        if (hasTwoNumbers(params) && params.get(1).asDouble() == 0.0) {
            return error(id, new JsonRpcError(JsonRpcError.INVALID_PARAMS, "Invalid params",
                mapper.getNodeFactory().textNode("division by zero")));
        }
        return apply(id, params, (a, b) -> a / b);
    }

    private ObjectNode apply(JsonNode id, JsonNode params, DoubleBinaryOperator operator) {
        if (!hasTwoNumbers(params)) {
            return error(id, JsonRpcError.invalidParams());
        }
        ObjectNode response = mapper.createObjectNode();
        response.put("jsonrpc", Envelope.JSONRPC_VERSION);
        response.put("result", operator.applyAsDouble(params.get(0).asDouble(), params.get(1).asDouble()));
        response.putNull("error");
        setId(response, id);
        return response;
    }

    private static boolean hasTwoNumbers(JsonNode params) {
        return params.isArray() && params.size() == 2 && params.get(0).isNumber() && params.get(1).isNumber();
    }

    private static void setId(ObjectNode response, JsonNode id) {
        if (id == null) {
            response.putNull("id");
        } else {
            response.set("id", id);
        }
    }
}
