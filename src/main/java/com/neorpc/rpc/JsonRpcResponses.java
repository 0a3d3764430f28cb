package com.neorpc.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Reads NEO JSON-RPC response bodies: checks the error envelope, then maps {@code result}.
 * An error object only counts when its message is non-empty.
 */
public class JsonRpcResponses {

    private final ObjectMapper objectMapper;

    public JsonRpcResponses(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parsed {@code result} node; may be a missing or null node.
     *
     * @throws JsonRpcErrorException if the envelope carries an error message
     * @throws RpcException          if the body is empty or not JSON
     */
    public JsonNode result(String method, String body) {
        if (body == null || body.isBlank()) {
            throw new RpcException(method + " returned an empty body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + method + " response", e);
        }
        JsonNode error = root.path("error");
        String message = error.path("message").asText("");
        if (!message.isEmpty()) {
            throw new JsonRpcErrorException(error.path("code").asLong(), message);
        }
        return root.path("result");
    }

    public <T> T read(String method, String body, Class<T> type) {
        return read(method, body, objectMapper.constructType(type));
    }

    public <T> T read(String method, String body, TypeReference<T> type) {
        return read(method, body, objectMapper.constructType(type));
    }

    /**
     * For methods where a null result is a normal answer (spent output, absent storage key).
     */
    public <T> Optional<T> readOptional(String method, String body, Class<T> type) {
        JsonNode result = result(method, body);
        if (result.isMissingNode() || result.isNull()) {
            return Optional.empty();
        }
        return Optional.of(map(method, result, objectMapper.constructType(type)));
    }

    private <T> T read(String method, String body, JavaType type) {
        JsonNode result = result(method, body);
        if (result.isMissingNode() || result.isNull()) {
            throw new RpcException(method + " returned no result");
        }
        return map(method, result, type);
    }

    private <T> T map(String method, JsonNode result, JavaType type) {
        try {
            return objectMapper.treeToValue(result, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new RpcException("Failed to map " + method + " result", e);
        }
    }
}
