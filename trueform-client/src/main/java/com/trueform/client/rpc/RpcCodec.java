package com.trueform.client.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trueform.client.errors.ProtocolException;

/**
 * Serialization of {@link JsonRpcMessage} envelopes and conversion of raw
 * results into caller types.
 */
public class RpcCodec {

    private final ObjectMapper mapper;

    public RpcCodec() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public RpcCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public String encode(JsonRpcMessage.Request request) throws ProtocolException {
        try {
            return mapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("failed to encode request " + request.getMethod(), e);
        }
    }

    public JsonRpcMessage.Response decodeResponse(String text) throws ProtocolException {
        try {
            return mapper.readValue(text, JsonRpcMessage.Response.class);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("malformed response frame", e);
        }
    }

    public JavaType type(Class<?> type) {
        return mapper.constructType(type);
    }

    public JavaType type(TypeReference<?> type) {
        return mapper.constructType(type);
    }

    /**
     * Convert a raw result into {@code type}. Absent and JSON-null results
     * convert to {@code null}.
     */
    public <T> T convert(JsonNode result, JavaType type) throws ProtocolException {
        if (result == null || result.isNull() || type == null || type.hasRawClass(Void.class)) {
            return null;
        }
        try {
            return mapper.convertValue(result, type);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("failed to decode result as " + type.toCanonical(), e);
        }
    }

    public JsonNode toTree(Object value) {
        return mapper.valueToTree(value);
    }
}
