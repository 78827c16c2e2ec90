package com.trueform.client.rpc;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.trueform.client.errors.ProtocolException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RpcCodecTest {

    private final RpcCodec codec = new RpcCodec();

    @Test
    void encode_writesEnvelope() throws Exception {
        String text = codec.encode(JsonRpcMessage.Request.create(3, "pool.query", List.of(List.of())));
        JsonNode tree = codec.mapper().readTree(text);

        assertEquals("2.0", tree.get("jsonrpc").asText());
        assertEquals("pool.query", tree.get("method").asText());
        assertEquals(3, tree.get("id").asLong());
        assertTrue(tree.get("params").isArray());
    }

    @Test
    void encode_omitsNullParams() throws Exception {
        String text = codec.encode(JsonRpcMessage.Request.create(1, "system.info", null));

        assertFalse(text.contains("params"));
    }

    @Test
    void request_survivesEncodeAndDecode() throws Exception {
        List<Object> params = List.of(List.of(List.of("name", "=", "tank")), Map.of("limit", 1));
        JsonRpcMessage.Request request = JsonRpcMessage.Request.create(8, "pool.dataset.query", params);

        JsonRpcMessage.Request decoded = codec.mapper().readValue(codec.encode(request), JsonRpcMessage.Request.class);

        assertEquals("pool.dataset.query", decoded.getMethod());
        assertEquals(8L, decoded.getId());
        assertEquals(params, decoded.getParams());
    }

    @Test
    void decodeResponse_ignoresUnknownFields() throws Exception {
        JsonRpcMessage.Response response = codec.decodeResponse(
                "{\"jsonrpc\":\"2.0\",\"id\":5,\"result\":{\"name\":\"tank\"},\"extra\":true}");

        assertEquals(5L, response.getId());
        assertFalse(response.hasError());
        assertEquals("tank", response.getResult().get("name").asText());
    }

    @Test
    void decodeResponse_readsErrorMember() throws Exception {
        JsonRpcMessage.Response response = codec.decodeResponse(
                "{\"jsonrpc\":\"2.0\",\"id\":6,\"error\":{\"code\":-32602,\"message\":\"Invalid params\","
                        + "\"data\":{\"reason\":\"[ENOENT] does not exist\"}}}");

        assertTrue(response.hasError());
        assertEquals(JsonRpcMessage.INVALID_PARAMS, response.getError().getCode());
        assertEquals("Invalid params", response.getError().getMessage());
        assertTrue(response.getError().getData().isObject());
    }

    @Test
    void malformedFrame_isProtocolError() {
        assertThrows(ProtocolException.class, () -> codec.decodeResponse("{not json"));
        assertThrows(ProtocolException.class, () -> codec.decodeResponse("[1,2,3]"));
    }

    @Test
    void convert_nullAndAbsentResults() throws Exception {
        assertNull(codec.convert(null, codec.type(String.class)));
        assertNull(codec.convert(codec.mapper().nullNode(), codec.type(Map.class)));
        assertNull(codec.convert(codec.toTree("ignored"), codec.type(Void.class)));
    }

    @Test
    void convert_toGenericType() throws Exception {
        JsonNode result = codec.mapper().readTree("[{\"id\":1,\"name\":\"tank\"},{\"id\":2,\"name\":\"boot-pool\"}]");

        List<Map<String, Object>> pools = codec.convert(result, codec.type(new TypeReference<List<Map<String, Object>>>() {
        }));

        assertEquals(2, pools.size());
        assertEquals("boot-pool", pools.get(1).get("name"));
    }

    @Test
    void convert_mismatchedShape_isProtocolError() {
        assertThrows(ProtocolException.class,
                () -> codec.convert(codec.toTree("not a number"), codec.type(Integer.class)));
    }

    @Test
    void errorResponse_encodesWithoutResult() throws Exception {
        String text = codec.mapper().writeValueAsString(JsonRpcMessage.Response.error(4, JsonRpcMessage.VALIDATION,
                "Validation error", null));

        assertFalse(text.contains("result"));
        assertTrue(text.contains("\"code\":4"));
    }
}
