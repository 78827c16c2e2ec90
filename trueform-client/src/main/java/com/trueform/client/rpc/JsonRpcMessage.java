package com.trueform.client.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON-RPC 2.0 envelopes exchanged with the TrueNAS {@code /api/current}
 * endpoint.
 */
public final class JsonRpcMessage {

    public static final String VERSION = "2.0";

    private JsonRpcMessage() {
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Request {
        private String jsonrpc;
        private String method;
        private Object params;
        private Long id;

        public static Request create(long id, String method, Object params) {
            return Request.builder()
                    .jsonrpc(VERSION)
                    .method(method)
                    .params(params)
                    .id(id)
                    .build();
        }
    }

    /**
     * A reply to a {@link Request}. Server-initiated notifications decode to a
     * response without an id.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Response {
        private String jsonrpc;
        private JsonNode result;
        private RpcError error;
        private Long id;

        public static Response success(long id, JsonNode result) {
            return Response.builder()
                    .jsonrpc(VERSION)
                    .result(result)
                    .id(id)
                    .build();
        }

        public static Response error(long id, int code, String message, JsonNode data) {
            return Response.builder()
                    .jsonrpc(VERSION)
                    .error(new RpcError(code, message, data))
                    .id(id)
                    .build();
        }

        public boolean hasError() {
            return error != null;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RpcError {
        private int code;
        private String message;
        private JsonNode data;
    }

    // Standard error codes
    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;

    // TrueNAS application error codes
    public static final int NOT_AUTHENTICATED = 1;
    public static final int NOT_AUTHORIZED = 2;
    public static final int NOT_FOUND = 3;
    public static final int VALIDATION = 4;
}
