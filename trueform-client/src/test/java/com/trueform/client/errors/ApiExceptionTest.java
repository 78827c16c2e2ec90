package com.trueform.client.errors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trueform.client.rpc.JsonRpcMessage;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApiExceptionTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void message_includesDetailsWhenPresent() {
        assertEquals("TrueNAS API error 4: Validation error (name is required)",
                new ApiException(4, "Validation error", "name is required").getMessage());
        assertEquals("TrueNAS API error 3: Not found",
                new ApiException(3, "Not found", "").getMessage());
        assertEquals("", new ApiException(3, "Not found", null).getDetails());
    }

    @Test
    void from_keepsRawDataText() throws Exception {
        JsonRpcMessage.RpcError wire = new JsonRpcMessage.RpcError(JsonRpcMessage.INVALID_PARAMS, "Invalid params",
                mapper.readTree("{\"errname\":\"InstanceNotFound\"}"));

        ApiException error = ApiException.from(wire);

        assertEquals(-32602, error.getCode());
        assertEquals("{\"errname\":\"InstanceNotFound\"}", error.getDetails());
        assertTrue(error.isNotFound());
    }

    @Test
    void from_withoutData() {
        ApiException error = ApiException.from(new JsonRpcMessage.RpcError(1, "Not authenticated", null));

        assertEquals("", error.getDetails());
        assertEquals("TrueNAS API error 1: Not authenticated", error.getMessage());
    }

    @Test
    void classification() {
        assertTrue(new ApiException(3, "Not found", "").isNotFound());
        assertTrue(new ApiException(-32602, "Invalid params", "dataset tank/x does not exist").isNotFound());
        assertFalse(new ApiException(-32602, "Invalid params", "name: field required").isNotFound());
        assertFalse(new ApiException(-32603, "Internal error", "does not exist").isNotFound());

        assertTrue(new ApiException(1, "Not authenticated", "").isAuthError());
        assertTrue(new ApiException(2, "Not authorized", "").isAuthError());
        assertFalse(new ApiException(3, "Not found", "").isAuthError());

        assertTrue(new ApiException(4, "Validation error", "").isValidationError());
        assertFalse(new ApiException(-32602, "Invalid params", "").isValidationError());
    }
}
