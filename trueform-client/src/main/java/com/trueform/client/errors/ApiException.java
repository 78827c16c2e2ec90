package com.trueform.client.errors;

import com.fasterxml.jackson.databind.JsonNode;
import com.trueform.client.rpc.JsonRpcMessage;
import lombok.Getter;

/**
 * An error the server returned in place of a result.
 */
@Getter
public class ApiException extends TrueNasException {

    private final int code;
    private final String apiMessage;

    /** Raw JSON text of the error's {@code data} member, empty when absent. */
    private final String details;

    public ApiException(int code, String apiMessage, String details) {
        super(render(code, apiMessage, details));
        this.code = code;
        this.apiMessage = apiMessage;
        this.details = details != null ? details : "";
    }

    public static ApiException from(JsonRpcMessage.RpcError error) {
        JsonNode data = error.getData();
        String details = data == null || data.isNull() ? "" : data.toString();
        return new ApiException(error.getCode(), error.getMessage(), details);
    }

    private static String render(int code, String message, String details) {
        if (details != null && !details.isEmpty()) {
            return String.format("TrueNAS API error %d: %s (%s)", code, message, details);
        }
        return String.format("TrueNAS API error %d: %s", code, message);
    }

    /**
     * Also true for invalid-params errors whose details name a missing
     * instance; newer servers report deleted objects that way.
     */
    public boolean isNotFound() {
        if (code == JsonRpcMessage.NOT_FOUND) {
            return true;
        }
        return code == JsonRpcMessage.INVALID_PARAMS
                && (details.contains("InstanceNotFound") || details.contains("does not exist"));
    }

    public boolean isAuthError() {
        return code == JsonRpcMessage.NOT_AUTHENTICATED || code == JsonRpcMessage.NOT_AUTHORIZED;
    }

    public boolean isValidationError() {
        return code == JsonRpcMessage.VALIDATION;
    }
}
