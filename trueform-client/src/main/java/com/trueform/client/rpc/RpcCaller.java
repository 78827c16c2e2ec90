package com.trueform.client.rpc;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.trueform.client.context.CallContext;
import com.trueform.client.errors.TrueNasException;

/**
 * Synchronous JSON-RPC call.
 */
public interface RpcCaller {

    /**
     * Call {@code method} and decode its result.
     *
     * @param params     positional parameters, usually a list; {@code null} to omit them
     * @param resultType shape of the result; {@code null} or {@code Void} discards it
     * @return the decoded result, {@code null} when the server returned none
     */
    <T> T call(CallContext ctx, String method, Object params, JavaType resultType) throws TrueNasException;

    RpcCodec codec();

    default <T> T call(CallContext ctx, String method, Object params, Class<T> resultType)
            throws TrueNasException {
        return call(ctx, method, params, codec().type(resultType));
    }

    default <T> T call(CallContext ctx, String method, Object params, TypeReference<T> resultType)
            throws TrueNasException {
        return call(ctx, method, params, codec().type(resultType));
    }

    default JsonNode call(CallContext ctx, String method, Object params) throws TrueNasException {
        return call(ctx, method, params, JsonNode.class);
    }
}
