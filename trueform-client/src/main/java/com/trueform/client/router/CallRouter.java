package com.trueform.client.router;

import com.fasterxml.jackson.databind.JavaType;
import com.trueform.client.connection.ConnectionManager;
import com.trueform.client.context.CallContext;
import com.trueform.client.errors.ApiException;
import com.trueform.client.errors.AuthenticationException;
import com.trueform.client.errors.CallCancelledException;
import com.trueform.client.errors.CallTimeoutException;
import com.trueform.client.errors.ProtocolException;
import com.trueform.client.errors.TrueNasException;
import com.trueform.client.rpc.JsonRpcMessage;
import com.trueform.client.rpc.RpcCaller;
import com.trueform.client.rpc.RpcCodec;
import com.trueform.client.transport.Frame;
import com.trueform.client.transport.ReadTimeoutException;
import com.trueform.client.transport.Transport;
import com.trueform.client.transport.TransportDialer;
import com.trueform.common.infra.ErrorUtils;
import com.trueform.common.logging.LogRedact;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Multiplexes concurrent synchronous calls over the shared connection.
 *
 * <p>Each call gets a fresh id and a one-shot slot in {@link PendingCalls};
 * the demultiplexer thread matches inbound responses to slots by id only, so
 * the server may answer in any order. A caller stops waiting on the first of
 * response, cancellation of its {@link CallContext}, or the call timeout, and
 * its slot is removed on every exit path. A response that arrives after that
 * is dropped.
 */
@Slf4j
public class CallRouter implements RpcCaller, AutoCloseable {

    public static final String AUTH_METHOD = "auth.login_with_api_key";

    private final RpcCodec codec;
    private final String apiKey;
    private final Duration timeout;
    private final PendingCalls pending = new PendingCalls();
    private final AtomicLong nextId = new AtomicLong();
    private final ConnectionManager connection;

    public CallRouter(TransportDialer dialer, String apiKey, Duration timeout, RpcCodec codec) {
        this.codec = codec;
        this.apiKey = apiKey;
        this.timeout = timeout;
        this.connection = new ConnectionManager(dialer, timeout, new Session());
    }

    // ── Calls ───────────────────────────────────────────────────────────

    @Override
    public <T> T call(CallContext ctx, String method, Object params, JavaType resultType)
            throws TrueNasException {
        connection.ensureConnected(ctx);
        return invoke(ctx, method, params, resultType, false);
    }

    @Override
    public RpcCodec codec() {
        return codec;
    }

    private <T> T invoke(CallContext ctx, String method, Object params, JavaType resultType,
            boolean handshake) throws TrueNasException {
        if (ctx.isCancelled()) {
            throw new CallCancelledException(method + " cancelled before it was sent");
        }
        long id = nextId.incrementAndGet();
        CompletableFuture<JsonRpcMessage.Response> slot = pending.register(id);
        try (CallContext.Registration ignored = ctx.onCancel(
                () -> slot.completeExceptionally(new CallCancelledException(method + " cancelled")))) {
            String frame = codec.encode(JsonRpcMessage.Request.create(id, method, params));
            if (log.isDebugEnabled()) {
                log.debug("→ #{} {}", id, LogRedact.redactFrame(method, frame));
            }
            if (handshake) {
                connection.sendHandshake(frame);
            } else {
                connection.send(frame);
            }

            JsonRpcMessage.Response response = await(ctx, method, slot);
            if (response.hasError()) {
                ApiException error = ApiException.from(response.getError());
                log.debug("← #{} {} error {}", id, method, error.getCode());
                throw error;
            }
            log.debug("← #{} {} ok", id, method);
            return codec.convert(response.getResult(), resultType);
        } finally {
            pending.unregister(id);
        }
    }

    private JsonRpcMessage.Response await(CallContext ctx, String method,
            CompletableFuture<JsonRpcMessage.Response> slot) throws TrueNasException {
        Duration wait = timeout;
        Duration left = ctx.remaining();
        boolean boundByDeadline = left != null && left.compareTo(timeout) < 0;
        if (boundByDeadline) {
            wait = left;
        }
        try {
            return slot.get(wait.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            if (boundByDeadline) {
                throw new CallCancelledException(method + " exceeded the caller's deadline");
            }
            throw new CallTimeoutException(method, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CallCancelledException cancelled) {
                throw cancelled;
            }
            throw new ProtocolException(method + ": " + ErrorUtils.formatErrorMessage(cause), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CallCancelledException(method + " interrupted");
        }
    }

    // ── Connection surface ──────────────────────────────────────────────

    public ConnectionManager connection() {
        return connection;
    }

    /** Number of calls currently waiting for a response. */
    public int pendingCount() {
        return pending.size();
    }

    @Override
    public void close() {
        connection.close();
    }

    // ── Session callbacks ───────────────────────────────────────────────

    private final class Session implements ConnectionManager.SessionHandler {

        @Override
        public void authenticate(CallContext ctx) throws TrueNasException {
            Boolean ok;
            try {
                ok = invoke(ctx, AUTH_METHOD, Collections.singletonList(apiKey), codec.type(Boolean.class), true);
            } catch (ApiException e) {
                throw new AuthenticationException("authentication failed: " + e.getMessage(), e);
            }
            if (!Boolean.TRUE.equals(ok)) {
                throw new AuthenticationException("authentication failed: invalid API key");
            }
        }

        @Override
        public void connectionLost(TrueNasException cause) {
            int failed = pending.failAll(cause);
            if (failed > 0) {
                log.debug("Failed {} waiting call(s): {}", failed, cause.getMessage());
            }
        }

        @Override
        public void readLoop(Transport transport) {
            while (true) {
                Frame frame;
                try {
                    frame = transport.receive(timeout);
                } catch (ReadTimeoutException e) {
                    if (connection.isShuttingDown()) {
                        return;
                    }
                    continue;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }

                switch (frame.kind()) {
                    case TEXT -> dispatch(frame.text());
                    case CLOSED -> {
                        if (frame.isNormalClosure()) {
                            log.debug("Connection closed ({} {})", frame.code(), frame.reason());
                        } else {
                            log.warn("Connection closed abnormally ({} {})", frame.code(), frame.reason());
                        }
                        return;
                    }
                    case FAILED -> {
                        log.warn("Connection failed: {}", ErrorUtils.formatErrorChain(frame.failure()));
                        return;
                    }
                }
            }
        }

        private void dispatch(String text) {
            JsonRpcMessage.Response response;
            try {
                response = codec.decodeResponse(text);
            } catch (ProtocolException e) {
                log.warn("Dropping undecodable frame: {}", ErrorUtils.formatErrorChain(e));
                return;
            }
            if (response.getId() == null) {
                log.trace("Ignoring frame without id");
                return;
            }
            if (!pending.deliver(response)) {
                log.debug("Dropping response #{}: no caller is waiting", response.getId());
            }
        }
    }
}
