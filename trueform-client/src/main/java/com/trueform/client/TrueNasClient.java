package com.trueform.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.trueform.client.connection.ConnectionState;
import com.trueform.client.context.CallContext;
import com.trueform.client.errors.TrueNasException;
import com.trueform.client.jobs.JobPoller;
import com.trueform.client.query.QueryParams;
import com.trueform.client.router.CallRouter;
import com.trueform.client.rpc.RpcCaller;
import com.trueform.client.rpc.RpcCodec;
import com.trueform.client.transport.OkHttpTransportDialer;
import com.trueform.client.transport.TransportDialer;
import com.trueform.common.config.TrueNasSettings;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

/**
 * TrueNAS API client: one authenticated WebSocket shared by any number of
 * threads, each making blocking calls.
 *
 * <pre>
 * try (TrueNasClient client = new TrueNasClient(settings)) {
 *     client.connect(CallContext.background());
 *     List&lt;Map&lt;String, Object&gt;&gt; pools = client.query(CallContext.background(),
 *             ResourceKind.POOL, new QueryParams().withFilter("name", "=", "tank"),
 *             new TypeReference&lt;&gt;() {});
 * }
 * </pre>
 *
 * <p>Resource kinds are API namespaces such as {@code pool.dataset}, given as
 * a string or a {@link ResourceKind}. Branch on failures with
 * {@link com.trueform.client.errors.TrueNasErrors}.
 */
@Slf4j
public class TrueNasClient implements RpcCaller, AutoCloseable {

    private final TrueNasSettings settings;
    private final CallRouter router;
    private final JobPoller jobs;

    public TrueNasClient(TrueNasSettings settings) {
        this(settings, OkHttpTransportDialer.forSettings(settings));
    }

    public TrueNasClient(TrueNasSettings settings, TransportDialer dialer) {
        this.settings = settings;
        this.router = new CallRouter(dialer, settings.getApiKey(), settings.effectiveTimeout(), new RpcCodec());
        this.jobs = new JobPoller(router, settings.effectiveJobPollInterval());
        log.debug("TrueNAS client created for {}", settings);
    }

    // ── Connection ──────────────────────────────────────────────────────

    /**
     * Dial and authenticate now instead of on the first call. Does nothing if
     * already connected.
     */
    public void connect(CallContext ctx) throws TrueNasException {
        router.connection().connect(ctx);
    }

    public boolean isConnected() {
        return router.connection().isConnected();
    }

    public ConnectionState state() {
        return router.connection().state();
    }

    public TrueNasSettings settings() {
        return settings;
    }

    /** Calls currently waiting for a response. */
    public int pendingCalls() {
        return router.pendingCount();
    }

    @Override
    public void close() {
        router.close();
    }

    // ── Raw calls ───────────────────────────────────────────────────────

    @Override
    public <T> T call(CallContext ctx, String method, Object params, JavaType resultType)
            throws TrueNasException {
        return router.call(ctx, method, params, resultType);
    }

    @Override
    public RpcCodec codec() {
        return router.codec();
    }

    // ── Resource operations ─────────────────────────────────────────────

    /**
     * {@code <kind>.query}. With {@code params == null} the call carries no
     * parameters and the server returns every row.
     */
    public <T> T query(CallContext ctx, String kind, QueryParams params, Class<T> resultType)
            throws TrueNasException {
        return call(ctx, kind + ".query", params != null ? params.toCallParams() : null, resultType);
    }

    public <T> T query(CallContext ctx, String kind, QueryParams params, TypeReference<T> resultType)
            throws TrueNasException {
        return call(ctx, kind + ".query", params != null ? params.toCallParams() : null, resultType);
    }

    /** {@code <kind>.get_instance [id]}. */
    public <T> T getInstance(CallContext ctx, String kind, Object id, Class<T> resultType)
            throws TrueNasException {
        return call(ctx, kind + ".get_instance", Collections.singletonList(id), resultType);
    }

    public <T> T getInstance(CallContext ctx, String kind, Object id, TypeReference<T> resultType)
            throws TrueNasException {
        return call(ctx, kind + ".get_instance", Collections.singletonList(id), resultType);
    }

    /** {@code <kind>.create [data]}. */
    public <T> T create(CallContext ctx, String kind, Object data, Class<T> resultType)
            throws TrueNasException {
        return call(ctx, kind + ".create", Collections.singletonList(data), resultType);
    }

    public <T> T create(CallContext ctx, String kind, Object data, TypeReference<T> resultType)
            throws TrueNasException {
        return call(ctx, kind + ".create", Collections.singletonList(data), resultType);
    }

    /** {@code <kind>.update [id, data]}. */
    public <T> T update(CallContext ctx, String kind, Object id, Object data, Class<T> resultType)
            throws TrueNasException {
        return call(ctx, kind + ".update", Arrays.asList(id, data), resultType);
    }

    public <T> T update(CallContext ctx, String kind, Object id, Object data, TypeReference<T> resultType)
            throws TrueNasException {
        return call(ctx, kind + ".update", Arrays.asList(id, data), resultType);
    }

    /** {@code <kind>.delete [id]}; the result is discarded. */
    public void delete(CallContext ctx, String kind, Object id) throws TrueNasException {
        call(ctx, kind + ".delete", Collections.singletonList(id), Void.class);
    }

    /** {@code <kind>.delete [id, options]}, e.g. snapshot deletion with {@code defer}. */
    public void deleteWithOptions(CallContext ctx, String kind, Object id, Object options) throws TrueNasException {
        call(ctx, kind + ".delete", Arrays.asList(id, options), Void.class);
    }

    // ── Resource operations by kind ─────────────────────────────────────

    public <T> T query(CallContext ctx, ResourceKind kind, QueryParams params, Class<T> resultType)
            throws TrueNasException {
        return query(ctx, kind.wireName(), params, resultType);
    }

    public <T> T query(CallContext ctx, ResourceKind kind, QueryParams params, TypeReference<T> resultType)
            throws TrueNasException {
        return query(ctx, kind.wireName(), params, resultType);
    }

    public <T> T getInstance(CallContext ctx, ResourceKind kind, Object id, Class<T> resultType)
            throws TrueNasException {
        return getInstance(ctx, kind.wireName(), id, resultType);
    }

    public <T> T getInstance(CallContext ctx, ResourceKind kind, Object id, TypeReference<T> resultType)
            throws TrueNasException {
        return getInstance(ctx, kind.wireName(), id, resultType);
    }

    public <T> T create(CallContext ctx, ResourceKind kind, Object data, Class<T> resultType)
            throws TrueNasException {
        return create(ctx, kind.wireName(), data, resultType);
    }

    public <T> T create(CallContext ctx, ResourceKind kind, Object data, TypeReference<T> resultType)
            throws TrueNasException {
        return create(ctx, kind.wireName(), data, resultType);
    }

    public <T> T update(CallContext ctx, ResourceKind kind, Object id, Object data, Class<T> resultType)
            throws TrueNasException {
        return update(ctx, kind.wireName(), id, data, resultType);
    }

    public <T> T update(CallContext ctx, ResourceKind kind, Object id, Object data, TypeReference<T> resultType)
            throws TrueNasException {
        return update(ctx, kind.wireName(), id, data, resultType);
    }

    public void delete(CallContext ctx, ResourceKind kind, Object id) throws TrueNasException {
        delete(ctx, kind.wireName(), id);
    }

    public void deleteWithOptions(CallContext ctx, ResourceKind kind, Object id, Object options)
            throws TrueNasException {
        deleteWithOptions(ctx, kind.wireName(), id, options);
    }

    public Map<String, Object> createWithJob(CallContext ctx, ResourceKind kind, Object data, Duration timeout)
            throws TrueNasException {
        return createWithJob(ctx, kind.wireName(), data, timeout);
    }

    // ── Jobs ────────────────────────────────────────────────────────────

    /**
     * Poll {@code core.get_jobs} until the job ends or {@code timeout} passes.
     */
    public Map<String, Object> waitForJob(CallContext ctx, long jobId, Duration timeout) throws TrueNasException {
        return jobs.waitForJob(ctx, jobId, timeout);
    }

    /**
     * Create an object whose {@code create} answers with a job id, and wait
     * for the job.
     */
    public Map<String, Object> createWithJob(CallContext ctx, String kind, Object data, Duration timeout)
            throws TrueNasException {
        return jobs.createWithJob(ctx, kind, data, timeout);
    }
}
