package com.trueform.client.jobs;

import com.fasterxml.jackson.core.type.TypeReference;
import com.trueform.client.context.CallContext;
import com.trueform.client.errors.CallCancelledException;
import com.trueform.client.errors.JobException;
import com.trueform.client.errors.ProtocolException;
import com.trueform.client.errors.TrueNasException;
import com.trueform.client.rpc.RpcCaller;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Polls long-running server jobs to completion.
 */
@Slf4j
public class JobPoller {

    public static final String JOBS_METHOD = "core.get_jobs";

    private static final TypeReference<List<Map<String, Object>>> JOB_LIST = new TypeReference<>() {
    };

    private final RpcCaller caller;
    private final Duration pollInterval;

    public JobPoller(RpcCaller caller, Duration pollInterval) {
        this.caller = caller;
        this.pollInterval = pollInterval;
    }

    /**
     * Poll job {@code jobId} until it reaches a terminal state.
     *
     * @return the job's {@code result} when it is an object, otherwise the
     *         whole job record
     * @throws JobException            if the job failed, was aborted, vanished, or outlived {@code timeout}
     * @throws CallCancelledException  if {@code ctx} is cancelled while waiting
     */
    public Map<String, Object> waitForJob(CallContext ctx, long jobId, Duration timeout) throws TrueNasException {
        Instant deadline = Instant.now().plus(timeout);
        List<Object> params = Collections.singletonList(
                Collections.singletonList(Arrays.asList("id", "=", jobId)));
        int polls = 0;

        while (true) {
            if (!Instant.now().isBefore(deadline)) {
                throw JobException.timeout(jobId);
            }

            List<Map<String, Object>> jobs = caller.call(ctx, JOBS_METHOD, params, JOB_LIST);
            polls++;
            if (jobs == null || jobs.isEmpty()) {
                throw JobException.notFound(jobId);
            }

            Map<String, Object> job = jobs.get(0);
            JobState state = JobState.parse(job.get("state"));
            if (!state.isTerminal()) {
                log.trace("Job {} is {}", jobId, state);
                Duration untilDeadline = Duration.between(Instant.now(), deadline);
                pause(ctx, untilDeadline.compareTo(pollInterval) < 0 ? untilDeadline : pollInterval);
                continue;
            }
            switch (state) {
                case SUCCESS:
                    log.debug("Job {} finished after {} poll(s)", jobId, polls);
                    return resultOf(job);
                case FAILED:
                    Object error = job.get("error");
                    throw JobException.failed(jobId, error instanceof String s ? s : "job failed");
                default:
                    throw JobException.aborted(jobId);
            }
        }
    }

    /**
     * Issue {@code <kind>.create} for kinds that answer with a job id, then
     * wait for that job.
     */
    public Map<String, Object> createWithJob(CallContext ctx, String kind, Object data, Duration timeout)
            throws TrueNasException {
        Long jobId = caller.call(ctx, kind + ".create", Collections.singletonList(data), Long.class);
        if (jobId == null) {
            throw new ProtocolException(kind + ".create returned no job id");
        }
        log.debug("{}.create started job {}", kind, jobId);
        return waitForJob(ctx, jobId, timeout);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> resultOf(Map<String, Object> job) {
        Object result = job.get("result");
        if (result instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return job;
    }

    private static void pause(CallContext ctx, Duration wait) throws CallCancelledException {
        if (ctx.isCancelled()) {
            throw new CallCancelledException("job wait cancelled");
        }
        if (wait.isNegative() || wait.isZero()) {
            return;
        }
        Duration left = ctx.remaining();
        boolean boundByDeadline = left != null && left.compareTo(wait) < 0;
        CompletableFuture<Void> wake = new CompletableFuture<>();
        try (CallContext.Registration ignored = ctx.onCancel(() -> wake.complete(null))) {
            wake.get((boundByDeadline ? left : wait).toNanos(), TimeUnit.NANOSECONDS);
            throw new CallCancelledException("job wait cancelled");
        } catch (TimeoutException e) {
            if (boundByDeadline) {
                throw new CallCancelledException("job wait exceeded the caller's deadline");
            }
        } catch (ExecutionException e) {
            throw new CallCancelledException("job wait cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CallCancelledException("job wait interrupted");
        }
    }
}
