package com.trueform.client.jobs;

import com.fasterxml.jackson.databind.JavaType;
import com.trueform.client.context.CallContext;
import com.trueform.client.errors.ApiException;
import com.trueform.client.errors.CallCancelledException;
import com.trueform.client.errors.JobException;
import com.trueform.client.errors.ProtocolException;
import com.trueform.client.errors.TrueNasErrors;
import com.trueform.client.errors.TrueNasException;
import com.trueform.client.rpc.RpcCaller;
import com.trueform.client.rpc.RpcCodec;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JobPollerTest {

    /** Answers calls from a script; the last entry repeats once the script runs out. */
    private static final class ScriptedCaller implements RpcCaller {

        record Call(String method, Object params) {
        }

        private final RpcCodec codec = new RpcCodec();
        private final Deque<Object> replies = new LinkedList<>();
        private final List<Call> calls = new CopyOnWriteArrayList<>();

        ScriptedCaller then(Object reply) {
            replies.add(reply);
            return this;
        }

        @Override
        public synchronized <T> T call(CallContext ctx, String method, Object params, JavaType resultType)
                throws TrueNasException {
            calls.add(new Call(method, params));
            Object reply = replies.size() > 1 ? replies.poll() : replies.peek();
            if (reply instanceof TrueNasException e) {
                throw e;
            }
            return codec.convert(codec.toTree(reply), resultType);
        }

        @Override
        public RpcCodec codec() {
            return codec;
        }
    }

    private static List<Map<String, Object>> job(String state) {
        return List.of(Map.of("id", 7, "state", state));
    }

    private static final Duration INTERVAL = Duration.ofMillis(50);

    @Test
    void runningJob_isPolledUntilSuccess() throws Exception {
        ScriptedCaller caller = new ScriptedCaller()
                .then(job("RUNNING"))
                .then(job("RUNNING"))
                .then(List.of(Map.of("id", 7, "state", "SUCCESS", "result", Map.of("x", 1))));
        JobPoller poller = new JobPoller(caller, INTERVAL);

        long start = System.nanoTime();
        Map<String, Object> result = poller.waitForJob(CallContext.background(), 7, Duration.ofSeconds(5));
        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(Map.of("x", 1), result);
        assertEquals(3, caller.calls.size());
        assertTrue(elapsed >= 90, "finished after " + elapsed + "ms");
        assertEquals(JobPoller.JOBS_METHOD, caller.calls.get(0).method());
        assertEquals(List.of(List.of(List.of("id", "=", 7L))), caller.calls.get(0).params());
    }

    @Test
    void successWithoutObjectResult_returnsJobRecord() throws Exception {
        ScriptedCaller caller = new ScriptedCaller()
                .then(List.of(Map.of("id", 7, "state", "SUCCESS", "result", 12)));

        Map<String, Object> result = new JobPoller(caller, INTERVAL)
                .waitForJob(CallContext.background(), 7, Duration.ofSeconds(1));

        assertEquals("SUCCESS", result.get("state"));
        assertEquals(12, result.get("result"));
    }

    @Test
    void failedJob_reportsServerError() {
        ScriptedCaller caller = new ScriptedCaller()
                .then(job("RUNNING"))
                .then(List.of(Map.of("id", 7, "state", "FAILED", "error", "boom")));

        JobException error = assertThrows(JobException.class,
                () -> new JobPoller(caller, INTERVAL).waitForJob(CallContext.background(), 7, Duration.ofSeconds(5)));

        assertEquals(JobException.Reason.FAILED, error.getReason());
        assertEquals(7, error.getJobId());
        assertEquals("job 7 failed: boom", error.getMessage());
    }

    @Test
    void failedJobWithoutError_usesDefaultText() {
        ScriptedCaller caller = new ScriptedCaller().then(job("FAILED"));

        JobException error = assertThrows(JobException.class,
                () -> new JobPoller(caller, INTERVAL).waitForJob(CallContext.background(), 7, Duration.ofSeconds(1)));

        assertEquals("job 7 failed: job failed", error.getMessage());
    }

    @Test
    void abortedJob() {
        ScriptedCaller caller = new ScriptedCaller().then(job("ABORTED"));

        JobException error = assertThrows(JobException.class,
                () -> new JobPoller(caller, INTERVAL).waitForJob(CallContext.background(), 7, Duration.ofSeconds(1)));

        assertEquals(JobException.Reason.ABORTED, error.getReason());
        assertEquals("job 7 was aborted", error.getMessage());
    }

    @Test
    void missingJob_isNotFound() {
        ScriptedCaller caller = new ScriptedCaller().then(List.of());

        JobException error = assertThrows(JobException.class,
                () -> new JobPoller(caller, INTERVAL).waitForJob(CallContext.background(), 99, Duration.ofSeconds(1)));

        assertEquals(JobException.Reason.NOT_FOUND, error.getReason());
        assertEquals("job 99 not found", error.getMessage());
    }

    @Test
    void jobThatNeverEnds_timesOut() {
        ScriptedCaller caller = new ScriptedCaller().then(job("WAITING"));

        long start = System.nanoTime();
        JobException error = assertThrows(JobException.class,
                () -> new JobPoller(caller, INTERVAL).waitForJob(CallContext.background(), 7, Duration.ofMillis(200)));
        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(JobException.Reason.TIMEOUT, error.getReason());
        assertTrue(error.getMessage().contains("job 7"));
        assertTrue(TrueNasErrors.isTimeout(error));
        assertTrue(elapsed < 2000, "timed out after " + elapsed + "ms");
    }

    @Test
    void cancellation_interruptsTheWait() throws Exception {
        ScriptedCaller caller = new ScriptedCaller().then(job("RUNNING"));
        CallContext ctx = CallContext.cancellable();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(ctx::cancel, 100, TimeUnit.MILLISECONDS);

            long start = System.nanoTime();
            assertThrows(CallCancelledException.class,
                    () -> new JobPoller(caller, Duration.ofSeconds(30)).waitForJob(ctx, 7, Duration.ofMinutes(1)));

            assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 2000);
            assertEquals(1, caller.calls.size());
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void queryErrors_propagate() {
        ScriptedCaller caller = new ScriptedCaller()
                .then(new ApiException(2, "Not authorized", ""));

        ApiException error = assertThrows(ApiException.class,
                () -> new JobPoller(caller, INTERVAL).waitForJob(CallContext.background(), 7, Duration.ofSeconds(1)));

        assertTrue(error.isAuthError());
    }

    @Test
    void createWithJob_createsThenWaits() throws Exception {
        ScriptedCaller caller = new ScriptedCaller()
                .then(55)
                .then(List.of(Map.of("id", 55, "state", "SUCCESS", "result", Map.of("name", "plex"))));
        Map<String, Object> data = Map.of("app_name", "plex");

        Map<String, Object> result = new JobPoller(caller, INTERVAL)
                .createWithJob(CallContext.background(), "app", data, Duration.ofSeconds(5));

        assertEquals("plex", result.get("name"));
        assertEquals("app.create", caller.calls.get(0).method());
        assertEquals(List.of(data), caller.calls.get(0).params());
        assertEquals(List.of(List.of(List.of("id", "=", 55L))), caller.calls.get(1).params());
    }

    @Test
    void createWithJob_withoutJobId_isProtocolError() {
        ScriptedCaller caller = new ScriptedCaller().then(null);

        assertThrows(ProtocolException.class, () -> new JobPoller(caller, INTERVAL)
                .createWithJob(CallContext.background(), "app", Map.of(), Duration.ofSeconds(1)));
    }
}
