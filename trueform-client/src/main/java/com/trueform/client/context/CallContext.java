package com.trueform.client.context;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal and optional deadline carried by every call.
 *
 * <p>Cancelling a context aborts the waits of every call using it; the
 * requests already written to the wire are not recalled.
 *
 * <pre>
 * CallContext ctx = CallContext.withTimeout(Duration.ofMinutes(5));
 * client.query(ctx, ResourceKind.POOL, null, POOL_LIST);
 * </pre>
 */
@Slf4j
public final class CallContext {

    private static final CallContext BACKGROUND = new CallContext(null, false);

    private final Instant deadline;
    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    private CallContext(Instant deadline, boolean cancellable) {
        this.deadline = deadline;
        this.cancellable = cancellable;
    }

    /** A context that is never cancelled and has no deadline. */
    public static CallContext background() {
        return BACKGROUND;
    }

    public static CallContext cancellable() {
        return new CallContext(null, true);
    }

    public static CallContext withTimeout(Duration timeout) {
        return new CallContext(Instant.now().plus(timeout), true);
    }

    public static CallContext withDeadline(Instant deadline) {
        return new CallContext(deadline, true);
    }

    /**
     * Cancel the context and run its listeners once. No-op on
     * {@link #background()} and on an already cancelled context.
     */
    public void cancel() {
        if (!cancellable || !cancelled.compareAndSet(false, true)) {
            return;
        }
        // whoever removes a listener runs it, so a concurrent onCancel cannot lose one
        for (Runnable listener : listeners) {
            if (listeners.remove(listener)) {
                runListener(listener);
            }
        }
    }

    /** True once cancelled or once the deadline has passed. */
    public boolean isCancelled() {
        return cancelled.get() || (deadline != null && !Instant.now().isBefore(deadline));
    }

    public boolean isDeadlineExceeded() {
        return deadline != null && !Instant.now().isBefore(deadline);
    }

    /** @return the deadline, or {@code null} */
    public Instant deadline() {
        return deadline;
    }

    /**
     * Time left before the deadline, never negative.
     *
     * @return remaining time, or {@code null} when there is no deadline
     */
    public Duration remaining() {
        if (deadline == null) {
            return null;
        }
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * Register a listener run on {@link #cancel()}. Runs immediately if the
     * context is already cancelled. Deadline expiry does not fire listeners;
     * waiters bound their waits by {@link #remaining()} instead.
     *
     * @return a registration whose {@code close()} removes the listener
     */
    public Registration onCancel(Runnable listener) {
        if (!cancellable) {
            return Registration.NONE;
        }
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            runListener(listener);
        }
        return () -> listeners.remove(listener);
    }

    private static void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation listener failed: {}", e.getMessage(), e);
        }
    }

    int listenerCount() {
        return listeners.size();
    }

    /**
     * Handle for a cancellation listener.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        Registration NONE = () -> {
        };

        @Override
        void close();
    }
}
