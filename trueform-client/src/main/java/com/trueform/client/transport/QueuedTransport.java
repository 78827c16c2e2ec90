package com.trueform.client.transport;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base for transports whose inbound side is push-based: the network layer
 * {@link #enqueue}s frames and the demultiplexer pulls them with
 * {@link #receive}.
 */
public abstract class QueuedTransport implements Transport {

    private final BlockingQueue<Frame> inbound = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Frame terminal;

    protected void enqueue(Frame frame) {
        if (terminal != null) {
            return;
        }
        inbound.offer(frame);
    }

    @Override
    public Frame receive(Duration readDeadline) throws ReadTimeoutException, InterruptedException {
        Frame last = terminal;
        if (last != null) {
            return last;
        }
        Frame frame = inbound.poll(readDeadline.toNanos(), TimeUnit.NANOSECONDS);
        if (frame == null) {
            throw new ReadTimeoutException(readDeadline);
        }
        if (frame.isTerminal()) {
            terminal = frame;
        }
        return frame;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            doClose();
        } finally {
            inbound.offer(Frame.closed(Frame.NORMAL_CLOSURE, "closed by client"));
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** Release the underlying connection. Called at most once. */
    protected abstract void doClose();
}
