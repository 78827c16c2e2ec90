package com.trueform.client.connection;

import com.trueform.client.context.CallContext;
import com.trueform.client.errors.CallCancelledException;
import com.trueform.client.errors.ConnectionException;
import com.trueform.client.errors.ProtocolException;
import com.trueform.client.errors.TrueNasException;
import com.trueform.client.transport.Transport;
import com.trueform.client.transport.TransportDialer;
import com.trueform.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the one transport to the endpoint: dialing, the authentication
 * handshake, the demultiplexer thread, serialized writes and shutdown.
 *
 * <p>Two locks: {@code connectLock} serializes whole connect attempts (dial
 * plus handshake), {@code lock} guards the transport handle and state and is
 * held around each write. Handshake writes therefore never wait behind a
 * connect attempt. Until the handshake succeeds only the connecting thread
 * may write; {@link #send} refuses everyone else.
 */
@Slf4j
public class ConnectionManager implements AutoCloseable {

    /**
     * Callbacks into the layer that routes calls over this connection.
     */
    public interface SessionHandler {

        /**
         * Body of the demultiplexer thread. Returns when the transport is
         * closed, fails, or the manager shuts down.
         */
        void readLoop(Transport transport);

        /**
         * Authenticate a freshly dialed transport. Runs on the connecting
         * thread while the state is {@link ConnectionState#CONNECTING}.
         */
        void authenticate(CallContext ctx) throws TrueNasException;

        /**
         * The current transport is gone; fail whoever waits on it.
         */
        void connectionLost(TrueNasException cause);
    }

    private static final AtomicInteger READER_SEQ = new AtomicInteger();

    private final TransportDialer dialer;
    private final Duration timeout;
    private final SessionHandler handler;

    private final ReentrantLock connectLock = new ReentrantLock();
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private Transport transport; // guarded by lock
    private Thread reader; // guarded by lock

    public ConnectionManager(TransportDialer dialer, Duration timeout, SessionHandler handler) {
        this.dialer = dialer;
        this.timeout = timeout;
        this.handler = handler;
    }

    // ── Lifecycle ───────────────────────────────────────────────────────

    /**
     * Dial and authenticate. Returns immediately when already connected.
     *
     * @throws ConnectionException     if the endpoint cannot be dialed
     * @throws TrueNasException        if the handshake fails; the transport is torn down again
     * @throws CallCancelledException  if {@code ctx} is already cancelled
     */
    public void connect(CallContext ctx) throws TrueNasException {
        if (state == ConnectionState.CONNECTED) {
            return;
        }
        if (ctx.isCancelled()) {
            throw new CallCancelledException("connect cancelled");
        }
        connectLock.lock();
        try {
            if (shuttingDown.get()) {
                throw new ProtocolException("client closed");
            }
            if (state == ConnectionState.CONNECTED) {
                return;
            }
            Transport fresh = dial();
            install(fresh);
            try {
                handler.authenticate(ctx);
            } catch (TrueNasException e) {
                log.warn("Handshake with {} failed: {}", dialer.target(), e.getMessage());
                awaitReader(detach(fresh, e));
                throw e;
            }
            markConnected(fresh);
            log.info("Connected to TrueNAS at {}", dialer.target());
        } finally {
            connectLock.unlock();
        }
    }

    /**
     * Connect if not connected. Used before every call.
     */
    public void ensureConnected(CallContext ctx) throws TrueNasException {
        if (state != ConnectionState.CONNECTED) {
            connect(ctx);
        }
    }

    /**
     * Tear the connection down, fail waiting callers and stop the
     * demultiplexer. Safe to call more than once; later calls do nothing.
     */
    @Override
    public void close() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        Thread stale;
        lock.lock();
        try {
            stale = detach(transport, new ProtocolException("client closed"));
        } finally {
            lock.unlock();
        }
        awaitReader(stale);
        dialer.close();
        log.info("Connection to {} closed", dialer.target());
    }

    // ── Writes ──────────────────────────────────────────────────────────

    /**
     * Write one frame on an authenticated connection. Only the write itself
     * is under the lock. Refused while a handshake is in flight.
     */
    public void send(String frame) throws ProtocolException {
        lock.lock();
        try {
            if (transport == null || state != ConnectionState.CONNECTED) {
                throw new ProtocolException(shuttingDown.get() ? "client closed" : "not connected");
            }
            write(frame);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Write a handshake frame onto the transport being authenticated. Only
     * the thread running the connect attempt may call this.
     */
    public void sendHandshake(String frame) throws ProtocolException {
        if (!connectLock.isHeldByCurrentThread()) {
            throw new ProtocolException("handshake frame outside a connect attempt");
        }
        lock.lock();
        try {
            if (transport == null || state != ConnectionState.CONNECTING) {
                throw new ProtocolException("connection lost during handshake");
            }
            write(frame);
        } finally {
            lock.unlock();
        }
    }

    private void write(String frame) throws ProtocolException {
        try {
            transport.send(frame);
        } catch (IOException e) {
            throw new ProtocolException("failed to send request: " + ErrorUtils.formatErrorMessage(e), e);
        }
    }

    // ── State ───────────────────────────────────────────────────────────

    public ConnectionState state() {
        return state;
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    public Duration timeout() {
        return timeout;
    }

    public String target() {
        return dialer.target();
    }

    // ── Internals ───────────────────────────────────────────────────────

    private Transport dial() throws TrueNasException {
        setState(ConnectionState.CONNECTING);
        log.debug("Dialing {}", dialer.target());
        try {
            return dialer.dial(timeout);
        } catch (IOException e) {
            setState(ConnectionState.DISCONNECTED);
            throw new ConnectionException(dialer.target(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            setState(ConnectionState.DISCONNECTED);
            throw new CallCancelledException("connect interrupted");
        } catch (RuntimeException e) {
            setState(ConnectionState.DISCONNECTED);
            throw new ConnectionException(dialer.target(), e);
        }
    }

    private void install(Transport fresh) throws ProtocolException {
        lock.lock();
        try {
            if (shuttingDown.get()) {
                fresh.close();
                state = ConnectionState.DISCONNECTED;
                throw new ProtocolException("client closed");
            }
            transport = fresh;
            reader = startReader(fresh);
        } finally {
            lock.unlock();
        }
    }

    private void markConnected(Transport fresh) throws ProtocolException {
        lock.lock();
        try {
            if (transport != fresh) {
                throw new ProtocolException("connection lost during handshake");
            }
            state = ConnectionState.CONNECTED;
        } finally {
            lock.unlock();
        }
    }

    private Thread startReader(Transport fresh) {
        Thread thread = new Thread(() -> {
            try {
                handler.readLoop(fresh);
            } finally {
                readerExited(fresh);
            }
        }, "trueform-demux-" + READER_SEQ.incrementAndGet());
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private void readerExited(Transport exited) {
        lock.lock();
        try {
            if (transport == exited) {
                transport = null;
                reader = null;
                state = ConnectionState.DISCONNECTED;
                handler.connectionLost(new ProtocolException("connection to " + dialer.target() + " lost"));
                log.info("Disconnected from {}", dialer.target());
            }
        } finally {
            lock.unlock();
        }
        exited.close();
    }

    /**
     * Drop {@code expected} if it is still the current transport and fail
     * everyone waiting on it.
     *
     * @return the reader thread to wait for, or {@code null}
     */
    private Thread detach(Transport expected, TrueNasException cause) {
        Thread stale = null;
        lock.lock();
        try {
            if (expected != null && transport == expected) {
                transport = null;
                stale = reader;
                reader = null;
                expected.close();
            }
            state = ConnectionState.DISCONNECTED;
            handler.connectionLost(cause);
        } finally {
            lock.unlock();
        }
        return stale;
    }

    private void awaitReader(Thread stale) {
        if (stale == null || stale == Thread.currentThread()) {
            return;
        }
        try {
            stale.join(timeout.toMillis());
            if (stale.isAlive()) {
                log.warn("Demultiplexer {} did not stop within {}ms", stale.getName(), timeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void setState(ConnectionState next) {
        lock.lock();
        try {
            state = next;
        } finally {
            lock.unlock();
        }
    }
}
