package com.trueform.client.transport;

import java.io.IOException;
import java.time.Duration;

/**
 * A full-duplex, message-framed connection. {@link #send} may be called from
 * one writer at a time; {@link #receive} is called only by the demultiplexer.
 */
public interface Transport {

    /**
     * Queue one text message for delivery.
     *
     * @throws IOException if the transport is closed or the message was refused
     */
    void send(String text) throws IOException;

    /**
     * Wait for the next inbound frame. Once a terminal frame has been returned
     * every later call returns it again.
     *
     * @param readDeadline how long to wait
     * @throws ReadTimeoutException if nothing arrived in time
     */
    Frame receive(Duration readDeadline) throws ReadTimeoutException, InterruptedException;

    /**
     * Close the transport. Idempotent; a pending {@link #receive} returns a
     * closure frame.
     */
    void close();
}
