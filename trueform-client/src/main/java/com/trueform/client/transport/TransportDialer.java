package com.trueform.client.transport;

import java.io.IOException;
import java.time.Duration;

/**
 * Opens {@link Transport}s to one fixed endpoint.
 */
public interface TransportDialer extends AutoCloseable {

    /**
     * Open a new transport.
     *
     * @param timeout bound for both the TCP connect and the protocol handshake
     * @throws IOException if the endpoint cannot be reached or refuses the upgrade
     */
    Transport dial(Duration timeout) throws IOException, InterruptedException;

    /** Human-readable endpoint, used in diagnostics. */
    String target();

    /** Release pooled resources. */
    @Override
    default void close() {
    }
}
