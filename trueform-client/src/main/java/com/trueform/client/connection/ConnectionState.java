package com.trueform.client.connection;

/**
 * Lifecycle of the single connection: {@code DISCONNECTED -> CONNECTING ->
 * CONNECTED -> DISCONNECTED}.
 */
public enum ConnectionState {
    DISCONNECTED,
    /** Dialing or authenticating. Only the handshake call may use the transport. */
    CONNECTING,
    CONNECTED
}
