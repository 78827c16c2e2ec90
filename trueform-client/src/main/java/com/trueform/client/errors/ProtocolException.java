package com.trueform.client.errors;

/**
 * Malformed frames, failed writes and connections lost mid-call.
 */
public class ProtocolException extends TrueNasException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
