package com.trueform.client.errors;

/**
 * Base type of every failure the client reports.
 */
public class TrueNasException extends Exception {

    public TrueNasException(String message) {
        super(message);
    }

    public TrueNasException(String message, Throwable cause) {
        super(message, cause);
    }
}
