package com.trueform.client.errors;

/**
 * The caller's context was cancelled, or its deadline passed, before the
 * operation finished.
 */
public class CallCancelledException extends TrueNasException {

    public CallCancelledException(String message) {
        super(message);
    }
}
