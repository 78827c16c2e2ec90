package com.trueform.client.errors;

import lombok.Getter;

import java.time.Duration;

/**
 * No response arrived within the configured call timeout.
 */
@Getter
public class CallTimeoutException extends TrueNasException {

    private final String method;
    private final Duration timeout;

    public CallTimeoutException(String method, Duration timeout) {
        super(String.format("request timeout after %dms (%s)", timeout.toMillis(), method));
        this.method = method;
        this.timeout = timeout;
    }
}
