package com.trueform.client.errors;

/**
 * The API key handshake did not succeed.
 */
public class AuthenticationException extends TrueNasException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
