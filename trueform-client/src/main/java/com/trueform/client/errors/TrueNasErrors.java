package com.trueform.client.errors;

import com.trueform.common.infra.ErrorUtils;

/**
 * Error-kind predicates for code that sits on top of the client. Branch on
 * these instead of matching message text.
 */
public final class TrueNasErrors {

    private TrueNasErrors() {
    }

    /**
     * Whether the target object does not exist. Callers usually treat this as
     * "already gone" rather than as a failure.
     */
    public static boolean isNotFound(Throwable err) {
        ApiException api = ErrorUtils.findCause(err, ApiException.class);
        return api != null && api.isNotFound();
    }

    public static boolean isAuthError(Throwable err) {
        if (ErrorUtils.findCause(err, AuthenticationException.class) != null) {
            return true;
        }
        ApiException api = ErrorUtils.findCause(err, ApiException.class);
        return api != null && api.isAuthError();
    }

    /**
     * Whether the server rejected the call's input. A wire error that failed
     * the handshake counts as an auth error only.
     */
    public static boolean isValidationError(Throwable err) {
        if (ErrorUtils.findCause(err, AuthenticationException.class) != null) {
            return false;
        }
        ApiException api = ErrorUtils.findCause(err, ApiException.class);
        return api != null && api.isValidationError();
    }

    public static boolean isTimeout(Throwable err) {
        if (ErrorUtils.findCause(err, CallTimeoutException.class) != null) {
            return true;
        }
        JobException job = ErrorUtils.findCause(err, JobException.class);
        return job != null && job.getReason() == JobException.Reason.TIMEOUT;
    }

    public static boolean isConnectionError(Throwable err) {
        return ErrorUtils.findCause(err, ConnectionException.class) != null;
    }
}
