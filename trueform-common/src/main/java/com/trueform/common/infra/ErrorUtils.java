package com.trueform.common.infra;

/**
 * Null-safe formatting of exception messages for logs and diagnostics.
 */
public final class ErrorUtils {

    private ErrorUtils() {
    }

    /**
     * Format an exception message safely.
     *
     * @return a non-null human-readable error string
     */
    public static String formatErrorMessage(Throwable err) {
        if (err == null)
            return "Error";
        String msg = err.getMessage();
        if (msg != null && !msg.isEmpty()) {
            return msg;
        }
        return err.getClass().getSimpleName();
    }

    /**
     * Format the whole cause chain, outermost first, joined by arrows.
     */
    public static String formatErrorChain(Throwable err) {
        if (err == null) {
            return "unknown error";
        }
        StringBuilder sb = new StringBuilder();
        Throwable current = err;
        int depth = 0;
        while (current != null && depth < 8) {
            if (sb.length() > 0) {
                sb.append(" → ");
            }
            sb.append(formatErrorMessage(current));
            current = current.getCause() == current ? null : current.getCause();
            depth++;
        }
        return sb.toString();
    }

    /**
     * Find the first throwable of the given type in the cause chain.
     *
     * @return the match, or {@code null}
     */
    public static <T extends Throwable> T findCause(Throwable err, Class<T> type) {
        Throwable current = err;
        int depth = 0;
        while (current != null && depth < 16) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = current.getCause() == current ? null : current.getCause();
            depth++;
        }
        return null;
    }
}
