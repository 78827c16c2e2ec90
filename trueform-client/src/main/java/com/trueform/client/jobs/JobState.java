package com.trueform.client.jobs;

import java.util.Locale;

/**
 * Server-side job states.
 */
public enum JobState {
    WAITING(false),
    RUNNING(false),
    SUCCESS(true),
    FAILED(true),
    ABORTED(true),
    /** Anything the client does not recognise; polled like a running job. */
    UNKNOWN(false);

    private final boolean terminal;

    JobState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public static JobState parse(Object raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        try {
            return valueOf(raw.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
