package com.trueform.client.transport;

/**
 * One inbound event from a {@link Transport}: a text message, a closure, or
 * a transport failure.
 *
 * @param kind    what happened
 * @param text    message payload for {@link Kind#TEXT}
 * @param code    close code for {@link Kind#CLOSED}
 * @param reason  close reason for {@link Kind#CLOSED}
 * @param failure cause for {@link Kind#FAILED}
 */
public record Frame(Kind kind, String text, int code, String reason, Throwable failure) {

    public enum Kind {
        TEXT,
        CLOSED,
        FAILED
    }

    public static final int NORMAL_CLOSURE = 1000;
    public static final int GOING_AWAY = 1001;
    /** Reported locally when the peer's close frame carried no status code. */
    public static final int NO_STATUS = 1005;

    public static Frame text(String text) {
        return new Frame(Kind.TEXT, text, 0, null, null);
    }

    public static Frame closed(int code, String reason) {
        return new Frame(Kind.CLOSED, null, code, reason, null);
    }

    public static Frame failed(Throwable failure) {
        return new Frame(Kind.FAILED, null, 0, null, failure);
    }

    public boolean isTerminal() {
        return kind != Kind.TEXT;
    }

    /**
     * Normal closure, going-away or a bare close frame: the peer or the
     * client ended the session on purpose.
     */
    public boolean isNormalClosure() {
        return kind == Kind.CLOSED && (code == NORMAL_CLOSURE || code == GOING_AWAY || code == NO_STATUS);
    }

    /**
     * Code to answer a peer's close frame with. Reserved and out-of-range
     * codes may not be sent and are answered with {@link #NORMAL_CLOSURE}.
     */
    public static int replyCloseCode(int peerCode) {
        boolean sendable = (peerCode >= 1000 && peerCode <= 1003)
                || (peerCode >= 1007 && peerCode <= 1014)
                || (peerCode >= 3000 && peerCode < 5000);
        return sendable ? peerCode : NORMAL_CLOSURE;
    }
}
