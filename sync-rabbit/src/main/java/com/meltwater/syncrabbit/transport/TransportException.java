package com.meltwater.syncrabbit.transport;

/**
 * A failure reported by the protocol engine.
 *
 * The {@link Kind} is decided once, where the engine's own exception is caught, so that callers can tell a lost
 * connection apart from an error that only concerns one request.
 */
public class TransportException extends Exception {

    public enum Kind {
        /**
         * The connection to the broker could not be opened or is gone. A reconnect is needed.
         */
        CONNECTION,
        /**
         * The channel is closed while the connection is still open.
         */
        CHANNEL,
        /**
         * The broker (or the engine) refused the request, e.g. a missing queue or an unknown delivery tag.
         */
        PROTOCOL,
        /**
         * No answer within the configured I/O timeout.
         */
        TIMEOUT
    }

    public static final int NO_REPLY_CODE = 0;

    private final Kind kind;
    private final int replyCode;

    public TransportException(Kind kind, String message) {
        this(kind, NO_REPLY_CODE, message, null);
    }

    public TransportException(Kind kind, String message, Throwable cause) {
        this(kind, NO_REPLY_CODE, message, cause);
    }

    public TransportException(Kind kind, int replyCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.replyCode = replyCode;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the AMQP reply code of the close that caused this failure, or {@link #NO_REPLY_CODE}
     */
    public int getReplyCode() {
        return replyCode;
    }

    public boolean isConnectionLoss() {
        return kind == Kind.CONNECTION;
    }

    @Override
    public String toString() {
        return "TransportException{" +
                "kind=" + kind +
                ", replyCode=" + replyCode +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
