package com.meltwater.syncrabbit;

/**
 * Base class of the checked errors raised by connections, channels, exchanges and queues.
 *
 * Catch {@link AmqpConnectionException} alone to detect that the broker connection is gone and a
 * {@link AmqpConnection#reconnect()} is needed.
 */
public class AmqpException extends Exception {

    public AmqpException(String message) {
        super(message);
    }

    public AmqpException(String message, Throwable cause) {
        super(message, cause);
    }
}
