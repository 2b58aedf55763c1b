package com.meltwater.syncrabbit;

/**
 * The transport connection to the broker could not be established or has been lost.
 */
public class AmqpConnectionException extends AmqpException {

    public AmqpConnectionException(String message) {
        super(message);
    }

    public AmqpConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
