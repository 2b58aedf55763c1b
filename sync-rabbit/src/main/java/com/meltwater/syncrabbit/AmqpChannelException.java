package com.meltwater.syncrabbit;

/**
 * An operation was attempted on a channel that is closed or could not be opened.
 */
public class AmqpChannelException extends AmqpException {

    public AmqpChannelException(String message) {
        super(message);
    }

    public AmqpChannelException(String message, Throwable cause) {
        super(message, cause);
    }
}
