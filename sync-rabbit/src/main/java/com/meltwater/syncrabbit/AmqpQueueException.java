package com.meltwater.syncrabbit;

public class AmqpQueueException extends AmqpException {

    public AmqpQueueException(String message) {
        super(message);
    }

    public AmqpQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
