package com.meltwater.syncrabbit;

public class AmqpExchangeException extends AmqpException {

    public AmqpExchangeException(String message) {
        super(message);
    }

    public AmqpExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
