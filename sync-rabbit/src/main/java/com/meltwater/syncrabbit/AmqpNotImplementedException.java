package com.meltwater.syncrabbit;

/**
 * Thrown by the persistent connection variants, which this client does not support.
 */
public class AmqpNotImplementedException extends UnsupportedOperationException {

    public AmqpNotImplementedException(String operation) {
        super(operation + " is not implemented: persistent connections are not supported");
    }
}
