package com.meltwater.syncrabbit.transport;

/**
 * Entry point into the library that speaks the AMQP 0-9-1 wire protocol.
 */
public interface ProtocolEngine {

    /**
     * Opens (connects and authenticates) a new session with the broker.
     *
     * @throws TransportException of kind {@link TransportException.Kind#CONNECTION} if the broker can not be reached
     */
    ProtocolSession open(SessionParameters parameters) throws TransportException;
}
