package com.meltwater.syncrabbit.transport;

/**
 * One transport connection to a broker.
 */
public interface ProtocolSession {

    ProtocolChannel openChannel() throws TransportException;

    /**
     * Closes the connection and all its channels. Closing a closed session does nothing.
     */
    void close() throws TransportException;

    boolean isOpen();

    /**
     * @return the id of the most recently opened channel, 0 if none was opened yet
     */
    int getLastChannelId();

    /**
     * @return the negotiated maximum number of channels, 0 meaning no limit
     */
    int getChannelMax();
}
