package com.meltwater.syncrabbit.transport.rabbit;

import com.meltwater.syncrabbit.transport.ProtocolChannel;
import com.meltwater.syncrabbit.transport.ProtocolSession;
import com.meltwater.syncrabbit.transport.TransportException;
import com.meltwater.syncrabbit.transport.TransportException.Kind;
import com.meltwater.syncrabbit.util.Logger;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;

import java.io.IOException;

class RabbitProtocolSession implements ProtocolSession {

    private static final Logger log = new Logger(RabbitProtocolSession.class);

    private final Connection connection;
    private int lastChannelId;

    RabbitProtocolSession(Connection connection) {
        this.connection = connection;
    }

    @Override
    public ProtocolChannel openChannel() throws TransportException {
        final Channel channel;
        try {
            channel = connection.createChannel();
        } catch (IOException | AlreadyClosedException e) {
            throw RabbitExceptions.translate("Open channel", e);
        }
        if (channel == null) {
            throw new TransportException(Kind.CHANNEL, "No free channel number, channel max is " + connection.getChannelMax());
        }
        lastChannelId = channel.getChannelNumber();
        log.debugWithParams("Opened channel.",
                "channelNr", lastChannelId,
                "connection", connection.getClientProvidedName());
        return new RabbitProtocolChannel(channel);
    }

    @Override
    public void close() throws TransportException {
        if (!connection.isOpen()) {
            return;
        }
        try {
            connection.close();
        } catch (AlreadyClosedException ignored) {
            log.debugWithParams("Connection was closed while closing it.",
                    "connection", connection.getClientProvidedName());
        } catch (IOException e) {
            throw RabbitExceptions.translate("Close connection", e);
        }
    }

    @Override
    public boolean isOpen() {
        return connection.isOpen();
    }

    @Override
    public int getLastChannelId() {
        return lastChannelId;
    }

    @Override
    public int getChannelMax() {
        return connection.getChannelMax();
    }
}
