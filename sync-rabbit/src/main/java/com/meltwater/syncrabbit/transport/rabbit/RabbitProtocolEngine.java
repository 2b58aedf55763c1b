package com.meltwater.syncrabbit.transport.rabbit;

import com.meltwater.syncrabbit.transport.ProtocolEngine;
import com.meltwater.syncrabbit.transport.ProtocolSession;
import com.meltwater.syncrabbit.transport.SessionParameters;
import com.meltwater.syncrabbit.transport.TransportException;
import com.meltwater.syncrabbit.transport.TransportException.Kind;
import com.meltwater.syncrabbit.util.Logger;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.SocketConfigurators;
import com.rabbitmq.client.impl.AMQConnection;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * {@link ProtocolEngine} backed by the RabbitMQ java client.
 */
public class RabbitProtocolEngine implements ProtocolEngine {

    private static final Logger log = new Logger(RabbitProtocolEngine.class);

    @Override
    public ProtocolSession open(SessionParameters parameters) throws TransportException {
        ConnectionFactory cf = createConnectionFactory(parameters);
        try {
            Connection connection = cf.newConnection(parameters.connectionName);
            log.infoWithParams("Successfully created connection to broker.",
                    "host", parameters.host,
                    "port", parameters.port,
                    "virtualHost", parameters.virtualHost,
                    "localPort", localPort(connection),
                    "name", parameters.connectionName);
            return new RabbitProtocolSession(connection);
        } catch (TimeoutException e) {
            throw new TransportException(Kind.CONNECTION, "Connect to broker timed out", e);
        } catch (IOException e) {
            throw new TransportException(Kind.CONNECTION, "Could not connect to broker: " + e.getMessage(), e);
        }
    }

    ConnectionFactory createConnectionFactory(SessionParameters parameters) {
        ConnectionFactory cf = new ConnectionFactory();
        cf.setHost(parameters.host);
        cf.setPort(parameters.port);
        cf.setVirtualHost(parameters.virtualHost);
        cf.setUsername(parameters.login);
        cf.setPassword(parameters.password);
        cf.setRequestedHeartbeat(parameters.heartbeatSeconds);
        cf.setConnectionTimeout(parameters.connectTimeoutMillis);
        cf.setHandshakeTimeout(Math.max(parameters.connectTimeoutMillis, parameters.ioTimeoutMillis));
        cf.setChannelRpcTimeout(parameters.ioTimeoutMillis);
        cf.setShutdownTimeout(parameters.ioTimeoutMillis);

        Map<String, Object> clientProperties = new HashMap<>(cf.getClientProperties());
        clientProperties.putAll(parameters.clientProperties);
        cf.setClientProperties(clientProperties);

        final boolean keepalive = parameters.keepalive;
        cf.setSocketConfigurator(socket -> {
            SocketConfigurators.defaultConfigurator().configure(socket);
            socket.setKeepAlive(keepalive);
        });
        cf.setRequestedChannelMax(0);//Hard coded ..
        cf.setAutomaticRecoveryEnabled(false);//Hard coded ..
        cf.setTopologyRecoveryEnabled(false);//Hard coded ..
        return cf;
    }

    private static Object localPort(Connection connection) {
        return connection instanceof AMQConnection ? ((AMQConnection) connection).getLocalPort() : "unknown";
    }
}
