package com.meltwater.syncrabbit;

import com.meltwater.syncrabbit.transport.ProtocolEngine;
import com.meltwater.syncrabbit.transport.ProtocolSession;
import com.meltwater.syncrabbit.transport.SessionParameters;
import com.meltwater.syncrabbit.transport.TransportException;
import com.meltwater.syncrabbit.transport.rabbit.RabbitProtocolEngine;
import com.meltwater.syncrabbit.util.Logger;

import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TimeZone;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A (transient) connection to an AMQP broker.
 *
 * The connection holds a transport session only while it is connected. When any operation finds out that the
 * broker connection is gone the session is dropped, so {@link #isConnected()} always tells whether a
 * {@link #reconnect()} is needed.
 *
 * Settings changed through the setters take effect on the next connect.
 *
 * Instances are not thread safe.
 */
public class AmqpConnection {

    private static final Logger log = new Logger(AmqpConnection.class);
    private static final AtomicInteger connectionCount = new AtomicInteger();

    private final ProtocolEngine engine;
    private final ConnectionSettings settings;
    private final Set<AmqpChannel> channels = new LinkedHashSet<>();

    private ProtocolSession session;

    public AmqpConnection() {
        this(Collections.<String, Object>emptyMap());
    }

    /**
     * @param config any of the keys {@code host, port, vhost, login, password, connect_timeout, read_timeout,
     *               write_timeout, heartbeat, keepalive}, see {@link ConnectionSettings#fromMap(Map)}
     */
    public AmqpConnection(Map<String, ?> config) {
        this(ConnectionSettings.fromMap(config), new RabbitProtocolEngine());
    }

    public AmqpConnection(ConnectionSettings settings, ProtocolEngine engine) {
        this.settings = new ConnectionSettings(settings);
        this.engine = engine;
    }

    /**
     * Opens the transport session. Does nothing if the connection is already open.
     *
     * @return true
     * @throws AmqpConnectionException if the broker could not be reached or refused the login
     */
    public boolean connect() throws AmqpConnectionException {
        if (isConnected()) {
            log.debugWithParams("Already connected, ignoring connect.", "settings", settings);
            return true;
        }
        String connectionName = "sync-rabbit-" + connectionCount.incrementAndGet();
        SessionParameters parameters = SessionParameters.builder()
                .withHost(settings.getHost())
                .withPort(settings.getPort())
                .withVirtualHost(settings.getVhost())
                .withCredentials(settings.getLogin(), settings.getPassword())
                .withConnectTimeoutMillis(settings.getConnectTimeoutMillis())
                .withIoTimeoutMillis(settings.getIoTimeoutMillis())
                .withHeartbeatSeconds(settings.getHeartbeat())
                .withKeepalive(settings.isKeepalive())
                .withConnectionName(connectionName)
                .withClientProperties(clientProperties(connectionName))
                .build();
        try {
            session = engine.open(parameters);
        } catch (TransportException e) {
            session = null;
            log.warnWithParams("Failed to connect to broker.",
                    "host", settings.getHost(),
                    "port", settings.getPort(),
                    "vhost", settings.getVhost(),
                    "kind", e.getKind(),
                    "error", e.getMessage());
            throw new AmqpConnectionException("Could not connect to " + settings.getHost() + ":" + settings.getPort() + ": " + e.getMessage(), e);
        }
        log.infoWithParams("Connected to broker.",
                "host", settings.getHost(),
                "port", settings.getPort(),
                "vhost", settings.getVhost(),
                "name", connectionName);
        return true;
    }

    /**
     * Closes the transport session. Closing a closed connection is a no-op.
     *
     * @return true if the connection is closed cleanly (or was not open), false if the close failed. The connection
     * counts as closed afterwards in both cases.
     */
    public boolean disconnect() {
        if (session == null) {
            return true;
        }
        ProtocolSession closing = session;
        dropSession();
        try {
            closing.close();
        } catch (TransportException e) {
            log.warnWithParams("Failed to close the broker connection cleanly.", e,
                    "host", settings.getHost(),
                    "port", settings.getPort());
            return false;
        }
        log.infoWithParams("Disconnected from broker.",
                "host", settings.getHost(),
                "port", settings.getPort());
        return true;
    }

    /**
     * Disconnects (ignoring a failing close) and connects again.
     *
     * @return false if the new connection could not be opened
     */
    public boolean reconnect() {
        disconnect();
        try {
            return connect();
        } catch (AmqpConnectionException e) {
            log.warnWithParams("Reconnect failed.", e,
                    "host", settings.getHost(),
                    "port", settings.getPort());
            return false;
        }
    }

    public boolean pconnect() {
        throw new AmqpNotImplementedException("pconnect");
    }

    public boolean pdisconnect() {
        throw new AmqpNotImplementedException("pdisconnect");
    }

    public boolean preconnect() {
        throw new AmqpNotImplementedException("preconnect");
    }

    public boolean isPersistent() {
        return false;
    }

    public boolean isConnected() {
        if (session != null && !session.isOpen()) {
            sessionLost("Session found closed");
        }
        return session != null;
    }

    /**
     * @return the id of the most recently opened channel, 0 when not connected
     */
    public int getUsedChannels() {
        if (!isConnected()) {
            return 0;
        }
        return session.getLastChannelId();
    }

    /**
     * @return the channel max negotiated with the broker (0 meaning no limit), empty when not connected
     */
    public OptionalInt getMaxChannels() {
        if (!isConnected()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(session.getChannelMax());
    }

    public String getHost() {
        return settings.getHost();
    }

    public void setHost(String host) {
        settings.withHost(host);
    }

    public int getPort() {
        return settings.getPort();
    }

    public void setPort(int port) {
        settings.withPort(port);
    }

    public String getVhost() {
        return settings.getVhost();
    }

    public void setVhost(String vhost) {
        settings.withVhost(vhost);
    }

    public String getLogin() {
        return settings.getLogin();
    }

    public void setLogin(String login) {
        settings.withLogin(login);
    }

    public String getPassword() {
        return settings.getPassword();
    }

    public void setPassword(String password) {
        settings.withPassword(password);
    }

    public double getConnectTimeout() {
        return settings.getConnect_timeout();
    }

    public void setConnectTimeout(double seconds) {
        settings.withConnectTimeoutSecs(seconds);
    }

    public double getReadTimeout() {
        return settings.getRead_timeout();
    }

    public void setReadTimeout(double seconds) {
        settings.withReadTimeoutSecs(seconds);
    }

    public double getWriteTimeout() {
        return settings.getWrite_timeout();
    }

    public void setWriteTimeout(double seconds) {
        settings.withWriteTimeoutSecs(seconds);
    }

    /**
     * @deprecated use {@link #getReadTimeout()}
     */
    @Deprecated
    public double getTimeout() {
        return getReadTimeout();
    }

    /**
     * @deprecated use {@link #setReadTimeout(double)}
     */
    @Deprecated
    public void setTimeout(double seconds) {
        setReadTimeout(seconds);
    }

    public int getHeartbeat() {
        return settings.getHeartbeat();
    }

    public void setHeartbeat(int seconds) {
        settings.withHeartbeatSecs(seconds);
    }

    public boolean isKeepalive() {
        return settings.isKeepalive();
    }

    public void setKeepalive(boolean keepalive) {
        settings.withKeepalive(keepalive);
    }

    /**
     * @return a copy of the current settings
     */
    public ConnectionSettings getSettings() {
        return new ConnectionSettings(settings);
    }

    @Override
    public String toString() {
        return "AmqpConnection{" +
                "settings=" + settings +
                ", connected=" + (session != null) +
                '}';
    }

    ProtocolSession session() throws AmqpConnectionException {
        if (!isConnected()) {
            throw new AmqpConnectionException("Not connected to " + settings.getHost() + ":" + settings.getPort());
        }
        return session;
    }

    int getIoTimeoutMillis() {
        return settings.getIoTimeoutMillis();
    }

    void register(AmqpChannel channel) {
        channels.add(channel);
    }

    void unregister(AmqpChannel channel) {
        channels.remove(channel);
    }

    /**
     * Called when an operation observed that the broker connection is gone.
     */
    void sessionLost(Object cause) {
        if (session == null) {
            return;
        }
        log.warnWithParams("Connection to broker lost.",
                "host", settings.getHost(),
                "port", settings.getPort(),
                "cause", cause);
        dropSession();
    }

    private void dropSession() {
        session = null;
        List<AmqpChannel> open = new ArrayList<>(channels);
        channels.clear();
        for (AmqpChannel channel : open) {
            channel.connectionClosed();
        }
    }

    private Map<String, Object> clientProperties(String connectionName) {
        SimpleDateFormat sdf = new SimpleDateFormat("yyyy-MM-dd HH:mm:ss");
        sdf.setTimeZone(TimeZone.getTimeZone("UTC"));
        Map<String, Object> properties = new HashMap<>(settings.getClient_properties());
        properties.put("connection_name", connectionName);
        properties.put("connect_time", sdf.format(new Date()) + "Z");
        return properties;
    }
}
