package com.meltwater.syncrabbit;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.meltwater.syncrabbit.util.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The broker address, credentials and timeouts of an {@link AmqpConnection}.
 *
 * Settings can be built with the {@code with...} methods or read from a configuration map with
 * {@link #fromMap(Map)}, which recognizes the keys {@code host, port, vhost, login, password, connect_timeout,
 * read_timeout, write_timeout, heartbeat, keepalive}. Missing keys keep their defaults.
 *
 * Timeouts are in seconds and may be fractional.
 */
public class ConnectionSettings {

    private static final Logger log = new Logger(ConnectionSettings.class);

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 5672;
    public static final String DEFAULT_VHOST = "/";
    public static final double DEFAULT_TIMEOUT_SECS = 3;
    public static final int DEFAULT_HEARTBEAT = 0; //disabled

    public static final int MAX_HOST_LENGTH = 1024;
    public static final int MAX_CREDENTIAL_LENGTH = 128;

    private static final Set<String> KNOWN_KEYS = ImmutableSet.of(
            "host", "port", "vhost", "login", "password",
            "connect_timeout", "read_timeout", "write_timeout", "timeout",
            "heartbeat", "keepalive");

    private final Map<String, Object> defaultClientCapabilities = ImmutableMap.of(
            //Lets us receive cancellation events, such as the queue being deleted
            "consumer_cancel_notify", true,
            "exchange_exchange_bindings", true,
            "basic.nack", true,
            "publisher_confirms", true);

    private String host = DEFAULT_HOST;
    private int port = DEFAULT_PORT;
    private String vhost = DEFAULT_VHOST;
    private String login = "";
    private String password = "";
    private double connect_timeout = DEFAULT_TIMEOUT_SECS;
    private double read_timeout = DEFAULT_TIMEOUT_SECS;
    private double write_timeout = DEFAULT_TIMEOUT_SECS;
    private int heartbeat = DEFAULT_HEARTBEAT; //in seconds
    private boolean keepalive = false;

    private Map<String, String> client_properties = new HashMap<>();

    public ConnectionSettings() {}

    public ConnectionSettings(ConnectionSettings that) {
        this.host = that.host;
        this.port = that.port;
        this.vhost = that.vhost;
        this.login = that.login;
        this.password = that.password;
        this.connect_timeout = that.connect_timeout;
        this.read_timeout = that.read_timeout;
        this.write_timeout = that.write_timeout;
        this.heartbeat = that.heartbeat;
        this.keepalive = that.keepalive;
        this.client_properties = new HashMap<>(that.client_properties);
    }

    /**
     * Merges a configuration map over the defaults.
     *
     * @throws IllegalArgumentException if a value can not be converted or is out of range
     */
    public static ConnectionSettings fromMap(Map<String, ?> config) {
        ConnectionSettings settings = new ConnectionSettings();
        for (Map.Entry<String, ?> entry : config.entrySet()) {
            if (!KNOWN_KEYS.contains(entry.getKey())) {
                log.warnWithParams("Ignoring unknown connection setting.", "key", entry.getKey());
            }
        }
        if (config.get("host") != null) settings.withHost(asString("host", config.get("host")));
        if (config.get("port") != null) settings.withPort(asInt("port", config.get("port")));
        if (config.get("vhost") != null) settings.withVhost(asString("vhost", config.get("vhost")));
        if (config.get("login") != null) settings.withLogin(asString("login", config.get("login")));
        if (config.get("password") != null) settings.withPassword(asString("password", config.get("password")));
        if (config.get("connect_timeout") != null) settings.withConnectTimeoutSecs(asDouble("connect_timeout", config.get("connect_timeout")));
        if (config.get("timeout") != null) settings.withReadTimeoutSecs(asDouble("timeout", config.get("timeout")));
        if (config.get("read_timeout") != null) settings.withReadTimeoutSecs(asDouble("read_timeout", config.get("read_timeout")));
        if (config.get("write_timeout") != null) settings.withWriteTimeoutSecs(asDouble("write_timeout", config.get("write_timeout")));
        if (config.get("heartbeat") != null) settings.withHeartbeatSecs(asInt("heartbeat", config.get("heartbeat")));
        if (config.get("keepalive") != null) settings.withKeepalive(asBoolean("keepalive", config.get("keepalive")));
        return settings;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getVhost() {
        return vhost;
    }

    public String getLogin() {
        return login;
    }

    public String getPassword() {
        return password;
    }

    public double getConnect_timeout() {
        return connect_timeout;
    }

    public double getRead_timeout() {
        return read_timeout;
    }

    public double getWrite_timeout() {
        return write_timeout;
    }

    public int getHeartbeat() {
        return heartbeat;
    }

    public boolean isKeepalive() {
        return keepalive;
    }

    public int getConnectTimeoutMillis() {
        return toMillis(connect_timeout);
    }

    /**
     * The transport is configured with one I/O timeout: the larger of the read and write timeouts.
     */
    public int getIoTimeoutMillis() {
        return toMillis(Math.max(read_timeout, write_timeout));
    }

    public Map<String, Object> getClient_properties() {
        Map<String, Object> properties = new HashMap<>(client_properties);
        properties.put("capabilities", defaultClientCapabilities);
        return properties;
    }

    public ConnectionSettings withHost(String host) {
        checkArgument(host != null && !host.isEmpty() && host.length() <= MAX_HOST_LENGTH,
                "host must be between 1 and %s characters", MAX_HOST_LENGTH);
        this.host = host;
        return this;
    }

    public ConnectionSettings withPort(int port) {
        checkArgument(port > 0 && port <= 65535, "port must be between 1 and 65535, was %s", port);
        this.port = port;
        return this;
    }

    public ConnectionSettings withVhost(String vhost) {
        checkArgument(vhost != null && vhost.length() <= MAX_CREDENTIAL_LENGTH,
                "vhost must be at most %s characters", MAX_CREDENTIAL_LENGTH);
        this.vhost = vhost;
        return this;
    }

    public ConnectionSettings withLogin(String login) {
        checkArgument(login != null && login.length() <= MAX_CREDENTIAL_LENGTH,
                "login must be at most %s characters", MAX_CREDENTIAL_LENGTH);
        this.login = login;
        return this;
    }

    public ConnectionSettings withPassword(String password) {
        checkArgument(password != null && password.length() <= MAX_CREDENTIAL_LENGTH,
                "password must be at most %s characters", MAX_CREDENTIAL_LENGTH);
        this.password = password;
        return this;
    }

    public ConnectionSettings withConnectTimeoutSecs(double connect_timeout) {
        checkTimeout("connect_timeout", connect_timeout);
        this.connect_timeout = connect_timeout;
        return this;
    }

    public ConnectionSettings withReadTimeoutSecs(double read_timeout) {
        checkTimeout("read_timeout", read_timeout);
        this.read_timeout = read_timeout;
        return this;
    }

    public ConnectionSettings withWriteTimeoutSecs(double write_timeout) {
        checkTimeout("write_timeout", write_timeout);
        this.write_timeout = write_timeout;
        return this;
    }

    public ConnectionSettings withHeartbeatSecs(int heartbeat) {
        checkArgument(heartbeat >= 0, "heartbeat must be 0 or greater, was %s", heartbeat);
        this.heartbeat = heartbeat;
        return this;
    }

    public ConnectionSettings withKeepalive(boolean keepalive) {
        this.keepalive = keepalive;
        return this;
    }

    public ConnectionSettings withClientProperties(Map<String, String> client_properties) {
        checkArgument(client_properties != null, "client_properties must not be null");
        this.client_properties = new HashMap<>(client_properties);
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        ConnectionSettings that = (ConnectionSettings) o;

        if (port != that.port) return false;
        if (Double.compare(that.connect_timeout, connect_timeout) != 0) return false;
        if (Double.compare(that.read_timeout, read_timeout) != 0) return false;
        if (Double.compare(that.write_timeout, write_timeout) != 0) return false;
        if (heartbeat != that.heartbeat) return false;
        if (keepalive != that.keepalive) return false;
        if (!host.equals(that.host)) return false;
        if (!vhost.equals(that.vhost)) return false;
        if (!login.equals(that.login)) return false;
        if (!password.equals(that.password)) return false;
        return client_properties.equals(that.client_properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, vhost, login, password,
                connect_timeout, read_timeout, write_timeout, heartbeat, keepalive, client_properties);
    }

    @Override
    public String toString() {
        return "{" +
                "host:'" + host + '\'' +
                ", port:" + port +
                ", vhost:'" + vhost + '\'' +
                ", login:'" + login + '\'' +
                ", password:'" + (password.isEmpty() ? "" : "****") + '\'' +
                ", connect_timeout:" + connect_timeout +
                ", read_timeout:" + read_timeout +
                ", write_timeout:" + write_timeout +
                ", heartbeat:" + heartbeat +
                ", keepalive:" + keepalive +
                ", client_properties:" + mapToString(client_properties) +
                '}';
    }

    private String mapToString(Map<String, String> map) {
        StringBuilder builder = new StringBuilder();
        builder.append("{");
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, String> e : map.entrySet()) {
            parts.add(e.getKey() + ":'" + e.getValue() + "'");
        }
        Joiner.on(", ").appendTo(builder, parts);
        return builder.append("}").toString();
    }

    private static int toMillis(double seconds) {
        return (int) Math.min(Integer.MAX_VALUE, Math.round(seconds * 1000));
    }

    private static void checkTimeout(String name, double seconds) {
        checkArgument(seconds >= 0 && !Double.isNaN(seconds), "%s must be 0 or greater, was %s", name, seconds);
    }

    private static String asString(String key, Object value) {
        return value.toString();
    }

    private static int asInt(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, was '" + value + "'", e);
        }
    }

    private static double asDouble(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, was '" + value + "'", e);
        }
    }

    private static boolean asBoolean(String key, Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue() != 0;
        }
        String text = value.toString().trim().toLowerCase();
        if (text.equals("true") || text.equals("1")) {
            return true;
        }
        if (text.equals("false") || text.equals("0") || text.isEmpty()) {
            return false;
        }
        throw new IllegalArgumentException(key + " must be a boolean, was '" + value + "'");
    }
}
