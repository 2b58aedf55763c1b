package com.meltwater.syncrabbit.transport;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Everything a {@link ProtocolEngine} needs to open a session.
 *
 * Read and write timeouts are not passed separately: the engine gets one combined I/O timeout.
 */
public class SessionParameters {

    public final String host;
    public final int port;
    public final String virtualHost;
    public final String login;
    public final String password;
    public final int connectTimeoutMillis;
    public final int ioTimeoutMillis;
    public final int heartbeatSeconds;
    public final boolean keepalive;
    public final String connectionName;
    public final Map<String, Object> clientProperties;

    private SessionParameters(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.virtualHost = builder.virtualHost;
        this.login = builder.login;
        this.password = builder.password;
        this.connectTimeoutMillis = builder.connectTimeoutMillis;
        this.ioTimeoutMillis = builder.ioTimeoutMillis;
        this.heartbeatSeconds = builder.heartbeatSeconds;
        this.keepalive = builder.keepalive;
        this.connectionName = builder.connectionName;
        this.clientProperties = builder.clientProperties.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "{" +
                "host:'" + host + '\'' +
                ", port:" + port +
                ", virtualHost:'" + virtualHost + '\'' +
                ", login:'" + login + '\'' +
                ", connectTimeoutMillis:" + connectTimeoutMillis +
                ", ioTimeoutMillis:" + ioTimeoutMillis +
                ", heartbeatSeconds:" + heartbeatSeconds +
                ", keepalive:" + keepalive +
                ", connectionName:'" + connectionName + '\'' +
                '}';
    }

    public static class Builder {
        private String host = "localhost";
        private int port = 5672;
        private String virtualHost = "/";
        private String login = "";
        private String password = "";
        private int connectTimeoutMillis;
        private int ioTimeoutMillis;
        private int heartbeatSeconds;
        private boolean keepalive;
        private String connectionName = "";
        private final ImmutableMap.Builder<String, Object> clientProperties = ImmutableMap.builder();

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withVirtualHost(String virtualHost) {
            this.virtualHost = virtualHost;
            return this;
        }

        public Builder withCredentials(String login, String password) {
            this.login = login;
            this.password = password;
            return this;
        }

        public Builder withConnectTimeoutMillis(int connectTimeoutMillis) {
            this.connectTimeoutMillis = connectTimeoutMillis;
            return this;
        }

        public Builder withIoTimeoutMillis(int ioTimeoutMillis) {
            this.ioTimeoutMillis = ioTimeoutMillis;
            return this;
        }

        public Builder withHeartbeatSeconds(int heartbeatSeconds) {
            this.heartbeatSeconds = heartbeatSeconds;
            return this;
        }

        public Builder withKeepalive(boolean keepalive) {
            this.keepalive = keepalive;
            return this;
        }

        public Builder withConnectionName(String connectionName) {
            this.connectionName = connectionName;
            return this;
        }

        public Builder withClientProperties(Map<String, ?> clientProperties) {
            this.clientProperties.putAll(clientProperties);
            return this;
        }

        public SessionParameters build() {
            return new SessionParameters(this);
        }
    }
}
