package com.meltwater.syncrabbit.broker;

import com.meltwater.syncrabbit.transport.ProtocolEngine;
import com.meltwater.syncrabbit.transport.ProtocolSession;
import com.meltwater.syncrabbit.transport.SessionParameters;
import com.meltwater.syncrabbit.transport.TransportException;
import com.meltwater.syncrabbit.transport.TransportException.Kind;
import com.meltwater.syncrabbit.util.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A single threaded AMQP broker living in the test JVM, reached through the {@link ProtocolEngine} interface.
 *
 * <p>
 * It routes through direct, fanout, topic and headers exchanges (and exchange to exchange bindings), hands out
 * per channel delivery tags, tracks unacknowledged messages and answers publisher confirms. Like RabbitMQ it closes
 * a channel on a request error (404 NOT_FOUND, 406 PRECONDITION_FAILED) and the whole connection on
 * {@code immediate} publishes (540 NOT_IMPLEMENTED).
 * </p>
 *
 * <p>
 * Frames are only dispatched from {@code waitForFrame()}. Since nothing runs in the background, waiting on a channel
 * without a ready frame fails with a {@link Kind#TIMEOUT} instead of blocking the test forever.
 * </p>
 */
public class InMemoryBroker implements ProtocolEngine {

    private static final Logger log = new Logger(InMemoryBroker.class);

    static final int NOT_FOUND = 404;
    static final int PRECONDITION_FAILED = 406;
    static final int ACCESS_REFUSED = 403;
    static final int COMMAND_INVALID = 503;
    static final int NOT_IMPLEMENTED = 540;

    final Map<String, BrokerExchange> exchanges = new LinkedHashMap<>();
    final Map<String, BrokerQueue> queues = new LinkedHashMap<>();
    private final List<BrokerSession> sessions = new ArrayList<>();
    private final List<StoredMessage> returned = new ArrayList<>();

    private int generatedNames;
    private int channelMax = 2047;
    private boolean refuseConnections;
    private boolean failNextClose;
    private boolean nackConfirms;
    private boolean holdConfirms;
    private String requiredLogin;
    private String requiredPassword;
    private SessionParameters lastParameters;

    public InMemoryBroker() {
        for (String type : new String[]{"direct", "fanout", "topic", "headers"}) {
            exchanges.put("amq." + type, new BrokerExchange("amq." + type, type, true, false));
        }
    }

    @Override
    public ProtocolSession open(SessionParameters parameters) throws TransportException {
        lastParameters = parameters;
        if (refuseConnections) {
            throw new TransportException(Kind.CONNECTION, "Connection refused: " + parameters.host + ":" + parameters.port);
        }
        if (requiredLogin != null
                && (!requiredLogin.equals(parameters.login) || !requiredPassword.equals(parameters.password))) {
            throw new TransportException(Kind.CONNECTION, ACCESS_REFUSED, "ACCESS_REFUSED - login refused for user '" + parameters.login + "'", null);
        }
        BrokerSession session = new BrokerSession(this);
        sessions.add(session);
        log.debugWithParams("Session opened.", "name", parameters.connectionName);
        return session;
    }

    public InMemoryBroker refuseConnections(boolean refuse) {
        this.refuseConnections = refuse;
        return this;
    }

    public InMemoryBroker requireCredentials(String login, String password) {
        this.requiredLogin = login;
        this.requiredPassword = password;
        return this;
    }

    /**
     * Drops every open connection, as if the broker went away.
     */
    public void killConnections() {
        for (BrokerSession session : new ArrayList<>(sessions)) {
            session.kill();
        }
        sessions.clear();
    }

    /**
     * The next session close fails with a lost connection.
     */
    public void failNextClose() {
        this.failNextClose = true;
    }

    public void nackConfirms(boolean nack) {
        this.nackConfirms = nack;
    }

    /**
     * Confirms never arrive: waiting for them times out.
     */
    public void holdConfirms(boolean hold) {
        this.holdConfirms = hold;
    }

    public void setChannelMax(int channelMax) {
        this.channelMax = channelMax;
    }

    public SessionParameters getLastParameters() {
        return lastParameters;
    }

    public int openSessionCount() {
        int open = 0;
        for (BrokerSession session : sessions) {
            if (session.isOpen()) {
                open++;
            }
        }
        return open;
    }

    public boolean hasQueue(String name) {
        return queues.containsKey(name);
    }

    public boolean hasExchange(String name) {
        return exchanges.containsKey(name);
    }

    public String exchangeType(String name) {
        return exchanges.containsKey(name) ? exchanges.get(name).type : null;
    }

    public int messageCount(String queue) {
        return queues.containsKey(queue) ? queues.get(queue).ready.size() : 0;
    }

    public int consumerCount(String queue) {
        return queues.containsKey(queue) ? queues.get(queue).consumers.size() : 0;
    }

    public int bindingCount(String exchange) {
        return exchanges.containsKey(exchange) ? exchanges.get(exchange).bindings.size() : 0;
    }

    public int unackedCount() {
        int unacked = 0;
        for (BrokerSession session : sessions) {
            unacked += session.unackedCount();
        }
        return unacked;
    }

    public List<String> returnedRoutingKeys() {
        List<String> keys = new ArrayList<>();
        for (StoredMessage message : returned) {
            keys.add(message.routingKey);
        }
        return Collections.unmodifiableList(keys);
    }

    int getChannelMax() {
        return channelMax;
    }

    boolean takeFailNextClose() {
        boolean fail = failNextClose;
        failNextClose = false;
        return fail;
    }

    boolean isNackConfirms() {
        return nackConfirms;
    }

    boolean isHoldConfirms() {
        return holdConfirms;
    }

    String generateName(String prefix) {
        return prefix + (++generatedNames);
    }

    /**
     * @return false if the message could not be routed to any queue
     */
    boolean publish(String exchange, StoredMessage message) {
        Set<BrokerQueue> targets = route(exchange, message.routingKey, message.properties.getHeaders());
        for (BrokerQueue queue : targets) {
            queue.ready.add(message.copy());
            deliverReady(queue);
        }
        return !targets.isEmpty();
    }

    void returnMessage(StoredMessage message) {
        returned.add(message);
    }

    void deliverReady(BrokerQueue queue) {
        while (!queue.ready.isEmpty()) {
            BrokerQueue.Consumer consumer = queue.nextConsumerWithCapacity();
            if (consumer == null) {
                return;
            }
            consumer.channel.deliver(consumer, queue, queue.ready.poll());
        }
    }

    void deliverAllReady() {
        for (BrokerQueue queue : new ArrayList<>(queues.values())) {
            deliverReady(queue);
        }
    }

    void removeQueue(BrokerQueue queue) {
        queues.remove(queue.name);
        for (BrokerExchange exchange : exchanges.values()) {
            exchange.bindings.removeIf(binding -> !binding.toExchange && binding.destination.equals(queue.name));
        }
        for (BrokerQueue.Consumer consumer : new ArrayList<>(queue.consumers)) {
            consumer.channel.notifyCancelled(consumer);
        }
        queue.consumers.clear();
    }

    void removeExchange(BrokerExchange exchange) {
        exchanges.remove(exchange.name);
        for (BrokerExchange other : exchanges.values()) {
            other.bindings.removeIf(binding -> binding.toExchange && binding.destination.equals(exchange.name));
        }
    }

    private Set<BrokerQueue> route(String exchange, String routingKey, Map<String, Object> headers) {
        Set<BrokerQueue> targets = new LinkedHashSet<>();
        if (exchange.isEmpty()) {
            BrokerQueue queue = queues.get(routingKey);
            if (queue != null) {
                targets.add(queue);
            }
            return targets;
        }
        routeVia(exchanges.get(exchange), routingKey, headers == null ? Collections.<String, Object>emptyMap() : headers,
                targets, new HashSet<>());
        return targets;
    }

    private void routeVia(BrokerExchange exchange, String routingKey, Map<String, Object> headers,
                          Set<BrokerQueue> targets, Set<String> visited) {
        if (exchange == null || !visited.add(exchange.name)) {
            return;
        }
        for (BrokerExchange.Binding binding : exchange.bindings) {
            if (!exchange.matches(binding, routingKey, headers)) {
                continue;
            }
            if (binding.toExchange) {
                routeVia(exchanges.get(binding.destination), routingKey, headers, targets, visited);
            } else if (queues.containsKey(binding.destination)) {
                targets.add(queues.get(binding.destination));
            }
        }
    }
}
