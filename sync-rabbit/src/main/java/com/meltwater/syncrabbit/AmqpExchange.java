package com.meltwater.syncrabbit;

import com.meltwater.syncrabbit.flags.AmqpFlags;
import com.meltwater.syncrabbit.flags.DeleteOptions;
import com.meltwater.syncrabbit.flags.ExchangeOptions;
import com.meltwater.syncrabbit.flags.FlagTranslator;
import com.meltwater.syncrabbit.flags.PublishOptions;
import com.meltwater.syncrabbit.transport.TransportException;
import com.meltwater.syncrabbit.util.Logger;
import com.rabbitmq.client.AMQP;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * An exchange on an {@link AmqpChannel}.
 *
 * Every failed request throws: an {@link AmqpConnectionException} when the broker connection is gone, an
 * {@link AmqpExchangeException} for anything else the broker (or the transport) refused.
 *
 * Publisher confirms are on by default: {@link #publish(byte[], String, int, Map)} then only returns once the broker
 * has taken responsibility for the message.
 */
public class AmqpExchange {

    private static final Logger log = new Logger(AmqpExchange.class);

    private final AmqpChannel channel;

    private String name = "";
    private ExchangeType type;
    private int flags = AmqpFlags.NOPARAM;
    private Map<String, Object> arguments = new LinkedHashMap<>();
    private boolean publisherConfirms = true;

    /**
     * @throws AmqpConnectionException if the channel's connection is not open
     * @throws AmqpChannelException if the channel is closed
     */
    public AmqpExchange(AmqpChannel channel) throws AmqpConnectionException, AmqpChannelException {
        if (!channel.getConnection().isConnected()) {
            throw new AmqpConnectionException("Could not create exchange, connection is not open");
        }
        if (!channel.isConnected()) {
            throw new AmqpChannelException("Could not create exchange, channel " + channel.getChannelId() + " is closed");
        }
        this.channel = channel;
    }

    /**
     * Declares the exchange with the current type, flags and arguments.
     *
     * @throws AmqpExchangeException if no type is set or the broker refused the declare
     */
    public boolean declareExchange() throws AmqpException {
        if (type == null) {
            throw new AmqpExchangeException("Could not declare exchange '" + name + "', no exchange type set");
        }
        ExchangeOptions options = FlagTranslator.toExchangeOptions(flags);
        request("Declare", transport -> {
            transport.exchangeDeclare(name, type.name(), options.passive, options.durable, options.autoDelete, arguments);
            return null;
        });
        log.infoWithParams("Exchange declared.",
                "exchange", name,
                "type", type,
                "options", options);
        return true;
    }

    public boolean bind(String exchangeName, String routingKey) throws AmqpException {
        return bind(exchangeName, routingKey, Collections.<String, Object>emptyMap());
    }

    /**
     * Binds the exchange called {@code exchangeName} to this exchange: messages published to this exchange that
     * match the binding are routed on to {@code exchangeName}.
     *
     * @param routingKey the binding key, null for the empty key
     * @param arguments passed to the broker as they are
     */
    public boolean bind(String exchangeName, String routingKey, Map<String, Object> arguments) throws AmqpException {
        String key = routingKey == null ? "" : routingKey;
        request("Bind", transport -> {
            transport.exchangeBind(exchangeName, name, key, arguments);
            return null;
        });
        return true;
    }

    public boolean unbind(String exchangeName, String routingKey) throws AmqpException {
        return unbind(exchangeName, routingKey, Collections.<String, Object>emptyMap());
    }

    /**
     * Removes a binding made with {@link #bind(String, String, Map)}.
     */
    public boolean unbind(String exchangeName, String routingKey, Map<String, Object> arguments) throws AmqpException {
        String key = routingKey == null ? "" : routingKey;
        request("Unbind", transport -> {
            transport.exchangeUnbind(exchangeName, name, key, arguments);
            return null;
        });
        return true;
    }

    public boolean delete() throws AmqpException {
        return delete(null, AmqpFlags.NOPARAM);
    }

    /**
     * @param exchangeName the exchange to delete, null for this exchange
     * @param flags {@link AmqpFlags#IFUNUSED} to only delete an exchange without bindings
     */
    public boolean delete(String exchangeName, int flags) throws AmqpException {
        DeleteOptions options = FlagTranslator.toExchangeDeleteOptions(flags);
        String target = exchangeName == null ? name : exchangeName;
        request("Delete", transport -> {
            transport.exchangeDelete(target, options.ifUnused);
            return null;
        });
        log.infoWithParams("Exchange deleted.",
                "exchange", target,
                "options", options);
        return true;
    }

    public boolean publish(String message) throws AmqpException {
        return publish(message, null);
    }

    public boolean publish(String message, String routingKey) throws AmqpException {
        return publish(message.getBytes(StandardCharsets.UTF_8), routingKey, AmqpFlags.NOPARAM, Collections.<String, Object>emptyMap());
    }

    public boolean publish(String message, String routingKey, int flags, Map<String, ?> attributes) throws AmqpException {
        return publish(message.getBytes(StandardCharsets.UTF_8), routingKey, flags, attributes);
    }

    /**
     * Publishes a message to this exchange.
     *
     * With publisher confirms on, blocks until the broker acknowledged the message (or returned it, for a mandatory
     * message that could not be routed), at most for the I/O timeout of the connection.
     *
     * @param routingKey null for the empty key
     * @param flags {@link AmqpFlags#MANDATORY} and/or {@link AmqpFlags#IMMEDIATE}
     * @param attributes the message properties, see {@link PublishAttributes} for the keys. A {@code headers} map
     *                   becomes the application headers of the message.
     * @throws AmqpExchangeException if the broker refused or nacked the message, or did not confirm it in time
     */
    public boolean publish(byte[] body, String routingKey, int flags, Map<String, ?> attributes) throws AmqpException {
        PublishOptions options = FlagTranslator.toPublishOptions(flags);
        AMQP.BasicProperties properties = PublishAttributes.toProperties(attributes);
        String key = routingKey == null ? "" : routingKey;
        try {
            if (publisherConfirms) {
                channel.ensureConfirmMode();
            }
            channel.call("Publish to exchange " + name, transport -> {
                transport.basicPublish(name, key, options.mandatory, options.immediate, properties, body);
                return null;
            });
            if (publisherConfirms) {
                long timeout = channel.getIoTimeoutMillis();
                boolean acked = channel.call("Wait for confirm from exchange " + name,
                        transport -> transport.waitForConfirms(timeout));
                if (!acked) {
                    throw new AmqpExchangeException("Message to exchange '" + name + "' with routing key '" + key + "' was nacked by the broker");
                }
            }
        } catch (TransportException e) {
            throw new AmqpExchangeException("Publish to exchange '" + name + "' failed: " + e.getMessage(), e);
        }
        if (log.isTraceEnabled()) {
            log.traceWithParams("Message published.",
                    "exchange", name,
                    "routingKey", key,
                    "options", options,
                    "body", body);
        }
        return true;
    }

    public String getName() {
        return name;
    }

    public boolean setName(String name) {
        this.name = name == null ? "" : name;
        return true;
    }

    /**
     * @return the type, empty until one is set
     */
    public Optional<ExchangeType> getType() {
        return Optional.ofNullable(type);
    }

    /**
     * @param type one of {@code direct, fanout, topic, headers}
     * @return false (and the type unchanged) for any other value
     */
    public boolean setType(String type) {
        Optional<ExchangeType> parsed = ExchangeType.parse(type);
        if (!parsed.isPresent()) {
            log.debugWithParams("Ignoring invalid exchange type.", "exchange", name, "type", type);
            return false;
        }
        this.type = parsed.get();
        return true;
    }

    public boolean setType(ExchangeType type) {
        if (type == null) {
            return false;
        }
        this.type = type;
        return true;
    }

    public int getFlags() {
        return flags;
    }

    /**
     * @param flags any of {@link AmqpFlags#DURABLE}, {@link AmqpFlags#PASSIVE} and {@link AmqpFlags#AUTODELETE}
     * @return false (and the flags unchanged) if any other bit is set
     */
    public boolean setFlags(int flags) {
        if (!AmqpFlags.isSubsetOf(flags, AmqpFlags.EXCHANGE_FLAGS)) {
            return false;
        }
        this.flags = flags;
        return true;
    }

    public Map<String, Object> getArguments() {
        return Collections.unmodifiableMap(arguments);
    }

    public Optional<Object> getArgument(String key) {
        return Optional.ofNullable(arguments.get(key));
    }

    public boolean setArguments(Map<String, ?> arguments) {
        this.arguments = new LinkedHashMap<>(arguments);
        return true;
    }

    public void setArgument(String key, Object value) {
        arguments.put(key, value);
    }

    public boolean hasPublisherConfirms() {
        return publisherConfirms;
    }

    public void setPublisherConfirms(boolean publisherConfirms) {
        this.publisherConfirms = publisherConfirms;
    }

    public AmqpChannel getChannel() {
        return channel;
    }

    public AmqpConnection getConnection() {
        return channel.getConnection();
    }

    @Override
    public String toString() {
        return "AmqpExchange{" +
                "name='" + name + '\'' +
                ", type=" + type +
                ", flags=" + flags +
                ", publisherConfirms=" + publisherConfirms +
                '}';
    }

    private void request(String operation, AmqpChannel.TransportCall<?> call) throws AmqpException {
        try {
            channel.call(operation + " exchange " + name, call);
        } catch (TransportException e) {
            throw new AmqpExchangeException(operation + " exchange '" + name + "' failed: " + e.getMessage(), e);
        }
    }
}
