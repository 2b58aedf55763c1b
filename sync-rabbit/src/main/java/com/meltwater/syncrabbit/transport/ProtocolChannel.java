package com.meltwater.syncrabbit.transport;

import com.rabbitmq.client.AMQP;

import java.util.Map;

/**
 * A multiplexed channel of a {@link ProtocolSession}.
 *
 * All request methods block for one request/response round trip, bounded by the session I/O timeout. Inbound
 * deliveries are never dispatched in the background: they are only handed to the {@link ConsumerListener}s from
 * inside {@link #waitForFrame()}.
 *
 * @see com.rabbitmq.client.Channel
 */
public interface ProtocolChannel {

    int getChannelNumber();

    boolean isOpen();

    void close() throws TransportException;

    void exchangeDeclare(String exchange, String type, boolean passive, boolean durable, boolean autoDelete,
                         Map<String, Object> arguments) throws TransportException;

    /**
     * Binds the {@code destination} exchange to the {@code source} exchange.
     */
    void exchangeBind(String destination, String source, String routingKey, Map<String, Object> arguments) throws TransportException;

    void exchangeUnbind(String destination, String source, String routingKey, Map<String, Object> arguments) throws TransportException;

    void exchangeDelete(String exchange, boolean ifUnused) throws TransportException;

    QueueStatus queueDeclare(String queue, boolean passive, boolean durable, boolean exclusive, boolean autoDelete,
                             Map<String, Object> arguments) throws TransportException;

    void queueBind(String queue, String exchange, String routingKey, Map<String, Object> arguments) throws TransportException;

    void queueUnbind(String queue, String exchange, String routingKey, Map<String, Object> arguments) throws TransportException;

    /**
     * @return the number of messages deleted with the queue
     */
    int queueDelete(String queue, boolean ifUnused, boolean ifEmpty) throws TransportException;

    /**
     * @return the number of messages purged
     */
    int queuePurge(String queue) throws TransportException;

    void basicPublish(String exchange, String routingKey, boolean mandatory, boolean immediate,
                      AMQP.BasicProperties properties, byte[] body) throws TransportException;

    /**
     * Puts the channel in publisher confirm mode.
     */
    void confirmSelect() throws TransportException;

    /**
     * Blocks until every message published since the last call has been acked, nacked or returned by the broker.
     *
     * @param timeoutMillis how long to wait, 0 to wait without limit
     * @return true if no message was nacked
     * @throws TransportException of kind {@link TransportException.Kind#TIMEOUT} when the time is up
     */
    boolean waitForConfirms(long timeoutMillis) throws TransportException;

    /**
     * Registers a subscription.
     *
     * @param consumerTag the tag to use, empty to let the broker generate one
     * @return the consumer tag of the subscription
     */
    String basicConsume(String queue, String consumerTag, boolean noLocal, boolean autoAck, boolean exclusive,
                        ConsumerListener listener) throws TransportException;

    void basicCancel(String consumerTag) throws TransportException;

    void basicAck(long deliveryTag, boolean multiple) throws TransportException;

    void basicNack(long deliveryTag, boolean multiple, boolean requeue) throws TransportException;

    void basicReject(long deliveryTag, boolean requeue) throws TransportException;

    void basicQos(int prefetchSize, int prefetchCount) throws TransportException;

    void basicRecover(boolean requeue) throws TransportException;

    void txSelect() throws TransportException;

    void txCommit() throws TransportException;

    void txRollback() throws TransportException;

    /**
     * Blocks until one inbound frame is available and processes it, invoking the listener it belongs to.
     */
    void waitForFrame() throws TransportException;

    /**
     * Readiness check with zero timeout.
     *
     * @return true if {@link #waitForFrame()} would not block
     */
    boolean isFrameReady();

    /**
     * @return the number of subscriptions on this channel that have not been cancelled
     */
    int pendingSubscriptionCount();
}
