package com.meltwater.syncrabbit;

import com.meltwater.syncrabbit.transport.ConsumerListener;
import com.meltwater.syncrabbit.transport.ProtocolChannel;
import com.meltwater.syncrabbit.transport.TransportException;
import com.meltwater.syncrabbit.util.Logger;
import com.rabbitmq.client.Delivery;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A channel of an {@link AmqpConnection}. Exchanges and queues are declared, bound and consumed "on" a channel.
 *
 * The channel does not own its connection. It owns the one place where inbound frames are read: both
 * {@link AmqpQueue#get(int)} and {@link AmqpQueue#consume(ConsumeCallback, int, String)} pump frames through it,
 * and deliveries are dispatched here to the subscription they belong to. A subscription registered without a
 * callback hands its deliveries to the channel's default handler, the first callback any consume on this channel
 * registered.
 */
public class AmqpChannel {

    private static final Logger log = new Logger(AmqpChannel.class);

    private final AmqpConnection connection;
    private final ProtocolChannel transport;
    private final int channelId;

    private final Map<String, Subscription> subscriptions = new LinkedHashMap<>();
    private final Deque<Undelivered> undelivered = new ArrayDeque<>();
    private final ConsumerListener dispatcher = new Dispatcher();

    private Subscription defaultHandler;
    private boolean stopRequested;
    private AmqpException callbackFailure;

    private boolean closed;
    private boolean confirmMode;
    private int prefetchCount;
    private int prefetchSize;

    /**
     * Opens a new channel on the connection.
     *
     * @throws AmqpConnectionException if the connection is not open
     * @throws AmqpChannelException if the broker did not hand out a channel
     */
    public AmqpChannel(AmqpConnection connection) throws AmqpConnectionException, AmqpChannelException {
        this.connection = connection;
        try {
            this.transport = connection.session().openChannel();
        } catch (TransportException e) {
            if (e.isConnectionLoss()) {
                connection.sessionLost(e);
                throw new AmqpConnectionException("Could not open channel, connection lost", e);
            }
            throw new AmqpChannelException("Could not open channel: " + e.getMessage(), e);
        }
        this.channelId = transport.getChannelNumber();
        connection.register(this);
        log.infoWithParams("Channel opened.",
                "channelId", channelId,
                "host", connection.getHost());
    }

    public boolean isConnected() {
        return !closed && connection.isConnected() && transport.isOpen();
    }

    public int getChannelId() {
        return channelId;
    }

    public AmqpConnection getConnection() {
        return connection;
    }

    /**
     * Closes the channel. Subscriptions on it end, unacknowledged messages go back to their queues.
     */
    public void close() {
        if (closed) {
            return;
        }
        markClosed();
        connection.unregister(this);
        try {
            transport.close();
            log.infoWithParams("Channel closed.", "channelId", channelId);
        } catch (TransportException e) {
            log.warnWithParams("Failed to close channel cleanly.", e,
                    "channelId", channelId,
                    "kind", e.getKind());
        }
    }

    public int getPrefetchCount() {
        return prefetchCount;
    }

    /**
     * Limits the number of unacknowledged messages the broker sends to consumers on this channel. 0 means no limit.
     */
    public boolean setPrefetchCount(int count) throws AmqpException {
        return qos(prefetchSize, count);
    }

    public int getPrefetchSize() {
        return prefetchSize;
    }

    /**
     * Limits the size in bytes of unacknowledged messages the broker sends to consumers on this channel. 0 means no limit.
     */
    public boolean setPrefetchSize(int size) throws AmqpException {
        return qos(size, prefetchCount);
    }

    public boolean qos(int size, int count) throws AmqpException {
        checkArgument(size >= 0, "prefetch size must be 0 or greater, was %s", size);
        checkArgument(count >= 0, "prefetch count must be 0 or greater, was %s", count);
        try {
            call("Qos", channel -> {
                channel.basicQos(size, count);
                return null;
            });
        } catch (TransportException e) {
            throw new AmqpChannelException("Could not set prefetch (size " + size + ", count " + count + "): " + e.getMessage(), e);
        }
        this.prefetchSize = size;
        this.prefetchCount = count;
        log.debugWithParams("Prefetch set.", "channelId", channelId, "size", size, "count", count);
        return true;
    }

    public boolean startTransaction() throws AmqpException {
        return channelRequest("Start transaction", channel -> {
            channel.txSelect();
            return null;
        });
    }

    public boolean commitTransaction() throws AmqpException {
        return channelRequest("Commit transaction", channel -> {
            channel.txCommit();
            return null;
        });
    }

    public boolean rollbackTransaction() throws AmqpException {
        return channelRequest("Rollback transaction", channel -> {
            channel.txRollback();
            return null;
        });
    }

    /**
     * Asks the broker to redeliver all unacknowledged messages of this channel.
     */
    public boolean basicRecover(boolean requeue) throws AmqpException {
        return channelRequest("Recover", channel -> {
            channel.basicRecover(requeue);
            return null;
        });
    }

    @Override
    public String toString() {
        return "AmqpChannel{" +
                "channelId=" + channelId +
                ", closed=" + closed +
                ", subscriptions=" + subscriptions.keySet() +
                '}';
    }

    /**
     * Runs a request on the transport channel and classifies its failure.
     *
     * A lost connection makes the connection drop its session and becomes an {@link AmqpConnectionException}; a
     * closed channel becomes an {@link AmqpChannelException}. Any other failure is handed back to the caller as is,
     * to be turned into its own exception or into a degraded result.
     */
    <T> T call(String operation, TransportCall<T> request)
            throws AmqpConnectionException, AmqpChannelException, TransportException {
        ensureUsable(operation);
        try {
            return request.apply(transport);
        } catch (TransportException e) {
            switch (e.getKind()) {
                case CONNECTION:
                    connection.sessionLost(e);
                    throw new AmqpConnectionException(operation + " failed, connection lost: " + e.getMessage(), e);
                case CHANNEL:
                    markClosed();
                    throw new AmqpChannelException(operation + " failed, channel " + channelId + " is closed: " + e.getMessage(), e);
                default:
                    if (!transport.isOpen()) {
                        // the broker closes the channel on most request errors
                        markClosed();
                    }
                    throw e;
            }
        }
    }

    void ensureConfirmMode() throws AmqpConnectionException, AmqpChannelException, TransportException {
        if (confirmMode) {
            return;
        }
        call("Confirm select", channel -> {
            channel.confirmSelect();
            return null;
        });
        confirmMode = true;
    }

    int getIoTimeoutMillis() {
        return connection.getIoTimeoutMillis();
    }

    /**
     * Registers a subscription for the queue.
     *
     * @param callback the callback of the subscription, null to use the default handler (or the queue buffer)
     * @param buffered true to append deliveries to the queue buffer instead of calling a callback
     * @return the consumer tag
     */
    String subscribe(AmqpQueue queue, String consumerTag, boolean autoAck, ConsumeCallback callback, boolean buffered)
            throws AmqpConnectionException, AmqpChannelException, TransportException {
        String tag = call("Consume from " + queue.getName(), channel ->
                channel.basicConsume(queue.getName(), consumerTag, false, autoAck, false, dispatcher));
        Subscription subscription = new Subscription(tag, queue);
        subscription.callback = callback;
        subscription.buffered = buffered;
        subscriptions.put(tag, subscription);
        offerDefaultHandler(subscription);
        log.infoWithParams("Subscribed to queue.",
                "channelId", channelId,
                "queue", queue.getName(),
                "consumerTag", tag,
                "autoAck", autoAck,
                "mode", buffered ? "get" : callback == null ? "default handler" : "callback");
        return tag;
    }

    /**
     * Makes an existing subscription call the callback (or the default handler when null).
     */
    void useCallback(String consumerTag, ConsumeCallback callback) {
        Subscription subscription = subscriptions.get(consumerTag);
        if (subscription == null) {
            return;
        }
        subscription.callback = callback;
        subscription.buffered = false;
        offerDefaultHandler(subscription);
    }

    /**
     * Makes an existing subscription append its deliveries to the queue buffer.
     */
    void useBuffer(String consumerTag) {
        Subscription subscription = subscriptions.get(consumerTag);
        if (subscription != null) {
            subscription.buffered = true;
        }
    }

    void cancel(String consumerTag) throws AmqpConnectionException, AmqpChannelException, TransportException {
        call("Cancel consumer " + consumerTag, channel -> {
            channel.basicCancel(consumerTag);
            return null;
        });
        log.infoWithParams("Subscription cancelled.",
                "channelId", channelId,
                "consumerTag", consumerTag);
        endSubscription(consumerTag);
    }

    /**
     * Drops a subscription the broker ended on its own, e.g. because its queue was deleted.
     */
    void forget(String consumerTag) {
        endSubscription(consumerTag);
    }

    /**
     * Processes every frame that is ready without blocking.
     */
    void pollFrames() throws AmqpException, TransportException {
        ensureUsable("Poll frames");
        while (transport.isFrameReady()) {
            pumpOne();
        }
    }

    /**
     * Pumps frames until a callback asks to stop or no subscription is left on the channel.
     *
     * Subscriptions also disappear when the channel or its connection dies, which must not look like a
     * regular end of consuming.
     */
    void runConsumeLoop() throws AmqpException, TransportException {
        stopRequested = false;
        flushUndelivered();
        while (!stopRequested && transport.pendingSubscriptionCount() > 0) {
            pumpOne();
        }
        if (!stopRequested) {
            ensureUsable("Consume");
        }
        log.debugWithParams("Consume loop ended.",
                "channelId", channelId,
                "stopRequested", stopRequested,
                "subscriptions", transport.pendingSubscriptionCount());
    }

    /**
     * The connection is gone (or was closed): nothing on this channel is valid anymore.
     */
    void connectionClosed() {
        markClosed();
    }

    private void ensureUsable(String operation) throws AmqpConnectionException, AmqpChannelException {
        if (!connection.isConnected()) {
            throw new AmqpConnectionException(operation + " failed, not connected");
        }
        if (closed || !transport.isOpen()) {
            markClosed();
            throw new AmqpChannelException(operation + " failed, channel " + channelId + " is closed");
        }
    }

    private boolean channelRequest(String operation, TransportCall<Void> request) throws AmqpException {
        try {
            call(operation, request);
            return true;
        } catch (TransportException e) {
            throw new AmqpChannelException(operation + " failed: " + e.getMessage(), e);
        }
    }

    private void pumpOne() throws AmqpException, TransportException {
        call("Wait for frame", channel -> {
            channel.waitForFrame();
            return null;
        });
        if (callbackFailure != null) {
            AmqpException failure = callbackFailure;
            callbackFailure = null;
            throw failure;
        }
    }

    private void offerDefaultHandler(Subscription subscription) {
        if (defaultHandler == null && subscription.callback != null) {
            defaultHandler = subscription;
            log.debugWithParams("Default handler set.",
                    "channelId", channelId,
                    "consumerTag", subscription.consumerTag);
        }
    }

    private void flushUndelivered() throws AmqpException {
        while (defaultHandler != null && !undelivered.isEmpty() && !stopRequested) {
            Undelivered next = undelivered.poll();
            if (!defaultHandler.callback.onMessage(next.envelope, next.queue)) {
                stopRequested = true;
            }
        }
    }

    private void dispatch(String consumerTag, Delivery delivery) {
        Envelope envelope = EnvelopeFactory.fromDelivery(delivery);
        if (log.isTraceEnabled()) {
            log.traceWithParams("Delivery received.",
                    "channelId", channelId,
                    "consumerTag", consumerTag,
                    "envelope", envelope);
        }
        Subscription subscription = subscriptions.get(consumerTag);
        if (subscription != null && subscription.buffered) {
            subscription.queue.buffer(envelope);
            return;
        }
        Subscription handler = subscription != null && subscription.callback != null ? subscription : defaultHandler;
        if (handler == null) {
            if (subscription != null) {
                undelivered.add(new Undelivered(envelope, subscription.queue));
            } else {
                log.warnWithParams("Dropping delivery without subscription or handler.",
                        "channelId", channelId,
                        "consumerTag", consumerTag,
                        "deliveryTag", envelope.getDeliveryTag());
            }
            return;
        }
        AmqpQueue queue = subscription != null ? subscription.queue : handler.queue;
        try {
            if (!handler.callback.onMessage(envelope, queue)) {
                stopRequested = true;
            }
        } catch (AmqpException e) {
            callbackFailure = e;
            stopRequested = true;
        }
    }

    private void endSubscription(String consumerTag) {
        Subscription subscription = subscriptions.remove(consumerTag);
        if (subscription != null) {
            subscription.queue.subscriptionEnded(consumerTag);
        }
    }

    private void markClosed() {
        if (closed) {
            return;
        }
        closed = true;
        List<String> tags = new ArrayList<>(subscriptions.keySet());
        for (String tag : tags) {
            endSubscription(tag);
        }
        undelivered.clear();
        defaultHandler = null;
    }

    interface TransportCall<T> {
        T apply(ProtocolChannel channel) throws TransportException;
    }

    private static class Subscription {
        private final String consumerTag;
        private final AmqpQueue queue;
        private ConsumeCallback callback;
        private boolean buffered;

        Subscription(String consumerTag, AmqpQueue queue) {
            this.consumerTag = consumerTag;
            this.queue = queue;
        }
    }

    private static class Undelivered {
        private final Envelope envelope;
        private final AmqpQueue queue;

        Undelivered(Envelope envelope, AmqpQueue queue) {
            this.envelope = envelope;
            this.queue = queue;
        }
    }

    private class Dispatcher implements ConsumerListener {

        @Override
        public void handleDelivery(String consumerTag, Delivery delivery) {
            dispatch(consumerTag, delivery);
        }

        @Override
        public void handleCancel(String consumerTag) {
            log.warnWithParams("Subscription cancelled by the broker.",
                    "channelId", channelId,
                    "consumerTag", consumerTag);
            endSubscription(consumerTag);
        }
    }
}
