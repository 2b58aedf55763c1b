package com.meltwater.syncrabbit;

import com.meltwater.syncrabbit.flags.AcknowledgeOptions;
import com.meltwater.syncrabbit.flags.AmqpFlags;
import com.meltwater.syncrabbit.flags.DeleteOptions;
import com.meltwater.syncrabbit.flags.FlagTranslator;
import com.meltwater.syncrabbit.flags.QueueOptions;
import com.meltwater.syncrabbit.transport.QueueStatus;
import com.meltwater.syncrabbit.transport.TransportException;
import com.meltwater.syncrabbit.util.Logger;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A queue on an {@link AmqpChannel}.
 *
 * <p>
 * A queue is either idle or subscribed. The first {@link #get(int)} or {@link #consume(ConsumeCallback, int, String)}
 * on an idle queue registers a subscription with the broker, later calls reuse it until it is cancelled, the queue
 * is deleted or the channel goes away.
 * </p>
 *
 * <p>
 * Declare, bind and acknowledge failures that do not concern the connection are logged and reported as false (or
 * 0). A lost connection is always thrown as {@link AmqpConnectionException}.
 * </p>
 *
 * <p>
 * {@link #ack(long, int)}, {@link #nack(long, int)} and {@link #reject(long, int)} must only be called for messages
 * that were received without {@link AmqpFlags#AUTOACK}. What the broker does with an acknowledgement of an auto
 * acked message is undefined.
 * </p>
 */
public class AmqpQueue {

    private static final Logger log = new Logger(AmqpQueue.class);

    enum State {
        IDLE,
        SUBSCRIBED
    }

    private final AmqpChannel channel;
    private final Deque<Envelope> buffer = new ArrayDeque<>();

    private String name = "";
    private int flags = AmqpFlags.NOPARAM;
    private Map<String, Object> arguments = new LinkedHashMap<>();

    private State state = State.IDLE;
    private String consumerTag;

    /**
     * @throws AmqpConnectionException if the channel's connection is not open
     * @throws AmqpChannelException if the channel is closed
     */
    public AmqpQueue(AmqpChannel channel) throws AmqpConnectionException, AmqpChannelException {
        if (!channel.getConnection().isConnected()) {
            throw new AmqpConnectionException("Could not create queue, connection is not open");
        }
        if (!channel.isConnected()) {
            throw new AmqpChannelException("Could not create queue, channel " + channel.getChannelId() + " is closed");
        }
        this.channel = channel;
    }

    /**
     * Declares the queue with the current flags and arguments. A queue without a name gets one from the broker,
     * which is stored as the name of this queue.
     *
     * @return the number of messages in the queue, 0 if the declare failed
     */
    public int declareQueue() throws AmqpConnectionException, AmqpChannelException {
        QueueOptions options = FlagTranslator.toQueueOptions(flags);
        try {
            QueueStatus status = channel.call("Declare queue " + name, transport -> transport.queueDeclare(
                    name, options.passive, options.durable, options.exclusive, options.autoDelete, arguments));
            name = status.queue;
            log.infoWithParams("Queue declared.",
                    "queue", name,
                    "options", options,
                    "messageCount", status.messageCount,
                    "consumerCount", status.consumerCount);
            return status.messageCount;
        } catch (TransportException e) {
            warnFailed("Declare", e);
            return 0;
        }
    }

    public boolean bind(String exchangeName) throws AmqpConnectionException, AmqpChannelException {
        return bind(exchangeName, null, Collections.<String, Object>emptyMap());
    }

    public boolean bind(String exchangeName, String routingKey) throws AmqpConnectionException, AmqpChannelException {
        return bind(exchangeName, routingKey, Collections.<String, Object>emptyMap());
    }

    /**
     * @param routingKey the binding key, null for the empty key
     * @param arguments passed to the broker as they are, e.g. the match arguments of a headers exchange
     */
    public boolean bind(String exchangeName, String routingKey, Map<String, Object> arguments)
            throws AmqpConnectionException, AmqpChannelException {
        String key = routingKey == null ? "" : routingKey;
        return request("Bind", transport -> {
            transport.queueBind(name, exchangeName, key, arguments);
            return null;
        });
    }

    public boolean unbind(String exchangeName) throws AmqpConnectionException, AmqpChannelException {
        return unbind(exchangeName, null, Collections.<String, Object>emptyMap());
    }

    public boolean unbind(String exchangeName, String routingKey) throws AmqpConnectionException, AmqpChannelException {
        return unbind(exchangeName, routingKey, Collections.<String, Object>emptyMap());
    }

    public boolean unbind(String exchangeName, String routingKey, Map<String, Object> arguments)
            throws AmqpConnectionException, AmqpChannelException {
        String key = routingKey == null ? "" : routingKey;
        return request("Unbind", transport -> {
            transport.queueUnbind(name, exchangeName, key, arguments);
            return null;
        });
    }

    /**
     * Removes all messages from the queue that are not waiting for an acknowledgement.
     */
    public boolean purge() throws AmqpConnectionException, AmqpChannelException {
        return request("Purge", transport -> transport.queuePurge(name));
    }

    public int delete() throws AmqpConnectionException, AmqpChannelException {
        return delete(AmqpFlags.NOPARAM);
    }

    /**
     * Deletes the queue. A subscription of this queue ends with it.
     *
     * @param flags {@link AmqpFlags#IFUNUSED} and/or {@link AmqpFlags#IFEMPTY}
     * @return the number of messages deleted with the queue, 0 if the delete failed
     */
    public int delete(int flags) throws AmqpConnectionException, AmqpChannelException {
        DeleteOptions options = FlagTranslator.toQueueDeleteOptions(flags);
        try {
            int deleted = channel.call("Delete queue " + name,
                    transport -> transport.queueDelete(name, options.ifUnused, options.ifEmpty));
            log.infoWithParams("Queue deleted.",
                    "queue", name,
                    "options", options,
                    "messageCount", deleted);
            if (state == State.SUBSCRIBED) {
                channel.forget(consumerTag);
            }
            return deleted;
        } catch (TransportException e) {
            warnFailed("Delete", e);
            return 0;
        }
    }

    /**
     * Subscribes to the queue and blocks, handing every delivered message to the callback.
     *
     * <p>
     * Consuming is channel wide: the loop also dispatches the deliveries of every other subscription on the channel
     * and only returns when a callback returns false or no subscription is left on the channel, e.g. because the
     * callback cancelled the last one. Messages buffered by an earlier {@link #get(int)} are handed to the callback
     * first.
     * </p>
     *
     * <p>
     * Without a callback the subscription is registered and the call returns right away. Its messages go to the
     * first callback that any consume on this channel registers.
     * </p>
     *
     * @param flags {@link AmqpFlags#AUTOACK} or {@link AmqpFlags#NOPARAM}, only used when a new subscription is made
     * @param consumerTag the tag of a new subscription, null or empty to let the broker pick one
     * @throws AmqpQueueException if the subscription could not be made or the channel failed while consuming
     * @throws AmqpException whatever the callback threw
     */
    public void consume(ConsumeCallback callback, int flags, String consumerTag) throws AmqpException {
        boolean autoAck = FlagTranslator.toAutoAck(flags);
        if (state == State.IDLE) {
            subscribe(autoAck, consumerTag, callback, false);
        } else {
            channel.useCallback(this.consumerTag, callback);
        }
        if (callback == null) {
            return;
        }
        while (!buffer.isEmpty()) {
            if (!callback.onMessage(buffer.poll(), this)) {
                return;
            }
        }
        try {
            channel.runConsumeLoop();
        } catch (TransportException e) {
            throw new AmqpQueueException("Consuming from queue '" + name + "' failed: " + e.getMessage(), e);
        }
    }

    public void consume(ConsumeCallback callback, int flags) throws AmqpException {
        consume(callback, flags, null);
    }

    public void consume(ConsumeCallback callback) throws AmqpException {
        consume(callback, AmqpFlags.NOPARAM, null);
    }

    /**
     * Returns the next message without blocking.
     *
     * <p>
     * The first call on an idle queue subscribes to it; the messages of that subscription are buffered by this
     * queue. Every call processes the frames that have already arrived on the channel, which includes the deliveries
     * of other subscriptions on the channel.
     * </p>
     *
     * @param flags {@link AmqpFlags#AUTOACK} or {@link AmqpFlags#NOPARAM}, only used when a new subscription is made
     * @return the oldest buffered message, empty if there is none
     * @throws AmqpQueueException if the subscription could not be made or the channel failed
     */
    public Optional<Envelope> get(int flags) throws AmqpException {
        boolean autoAck = FlagTranslator.toAutoAck(flags);
        if (state == State.IDLE) {
            subscribe(autoAck, null, null, true);
        } else {
            channel.useBuffer(consumerTag);
        }
        try {
            channel.pollFrames();
        } catch (TransportException e) {
            throw new AmqpQueueException("Get from queue '" + name + "' failed: " + e.getMessage(), e);
        }
        return Optional.ofNullable(buffer.poll());
    }

    public Optional<Envelope> get() throws AmqpException {
        return get(AmqpFlags.NOPARAM);
    }

    /**
     * Ends a subscription on the channel.
     *
     * @param consumerTag the subscription to end, null or empty for the subscription of this queue
     * @return true if the subscription ended or there was nothing to cancel
     */
    public boolean cancel(String consumerTag) throws AmqpConnectionException, AmqpChannelException {
        String tag = consumerTag == null || consumerTag.isEmpty() ? this.consumerTag : consumerTag;
        if (tag == null) {
            return true;
        }
        try {
            channel.cancel(tag);
            return true;
        } catch (TransportException e) {
            warnFailed("Cancel", e);
            return false;
        }
    }

    public boolean cancel() throws AmqpConnectionException, AmqpChannelException {
        return cancel(null);
    }

    /**
     * @param flags {@link AmqpFlags#MULTIPLE} to also acknowledge every earlier delivery
     */
    public boolean ack(long deliveryTag, int flags) throws AmqpConnectionException, AmqpChannelException {
        AcknowledgeOptions options = FlagTranslator.toAckOptions(flags);
        return request("Ack " + deliveryTag, transport -> {
            transport.basicAck(deliveryTag, options.multiple);
            return null;
        });
    }

    public boolean ack(long deliveryTag) throws AmqpConnectionException, AmqpChannelException {
        return ack(deliveryTag, AmqpFlags.NOPARAM);
    }

    /**
     * @param flags {@link AmqpFlags#MULTIPLE} and/or {@link AmqpFlags#REQUEUE}
     */
    public boolean nack(long deliveryTag, int flags) throws AmqpConnectionException, AmqpChannelException {
        AcknowledgeOptions options = FlagTranslator.toNackOptions(flags);
        return request("Nack " + deliveryTag, transport -> {
            transport.basicNack(deliveryTag, options.multiple, options.requeue);
            return null;
        });
    }

    public boolean nack(long deliveryTag) throws AmqpConnectionException, AmqpChannelException {
        return nack(deliveryTag, AmqpFlags.NOPARAM);
    }

    /**
     * @param flags {@link AmqpFlags#REQUEUE} to put the message back on the queue; {@link AmqpFlags#MULTIPLE} is
     *              accepted but a reject always concerns a single message
     */
    public boolean reject(long deliveryTag, int flags) throws AmqpConnectionException, AmqpChannelException {
        AcknowledgeOptions options = FlagTranslator.toRejectOptions(flags);
        return request("Reject " + deliveryTag, transport -> {
            transport.basicReject(deliveryTag, options.requeue);
            return null;
        });
    }

    public boolean reject(long deliveryTag) throws AmqpConnectionException, AmqpChannelException {
        return reject(deliveryTag, AmqpFlags.NOPARAM);
    }

    public String getName() {
        return name;
    }

    public boolean setName(String name) {
        this.name = name == null ? "" : name;
        return true;
    }

    public int getFlags() {
        return flags;
    }

    /**
     * @param flags any of {@link AmqpFlags#DURABLE}, {@link AmqpFlags#PASSIVE}, {@link AmqpFlags#EXCLUSIVE} and
     *              {@link AmqpFlags#AUTODELETE}
     * @return false (and the flags unchanged) if any other bit is set
     */
    public boolean setFlags(int flags) {
        if (!AmqpFlags.isSubsetOf(flags, AmqpFlags.QUEUE_FLAGS)) {
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

    /**
     * @return the tag of this queue's subscription, empty when idle
     */
    public Optional<String> getConsumerTag() {
        return Optional.ofNullable(consumerTag);
    }

    public boolean isConsuming() {
        return state == State.SUBSCRIBED;
    }

    public AmqpChannel getChannel() {
        return channel;
    }

    public AmqpConnection getConnection() {
        return channel.getConnection();
    }

    @Override
    public String toString() {
        return "AmqpQueue{" +
                "name='" + name + '\'' +
                ", flags=" + flags +
                ", state=" + state +
                ", consumerTag=" + consumerTag +
                ", buffered=" + buffer.size() +
                '}';
    }

    State getState() {
        return state;
    }

    void buffer(Envelope envelope) {
        buffer.add(envelope);
    }

    void subscriptionEnded(String endedTag) {
        if (endedTag.equals(consumerTag)) {
            transition(State.IDLE, null);
        }
    }

    private void subscribe(boolean autoAck, String requestedTag, ConsumeCallback callback, boolean buffered)
            throws AmqpConnectionException, AmqpChannelException, AmqpQueueException {
        String tag = requestedTag == null ? "" : requestedTag;
        try {
            transition(State.SUBSCRIBED, channel.subscribe(this, tag, autoAck, callback, buffered));
        } catch (TransportException e) {
            throw new AmqpQueueException("Could not subscribe to queue '" + name + "': " + e.getMessage(), e);
        }
    }

    private void transition(State next, String tag) {
        if (state == next) {
            return;
        }
        log.debugWithParams("Queue state changed.",
                "queue", name,
                "from", state,
                "to", next,
                "consumerTag", next == State.SUBSCRIBED ? tag : consumerTag);
        state = next;
        consumerTag = next == State.SUBSCRIBED ? tag : null;
    }

    private boolean request(String operation, AmqpChannel.TransportCall<?> call)
            throws AmqpConnectionException, AmqpChannelException {
        try {
            channel.call(operation + " queue " + name, call);
            return true;
        } catch (TransportException e) {
            warnFailed(operation, e);
            return false;
        }
    }

    private void warnFailed(String operation, TransportException e) {
        log.warnWithParams(operation + " failed.", e,
                "queue", name,
                "channelId", channel.getChannelId(),
                "kind", e.getKind(),
                "replyCode", e.getReplyCode());
    }
}
