package com.meltwater.syncrabbit.broker;

import com.meltwater.syncrabbit.transport.ConsumerListener;
import com.meltwater.syncrabbit.transport.ProtocolChannel;
import com.meltwater.syncrabbit.transport.QueueStatus;
import com.meltwater.syncrabbit.transport.TransportException;
import com.meltwater.syncrabbit.transport.TransportException.Kind;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static com.meltwater.syncrabbit.broker.InMemoryBroker.ACCESS_REFUSED;
import static com.meltwater.syncrabbit.broker.InMemoryBroker.COMMAND_INVALID;
import static com.meltwater.syncrabbit.broker.InMemoryBroker.NOT_FOUND;
import static com.meltwater.syncrabbit.broker.InMemoryBroker.NOT_IMPLEMENTED;
import static com.meltwater.syncrabbit.broker.InMemoryBroker.PRECONDITION_FAILED;

class BrokerChannel implements ProtocolChannel {

    private static final List<String> EXCHANGE_TYPES = Arrays.asList("direct", "fanout", "topic", "headers");

    private final InMemoryBroker broker;
    private final BrokerSession session;
    private final int number;

    private final Deque<Runnable> frames = new ArrayDeque<>();
    private final Map<String, BrokerQueue.Consumer> subscriptions = new LinkedHashMap<>();
    private final TreeMap<Long, Unacked> unacked = new TreeMap<>();
    private final List<Runnable> transaction = new ArrayList<>();

    private long deliveryTags;
    private boolean closed;
    private boolean confirmMode;
    private boolean txMode;
    private int prefetchCount;

    BrokerChannel(InMemoryBroker broker, BrokerSession session, int number) {
        this.broker = broker;
        this.session = session;
        this.number = number;
    }

    @Override
    public int getChannelNumber() {
        return number;
    }

    @Override
    public boolean isOpen() {
        return !closed && session.isOpen();
    }

    @Override
    public void close() throws TransportException {
        if (closed) {
            return;
        }
        if (!session.isOpen()) {
            throw connectionClosed();
        }
        closeOnBroker();
        broker.deliverAllReady();
    }

    @Override
    public void exchangeDeclare(String exchange, String type, boolean passive, boolean durable, boolean autoDelete,
                                Map<String, Object> arguments) throws TransportException {
        ensureOpen();
        BrokerExchange existing = broker.exchanges.get(exchange);
        if (passive) {
            if (existing == null) {
                throw channelError(NOT_FOUND, "NOT_FOUND - no exchange '" + exchange + "' in vhost '/'");
            }
            return;
        }
        if (!EXCHANGE_TYPES.contains(type)) {
            throw connectionError(COMMAND_INVALID, "COMMAND_INVALID - unknown exchange type '" + type + "'");
        }
        if (existing != null) {
            if (!existing.type.equals(type)) {
                throw channelError(PRECONDITION_FAILED, "PRECONDITION_FAILED - inequivalent arg 'type' for exchange '" + exchange + "'");
            }
            return;
        }
        if (exchange.isEmpty() || exchange.startsWith("amq.")) {
            throw channelError(ACCESS_REFUSED, "ACCESS_REFUSED - exchange name '" + exchange + "' contains reserved prefix 'amq.'");
        }
        broker.exchanges.put(exchange, new BrokerExchange(exchange, type, durable, autoDelete));
    }

    @Override
    public void exchangeBind(String destination, String source, String routingKey, Map<String, Object> arguments) throws TransportException {
        ensureOpen();
        existingExchange(destination);
        existingExchange(source).bindings.add(new BrokerExchange.Binding(destination, true, routingKey, arguments));
    }

    @Override
    public void exchangeUnbind(String destination, String source, String routingKey, Map<String, Object> arguments) throws TransportException {
        ensureOpen();
        existingExchange(destination);
        existingExchange(source).bindings.remove(new BrokerExchange.Binding(destination, true, routingKey, arguments));
    }

    @Override
    public void exchangeDelete(String exchange, boolean ifUnused) throws TransportException {
        ensureOpen();
        BrokerExchange existing = existingExchange(exchange);
        if (ifUnused && !existing.bindings.isEmpty()) {
            throw channelError(PRECONDITION_FAILED, "PRECONDITION_FAILED - exchange '" + exchange + "' in use");
        }
        broker.removeExchange(existing);
    }

    @Override
    public QueueStatus queueDeclare(String queue, boolean passive, boolean durable, boolean exclusive, boolean autoDelete,
                                    Map<String, Object> arguments) throws TransportException {
        ensureOpen();
        BrokerQueue existing = broker.queues.get(queue);
        if (passive) {
            if (existing == null) {
                throw channelError(NOT_FOUND, "NOT_FOUND - no queue '" + queue + "' in vhost '/'");
            }
            return status(existing);
        }
        if (existing == null) {
            String name = queue.isEmpty() ? broker.generateName("amq.gen-") : queue;
            existing = new BrokerQueue(name, durable, exclusive, autoDelete);
            broker.queues.put(name, existing);
        } else if (existing.durable != durable) {
            throw channelError(PRECONDITION_FAILED, "PRECONDITION_FAILED - inequivalent arg 'durable' for queue '" + queue + "'");
        }
        return status(existing);
    }

    @Override
    public void queueBind(String queue, String exchange, String routingKey, Map<String, Object> arguments) throws TransportException {
        ensureOpen();
        existingQueue(queue);
        if (exchange.isEmpty()) {
            throw channelError(ACCESS_REFUSED, "ACCESS_REFUSED - operation not permitted on the default exchange");
        }
        BrokerExchange.Binding binding = new BrokerExchange.Binding(queue, false, routingKey, arguments);
        BrokerExchange source = existingExchange(exchange);
        if (!source.bindings.contains(binding)) {
            source.bindings.add(binding);
        }
    }

    @Override
    public void queueUnbind(String queue, String exchange, String routingKey, Map<String, Object> arguments) throws TransportException {
        ensureOpen();
        existingQueue(queue);
        existingExchange(exchange).bindings.remove(new BrokerExchange.Binding(queue, false, routingKey, arguments));
    }

    @Override
    public int queueDelete(String queue, boolean ifUnused, boolean ifEmpty) throws TransportException {
        ensureOpen();
        BrokerQueue existing = existingQueue(queue);
        if (ifUnused && !existing.consumers.isEmpty()) {
            throw channelError(PRECONDITION_FAILED, "PRECONDITION_FAILED - queue '" + queue + "' in use");
        }
        if (ifEmpty && !existing.ready.isEmpty()) {
            throw channelError(PRECONDITION_FAILED, "PRECONDITION_FAILED - queue '" + queue + "' not empty");
        }
        int count = existing.ready.size();
        broker.removeQueue(existing);
        return count;
    }

    @Override
    public int queuePurge(String queue) throws TransportException {
        ensureOpen();
        BrokerQueue existing = existingQueue(queue);
        int count = existing.ready.size();
        existing.ready.clear();
        return count;
    }

    @Override
    public void basicPublish(String exchange, String routingKey, boolean mandatory, boolean immediate,
                             AMQP.BasicProperties properties, byte[] body) throws TransportException {
        ensureOpen();
        if (immediate) {
            throw connectionError(NOT_IMPLEMENTED, "NOT_IMPLEMENTED - immediate=true");
        }
        if (!exchange.isEmpty()) {
            existingExchange(exchange);
        }
        StoredMessage message = new StoredMessage(exchange, routingKey,
                properties == null ? new AMQP.BasicProperties.Builder().build() : properties, body);
        Runnable publish = () -> {
            if (!broker.publish(exchange, message) && mandatory) {
                broker.returnMessage(message);
            }
        };
        if (txMode) {
            transaction.add(publish);
        } else {
            publish.run();
        }
    }

    @Override
    public void confirmSelect() throws TransportException {
        ensureOpen();
        if (txMode) {
            throw channelError(PRECONDITION_FAILED, "PRECONDITION_FAILED - cannot switch from tx to confirm mode");
        }
        confirmMode = true;
    }

    @Override
    public boolean waitForConfirms(long timeoutMillis) throws TransportException {
        ensureOpen();
        if (!confirmMode) {
            throw new TransportException(Kind.PROTOCOL, "Channel " + number + " is not in confirm mode");
        }
        if (broker.isHoldConfirms()) {
            throw new TransportException(Kind.TIMEOUT, "No confirms within " + timeoutMillis + " ms");
        }
        return !broker.isNackConfirms();
    }

    @Override
    public String basicConsume(String queue, String consumerTag, boolean noLocal, boolean autoAck, boolean exclusive,
                               ConsumerListener listener) throws TransportException {
        ensureOpen();
        BrokerQueue existing = existingQueue(queue);
        String tag = consumerTag.isEmpty() ? broker.generateName("amq.ctag-") : consumerTag;
        if (subscriptions.containsKey(tag)) {
            throw channelError(PRECONDITION_FAILED, "NOT_ALLOWED - attempt to reuse consumer tag '" + tag + "'");
        }
        if (exclusive && !existing.consumers.isEmpty()) {
            throw channelError(ACCESS_REFUSED, "ACCESS_REFUSED - queue '" + queue + "' in exclusive use");
        }
        BrokerQueue.Consumer consumer = new BrokerQueue.Consumer(tag, this, autoAck, listener, existing);
        existing.consumers.add(consumer);
        subscriptions.put(tag, consumer);
        broker.deliverReady(existing);
        return tag;
    }

    @Override
    public void basicCancel(String consumerTag) throws TransportException {
        ensureOpen();
        BrokerQueue.Consumer consumer = subscriptions.remove(consumerTag);
        if (consumer == null) {
            throw new TransportException(Kind.PROTOCOL, "Unknown consumer tag '" + consumerTag + "'");
        }
        consumer.queue.consumers.remove(consumer);
    }

    @Override
    public void basicAck(long deliveryTag, boolean multiple) throws TransportException {
        ensureOpen();
        take(deliveryTag, multiple);
        broker.deliverAllReady();
    }

    @Override
    public void basicNack(long deliveryTag, boolean multiple, boolean requeue) throws TransportException {
        ensureOpen();
        List<Unacked> taken = take(deliveryTag, multiple);
        if (requeue) {
            requeue(taken);
        }
        broker.deliverAllReady();
    }

    @Override
    public void basicReject(long deliveryTag, boolean requeue) throws TransportException {
        basicNack(deliveryTag, false, requeue);
    }

    @Override
    public void basicQos(int prefetchSize, int prefetchCount) throws TransportException {
        ensureOpen();
        this.prefetchCount = prefetchCount;
        broker.deliverAllReady();
    }

    @Override
    public void basicRecover(boolean requeue) throws TransportException {
        ensureOpen();
        List<Unacked> all = new ArrayList<>(unacked.values());
        unacked.clear();
        requeue(all);
        broker.deliverAllReady();
    }

    @Override
    public void txSelect() throws TransportException {
        ensureOpen();
        if (confirmMode) {
            throw channelError(PRECONDITION_FAILED, "PRECONDITION_FAILED - cannot switch from confirm to tx mode");
        }
        txMode = true;
    }

    @Override
    public void txCommit() throws TransportException {
        ensureTransactional();
        List<Runnable> pending = new ArrayList<>(transaction);
        transaction.clear();
        for (Runnable publish : pending) {
            publish.run();
        }
    }

    @Override
    public void txRollback() throws TransportException {
        ensureTransactional();
        transaction.clear();
    }

    @Override
    public void waitForFrame() throws TransportException {
        ensureOpen();
        Runnable frame = frames.poll();
        if (frame == null) {
            throw new TransportException(Kind.TIMEOUT, "No frame on channel " + number + ", nothing would ever arrive");
        }
        frame.run();
    }

    @Override
    public boolean isFrameReady() {
        return !frames.isEmpty();
    }

    @Override
    public int pendingSubscriptionCount() {
        return subscriptions.size();
    }

    boolean hasCapacity() {
        return prefetchCount == 0 || unacked.size() < prefetchCount;
    }

    int unackedCount() {
        return unacked.size();
    }

    void deliver(BrokerQueue.Consumer consumer, BrokerQueue queue, StoredMessage message) {
        long tag = ++deliveryTags;
        if (!consumer.autoAck) {
            unacked.put(tag, new Unacked(queue, message));
        }
        Delivery delivery = new Delivery(
                new Envelope(tag, message.redelivered, message.exchange, message.routingKey),
                message.properties,
                message.body);
        frames.add(() -> consumer.listener.handleDelivery(consumer.tag, delivery));
    }

    void notifyCancelled(BrokerQueue.Consumer consumer) {
        frames.add(() -> {
            subscriptions.remove(consumer.tag);
            consumer.listener.handleCancel(consumer.tag);
        });
    }

    /**
     * Closes the channel from the broker side: consumers go away, unacknowledged messages are requeued.
     */
    void closeOnBroker() {
        if (closed) {
            return;
        }
        closed = true;
        for (BrokerQueue.Consumer consumer : subscriptions.values()) {
            consumer.queue.consumers.remove(consumer);
        }
        subscriptions.clear();
        frames.clear();
        List<Unacked> all = new ArrayList<>(unacked.values());
        unacked.clear();
        requeue(all);
    }

    private List<Unacked> take(long deliveryTag, boolean multiple) throws TransportException {
        List<Unacked> taken = new ArrayList<>();
        if (multiple && deliveryTag == 0) {
            taken.addAll(unacked.values());
            unacked.clear();
            return taken;
        }
        if (!unacked.containsKey(deliveryTag)) {
            throw channelError(PRECONDITION_FAILED, "PRECONDITION_FAILED - unknown delivery tag " + deliveryTag);
        }
        Map<Long, Unacked> range = multiple ? unacked.headMap(deliveryTag, true) : unacked.subMap(deliveryTag, true, deliveryTag, true);
        taken.addAll(range.values());
        range.clear();
        return taken;
    }

    private void requeue(List<Unacked> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            Unacked entry = messages.get(i);
            if (broker.queues.get(entry.queue.name) == entry.queue) {
                entry.message.redelivered = true;
                entry.queue.ready.addFirst(entry.message);
            }
        }
    }

    private void ensureOpen() throws TransportException {
        if (!session.isOpen()) {
            throw connectionClosed();
        }
        if (closed) {
            throw new TransportException(Kind.CHANNEL, "Channel " + number + " is closed");
        }
    }

    private void ensureTransactional() throws TransportException {
        ensureOpen();
        if (!txMode) {
            throw channelError(PRECONDITION_FAILED, "PRECONDITION_FAILED - channel is not transactional");
        }
    }

    private BrokerExchange existingExchange(String exchange) throws TransportException {
        BrokerExchange existing = broker.exchanges.get(exchange);
        if (existing == null) {
            throw channelError(NOT_FOUND, "NOT_FOUND - no exchange '" + exchange + "' in vhost '/'");
        }
        return existing;
    }

    private BrokerQueue existingQueue(String queue) throws TransportException {
        BrokerQueue existing = broker.queues.get(queue);
        if (existing == null) {
            throw channelError(NOT_FOUND, "NOT_FOUND - no queue '" + queue + "' in vhost '/'");
        }
        return existing;
    }

    private QueueStatus status(BrokerQueue queue) {
        return new QueueStatus(queue.name, queue.ready.size(), queue.consumers.size());
    }

    private TransportException channelError(int replyCode, String text) {
        closeOnBroker();
        broker.deliverAllReady();
        return new TransportException(Kind.PROTOCOL, replyCode, text, null);
    }

    private TransportException connectionError(int replyCode, String text) {
        session.kill();
        return new TransportException(Kind.CONNECTION, replyCode, text, null);
    }

    private TransportException connectionClosed() {
        return new TransportException(Kind.CONNECTION, "Connection closed by broker");
    }

    private static class Unacked {
        final BrokerQueue queue;
        final StoredMessage message;

        Unacked(BrokerQueue queue, StoredMessage message) {
            this.queue = queue;
            this.message = message;
        }
    }
}
