package com.meltwater.syncrabbit.transport.rabbit;

import com.meltwater.syncrabbit.transport.ConsumerListener;
import com.meltwater.syncrabbit.transport.ProtocolChannel;
import com.meltwater.syncrabbit.transport.QueueStatus;
import com.meltwater.syncrabbit.transport.TransportException;
import com.meltwater.syncrabbit.transport.TransportException.Kind;
import com.meltwater.syncrabbit.util.Logger;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeoutException;

/**
 * {@link ProtocolChannel} on top of a RabbitMQ java client {@link Channel}.
 *
 * The client reads the socket on its own threads and calls {@link Consumer}s there. This class only lets those
 * threads put frames on a queue; the frames are taken off and handed to the {@link ConsumerListener}s on the
 * thread that calls {@link #waitForFrame()}, so the application sees a single flow of control.
 */
class RabbitProtocolChannel implements ProtocolChannel {

    private static final Logger log = new Logger(RabbitProtocolChannel.class);

    private final Channel delegate;
    private final BlockingQueue<InboundFrame> frames = new LinkedBlockingQueue<>();
    private final Map<String, ConsumerListener> subscriptions = new ConcurrentHashMap<>();

    RabbitProtocolChannel(Channel delegate) {
        this.delegate = delegate;
        delegate.addShutdownListener(cause -> frames.add(() -> {
            subscriptions.clear();
            throw RabbitExceptions.translate("Channel " + delegate.getChannelNumber(), cause);
        }));
        delegate.addReturnListener(returned -> log.warnWithParams("Message returned by broker.",
                "channelNr", delegate.getChannelNumber(),
                "replyCode", returned.getReplyCode(),
                "replyText", returned.getReplyText(),
                "exchange", returned.getExchange(),
                "routingKey", returned.getRoutingKey(),
                "messageId", returned.getProperties().getMessageId()));
    }

    @Override
    public int getChannelNumber() {
        return delegate.getChannelNumber();
    }

    @Override
    public boolean isOpen() {
        return delegate.isOpen() && delegate.getConnection().isOpen();
    }

    @Override
    public void close() throws TransportException {
        subscriptions.clear();
        if (!delegate.isOpen()) {
            return;
        }
        invoke("Close channel", () -> {
            delegate.close();
            return null;
        });
    }

    @Override
    public void exchangeDeclare(String exchange, String type, boolean passive, boolean durable, boolean autoDelete,
                                Map<String, Object> arguments) throws TransportException {
        invoke("Declare exchange " + exchange, () -> passive
                ? delegate.exchangeDeclarePassive(exchange)
                : delegate.exchangeDeclare(exchange, type, durable, autoDelete, false, arguments));
    }

    @Override
    public void exchangeBind(String destination, String source, String routingKey, Map<String, Object> arguments) throws TransportException {
        invoke("Bind exchange " + destination + " to " + source,
                () -> delegate.exchangeBind(destination, source, routingKey, arguments));
    }

    @Override
    public void exchangeUnbind(String destination, String source, String routingKey, Map<String, Object> arguments) throws TransportException {
        invoke("Unbind exchange " + destination + " from " + source,
                () -> delegate.exchangeUnbind(destination, source, routingKey, arguments));
    }

    @Override
    public void exchangeDelete(String exchange, boolean ifUnused) throws TransportException {
        invoke("Delete exchange " + exchange, () -> delegate.exchangeDelete(exchange, ifUnused));
    }

    @Override
    public QueueStatus queueDeclare(String queue, boolean passive, boolean durable, boolean exclusive, boolean autoDelete,
                                    Map<String, Object> arguments) throws TransportException {
        AMQP.Queue.DeclareOk ok = invoke("Declare queue " + queue, () -> passive
                ? delegate.queueDeclarePassive(queue)
                : delegate.queueDeclare(queue, durable, exclusive, autoDelete, arguments));
        return new QueueStatus(ok.getQueue(), ok.getMessageCount(), ok.getConsumerCount());
    }

    @Override
    public void queueBind(String queue, String exchange, String routingKey, Map<String, Object> arguments) throws TransportException {
        invoke("Bind queue " + queue, () -> delegate.queueBind(queue, exchange, routingKey, arguments));
    }

    @Override
    public void queueUnbind(String queue, String exchange, String routingKey, Map<String, Object> arguments) throws TransportException {
        invoke("Unbind queue " + queue, () -> delegate.queueUnbind(queue, exchange, routingKey, arguments));
    }

    @Override
    public int queueDelete(String queue, boolean ifUnused, boolean ifEmpty) throws TransportException {
        return invoke("Delete queue " + queue, () -> delegate.queueDelete(queue, ifUnused, ifEmpty)).getMessageCount();
    }

    @Override
    public int queuePurge(String queue) throws TransportException {
        return invoke("Purge queue " + queue, () -> delegate.queuePurge(queue)).getMessageCount();
    }

    @Override
    public void basicPublish(String exchange, String routingKey, boolean mandatory, boolean immediate,
                             AMQP.BasicProperties properties, byte[] body) throws TransportException {
        invoke("Publish to " + exchange, () -> {
            delegate.basicPublish(exchange, routingKey, mandatory, immediate, properties, body);
            return null;
        });
    }

    @Override
    public void confirmSelect() throws TransportException {
        invoke("Confirm select", delegate::confirmSelect);
    }

    @Override
    public boolean waitForConfirms(long timeoutMillis) throws TransportException {
        return invoke("Wait for confirms", () -> timeoutMillis > 0
                ? delegate.waitForConfirms(timeoutMillis)
                : delegate.waitForConfirms());
    }

    @Override
    public String basicConsume(String queue, String consumerTag, boolean noLocal, boolean autoAck, boolean exclusive,
                               ConsumerListener listener) throws TransportException {
        String tag = invoke("Consume from " + queue, () -> delegate.basicConsume(
                queue, autoAck, consumerTag, noLocal, exclusive, null, new FrameQueueingConsumer(queue, listener)));
        subscriptions.put(tag, listener);
        return tag;
    }

    @Override
    public void basicCancel(String consumerTag) throws TransportException {
        if (!subscriptions.containsKey(consumerTag)) {
            throw new TransportException(Kind.PROTOCOL, "Unknown consumer tag '" + consumerTag + "'");
        }
        invoke("Cancel consumer " + consumerTag, () -> {
            delegate.basicCancel(consumerTag);
            return null;
        });
        subscriptions.remove(consumerTag);
    }

    @Override
    public void basicAck(long deliveryTag, boolean multiple) throws TransportException {
        invoke("Ack " + deliveryTag, () -> {
            delegate.basicAck(deliveryTag, multiple);
            return null;
        });
    }

    @Override
    public void basicNack(long deliveryTag, boolean multiple, boolean requeue) throws TransportException {
        invoke("Nack " + deliveryTag, () -> {
            delegate.basicNack(deliveryTag, multiple, requeue);
            return null;
        });
    }

    @Override
    public void basicReject(long deliveryTag, boolean requeue) throws TransportException {
        invoke("Reject " + deliveryTag, () -> {
            delegate.basicReject(deliveryTag, requeue);
            return null;
        });
    }

    @Override
    public void basicQos(int prefetchSize, int prefetchCount) throws TransportException {
        invoke("Qos", () -> {
            delegate.basicQos(prefetchSize, prefetchCount, false);
            return null;
        });
    }

    @Override
    public void basicRecover(boolean requeue) throws TransportException {
        invoke("Recover", () -> delegate.basicRecover(requeue));
    }

    @Override
    public void txSelect() throws TransportException {
        invoke("Start transaction", delegate::txSelect);
    }

    @Override
    public void txCommit() throws TransportException {
        invoke("Commit transaction", delegate::txCommit);
    }

    @Override
    public void txRollback() throws TransportException {
        invoke("Rollback transaction", delegate::txRollback);
    }

    @Override
    public void waitForFrame() throws TransportException {
        if (frames.isEmpty() && !delegate.isOpen()) {
            String operation = "Wait for frame on channel " + delegate.getChannelNumber();
            ShutdownSignalException reason = delegate.getCloseReason();
            throw reason == null
                    ? new TransportException(Kind.CHANNEL, operation + " failed, channel is closed")
                    : RabbitExceptions.translate(operation, reason);
        }
        final InboundFrame frame;
        try {
            frame = frames.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(Kind.TIMEOUT, "Interrupted while waiting for a frame", e);
        }
        frame.dispatch();
    }

    @Override
    public boolean isFrameReady() {
        return !frames.isEmpty();
    }

    @Override
    public int pendingSubscriptionCount() {
        return subscriptions.size();
    }

    @Override
    public String toString() {
        return "{channelNr=" + delegate.getChannelNumber() +
                ", subscriptions=" + subscriptions.keySet() +
                ", pendingFrames=" + frames.size() +
                '}';
    }

    private <T> T invoke(String operation, RabbitCall<T> call) throws TransportException {
        try {
            return call.call();
        } catch (IOException | TimeoutException | ShutdownSignalException e) {
            throw RabbitExceptions.translate(operation, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(Kind.TIMEOUT, operation + " interrupted", e);
        }
    }

    private interface RabbitCall<T> {
        T call() throws IOException, TimeoutException, InterruptedException;
    }

    private interface InboundFrame {
        void dispatch() throws TransportException;
    }

    /**
     * Runs on the client's consumer threads: every callback is turned into a frame for the pumping thread.
     */
    private class FrameQueueingConsumer implements Consumer {

        private final String queue;
        private final ConsumerListener listener;

        FrameQueueingConsumer(String queue, ConsumerListener listener) {
            this.queue = queue;
            this.listener = listener;
        }

        @Override
        public void handleConsumeOk(String consumerTag) {
            log.infoWithParams("Consumer registered and ready to receive messages.",
                    "channelNr", delegate.getChannelNumber(),
                    "queue", queue,
                    "consumerTag", consumerTag);
        }

        @Override
        public void handleCancelOk(String consumerTag) {
            log.infoWithParams("Consumer successfully stopped. It will not receive any more messages.",
                    "channelNr", delegate.getChannelNumber(),
                    "queue", queue,
                    "consumerTag", consumerTag);
        }

        @Override
        public void handleCancel(String consumerTag) {
            log.warnWithParams("Consumer stopped by the broker. It will not receive any more messages.",
                    "channelNr", delegate.getChannelNumber(),
                    "queue", queue,
                    "consumerTag", consumerTag);
            frames.add(() -> {
                subscriptions.remove(consumerTag);
                listener.handleCancel(consumerTag);
            });
        }

        @Override
        public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
            // the subscription stays until the shutdown frame is pumped
            log.debugWithParams("Consumer shut down.",
                    "channelNr", delegate.getChannelNumber(),
                    "queue", queue,
                    "consumerTag", consumerTag,
                    "hardError", sig.isHardError());
        }

        @Override
        public void handleRecoverOk(String consumerTag) {
        }

        @Override
        public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
            Delivery delivery = new Delivery(envelope, properties, body);
            frames.add(() -> listener.handleDelivery(consumerTag, delivery));
        }
    }
}
