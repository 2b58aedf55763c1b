package com.meltwater.syncrabbit.transport;

import com.rabbitmq.client.Delivery;

/**
 * Receives the frames of one subscription.
 *
 * Both methods are only ever called from inside {@link ProtocolChannel#waitForFrame()}, on the thread that pumps
 * the channel.
 */
public interface ConsumerListener {

    void handleDelivery(String consumerTag, Delivery delivery);

    /**
     * The broker cancelled the subscription, e.g. because the queue was deleted.
     */
    void handleCancel(String consumerTag);
}
