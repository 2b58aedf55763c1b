package com.meltwater.syncrabbit;

/**
 * Receives the messages of {@link AmqpQueue#consume(ConsumeCallback, int, String)}.
 */
@FunctionalInterface
public interface ConsumeCallback {

    /**
     * Called on the consuming thread once per delivered message.
     *
     * @param envelope the delivered message
     * @param queue the queue the message was delivered from, which is not the queue of this callback when it acts
     *              as the default handler of the channel
     * @return false to stop consuming and return from {@link AmqpQueue#consume(ConsumeCallback, int, String)},
     * true to wait for the next message
     * @throws AmqpException to abort consuming, the exception is rethrown from the consume call
     */
    boolean onMessage(Envelope envelope, AmqpQueue queue) throws AmqpException;
}
