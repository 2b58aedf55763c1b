package com.meltwater.syncrabbit.flags;

import static com.google.common.base.Preconditions.checkArgument;
import static com.meltwater.syncrabbit.flags.AmqpFlags.isSet;

/**
 * Translates the integer bitmask API into typed option sets.
 *
 * Every method first checks that only the bits legal for the operation are set and throws
 * {@link IllegalArgumentException} otherwise, so an illegal combination never reaches the broker.
 */
public final class FlagTranslator {

    private FlagTranslator() {
    }

    public static QueueOptions toQueueOptions(int flags) {
        checkLegal(flags, AmqpFlags.QUEUE_FLAGS, "queue");
        return new QueueOptions(
                isSet(flags, AmqpFlags.DURABLE),
                isSet(flags, AmqpFlags.PASSIVE),
                isSet(flags, AmqpFlags.EXCLUSIVE),
                isSet(flags, AmqpFlags.AUTODELETE));
    }

    public static ExchangeOptions toExchangeOptions(int flags) {
        checkLegal(flags, AmqpFlags.EXCHANGE_FLAGS, "exchange");
        return new ExchangeOptions(
                isSet(flags, AmqpFlags.DURABLE),
                isSet(flags, AmqpFlags.PASSIVE),
                isSet(flags, AmqpFlags.AUTODELETE));
    }

    /**
     * @return true if the consume (or get) flags ask for auto ack
     */
    public static boolean toAutoAck(int flags) {
        checkLegal(flags, AmqpFlags.CONSUME_FLAGS, "consume");
        return isSet(flags, AmqpFlags.AUTOACK);
    }

    public static AcknowledgeOptions toAckOptions(int flags) {
        checkLegal(flags, AmqpFlags.ACK_FLAGS, "ack");
        return new AcknowledgeOptions(isSet(flags, AmqpFlags.MULTIPLE), false);
    }

    public static AcknowledgeOptions toNackOptions(int flags) {
        checkLegal(flags, AmqpFlags.NACK_FLAGS, "nack");
        return new AcknowledgeOptions(isSet(flags, AmqpFlags.MULTIPLE), isSet(flags, AmqpFlags.REQUEUE));
    }

    /**
     * basic.reject has no multiple bit, so {@link AmqpFlags#MULTIPLE} is accepted and ignored.
     */
    public static AcknowledgeOptions toRejectOptions(int flags) {
        checkLegal(flags, AmqpFlags.REJECT_FLAGS, "reject");
        return new AcknowledgeOptions(false, isSet(flags, AmqpFlags.REQUEUE));
    }

    public static PublishOptions toPublishOptions(int flags) {
        checkLegal(flags, AmqpFlags.PUBLISH_FLAGS, "publish");
        return new PublishOptions(isSet(flags, AmqpFlags.MANDATORY), isSet(flags, AmqpFlags.IMMEDIATE));
    }

    public static DeleteOptions toQueueDeleteOptions(int flags) {
        checkLegal(flags, AmqpFlags.QUEUE_DELETE_FLAGS, "queue delete");
        return new DeleteOptions(isSet(flags, AmqpFlags.IFUNUSED), isSet(flags, AmqpFlags.IFEMPTY));
    }

    public static DeleteOptions toExchangeDeleteOptions(int flags) {
        checkLegal(flags, AmqpFlags.EXCHANGE_DELETE_FLAGS, "exchange delete");
        return new DeleteOptions(isSet(flags, AmqpFlags.IFUNUSED), false);
    }

    private static void checkLegal(int flags, int legal, String operation) {
        checkArgument(AmqpFlags.isSubsetOf(flags, legal),
                "Illegal %s flags %s, only %s are allowed", operation, flags, legal);
    }
}
