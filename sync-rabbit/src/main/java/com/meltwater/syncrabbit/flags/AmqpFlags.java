package com.meltwater.syncrabbit.flags;

/**
 * Bitmask option flags accepted by the exchange and queue operations.
 *
 * The values are compatible with the pecl-amqp extension constants so that flags persisted or passed
 * around as plain integers keep their meaning. Each operation accepts only its own subset, see
 * {@link FlagTranslator}.
 */
public final class AmqpFlags {

    public static final int NOPARAM = 0;
    public static final int DURABLE = 2;
    public static final int PASSIVE = 4;
    public static final int EXCLUSIVE = 8;
    public static final int AUTODELETE = 16;
    public static final int INTERNAL = 32;
    public static final int NOLOCAL = 64;
    public static final int AUTOACK = 128;
    public static final int IFEMPTY = 256;
    public static final int IFUNUSED = 512;
    public static final int MANDATORY = 1024;
    public static final int IMMEDIATE = 2048;
    public static final int MULTIPLE = 4096;
    public static final int NOWAIT = 8192;
    public static final int REQUEUE = 16384;

    public static final int QUEUE_FLAGS = DURABLE | PASSIVE | EXCLUSIVE | AUTODELETE;
    public static final int EXCHANGE_FLAGS = DURABLE | PASSIVE | AUTODELETE;
    public static final int CONSUME_FLAGS = AUTOACK;
    public static final int ACK_FLAGS = MULTIPLE;
    public static final int NACK_FLAGS = MULTIPLE | REQUEUE;
    public static final int REJECT_FLAGS = MULTIPLE | REQUEUE;
    public static final int PUBLISH_FLAGS = MANDATORY | IMMEDIATE;
    public static final int QUEUE_DELETE_FLAGS = IFUNUSED | IFEMPTY;
    public static final int EXCHANGE_DELETE_FLAGS = IFUNUSED;

    private AmqpFlags() {
    }

    /**
     * @return true if every bit set in {@code flags} is part of {@code legal}
     */
    public static boolean isSubsetOf(int flags, int legal) {
        return (flags & ~legal) == 0;
    }

    static boolean isSet(int flags, int flag) {
        return (flags & flag) != 0;
    }
}
