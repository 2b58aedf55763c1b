package com.meltwater.syncrabbit.flags;

import java.util.Objects;

/**
 * The declare options of a queue.
 */
public class QueueOptions {

    public final boolean durable;
    public final boolean passive;
    public final boolean exclusive;
    public final boolean autoDelete;

    public QueueOptions(boolean durable, boolean passive, boolean exclusive, boolean autoDelete) {
        this.durable = durable;
        this.passive = passive;
        this.exclusive = exclusive;
        this.autoDelete = autoDelete;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueueOptions that = (QueueOptions) o;
        return durable == that.durable
                && passive == that.passive
                && exclusive == that.exclusive
                && autoDelete == that.autoDelete;
    }

    @Override
    public int hashCode() {
        return Objects.hash(durable, passive, exclusive, autoDelete);
    }

    @Override
    public String toString() {
        return "{durable:" + durable +
                ", passive:" + passive +
                ", exclusive:" + exclusive +
                ", autoDelete:" + autoDelete +
                '}';
    }
}
