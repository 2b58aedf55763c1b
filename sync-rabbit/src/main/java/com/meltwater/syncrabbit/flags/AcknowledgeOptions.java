package com.meltwater.syncrabbit.flags;

import java.util.Objects;

/**
 * Options of ack, nack and reject. Ack only carries {@code multiple}, reject only {@code requeue}.
 */
public class AcknowledgeOptions {

    public final boolean multiple;
    public final boolean requeue;

    public AcknowledgeOptions(boolean multiple, boolean requeue) {
        this.multiple = multiple;
        this.requeue = requeue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AcknowledgeOptions that = (AcknowledgeOptions) o;
        return multiple == that.multiple && requeue == that.requeue;
    }

    @Override
    public int hashCode() {
        return Objects.hash(multiple, requeue);
    }

    @Override
    public String toString() {
        return "{multiple:" + multiple + ", requeue:" + requeue + '}';
    }
}
