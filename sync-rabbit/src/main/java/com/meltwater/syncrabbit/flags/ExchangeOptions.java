package com.meltwater.syncrabbit.flags;

import java.util.Objects;

/**
 * The declare options of an exchange.
 */
public class ExchangeOptions {

    public final boolean durable;
    public final boolean passive;
    public final boolean autoDelete;

    public ExchangeOptions(boolean durable, boolean passive, boolean autoDelete) {
        this.durable = durable;
        this.passive = passive;
        this.autoDelete = autoDelete;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExchangeOptions that = (ExchangeOptions) o;
        return durable == that.durable && passive == that.passive && autoDelete == that.autoDelete;
    }

    @Override
    public int hashCode() {
        return Objects.hash(durable, passive, autoDelete);
    }

    @Override
    public String toString() {
        return "{durable:" + durable + ", passive:" + passive + ", autoDelete:" + autoDelete + '}';
    }
}
