package com.meltwater.syncrabbit.flags;

import java.util.Objects;

public class PublishOptions {

    /**
     * Ask the broker to return the message if it can not be routed to any queue.
     */
    public final boolean mandatory;

    /**
     * Ask the broker to return the message if it can not be delivered to a consumer right away.
     * Note that RabbitMQ does not implement this and closes the connection when it is set.
     */
    public final boolean immediate;

    public PublishOptions(boolean mandatory, boolean immediate) {
        this.mandatory = mandatory;
        this.immediate = immediate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PublishOptions that = (PublishOptions) o;
        return mandatory == that.mandatory && immediate == that.immediate;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mandatory, immediate);
    }

    @Override
    public String toString() {
        return "{mandatory:" + mandatory + ", immediate:" + immediate + '}';
    }
}
