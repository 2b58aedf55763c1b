package com.meltwater.syncrabbit.transport;

/**
 * What the broker reported back for a queue declare.
 */
public class QueueStatus {

    public final String queue;
    public final int messageCount;
    public final int consumerCount;

    public QueueStatus(String queue, int messageCount, int consumerCount) {
        this.queue = queue;
        this.messageCount = messageCount;
        this.consumerCount = consumerCount;
    }

    @Override
    public String toString() {
        return "{queue:'" + queue + '\'' +
                ", messageCount:" + messageCount +
                ", consumerCount:" + consumerCount +
                '}';
    }
}
