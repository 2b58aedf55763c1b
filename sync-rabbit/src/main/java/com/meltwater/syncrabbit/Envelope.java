package com.meltwater.syncrabbit;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * This class wraps all the data delivered by the broker for a given message.
 *
 * Attributes that were not set on the message read as empty strings, 0 or an empty header map, never as null.
 *
 * Acknowledgement is keyed by {@link #getDeliveryTag()}: pass it to {@link AmqpQueue#ack(long, int)},
 * {@link AmqpQueue#nack(long, int)} or {@link AmqpQueue#reject(long, int)} on the queue it was consumed from.
 * The tag is only meaningful on the channel that received the message.
 *
 * @see EnvelopeFactory#fromDelivery(com.rabbitmq.client.Delivery)
 */
public class Envelope {

    private final long deliveryTag;
    private final byte[] body;
    private final String appId;
    private final String contentType;
    private final String contentEncoding;
    private final String correlationId;
    private final int deliveryMode;
    private final String exchangeName;
    private final String expiration;
    private final Map<String, Object> headers;
    private final String messageId;
    private final int priority;
    private final String replyTo;
    private final String routingKey;
    private final long timestamp;
    private final String type;
    private final String userId;
    private final String clusterId;
    private final boolean redelivery;

    private Envelope(Builder builder) {
        this.deliveryTag = builder.deliveryTag;
        this.body = builder.body;
        this.appId = builder.appId;
        this.contentType = builder.contentType;
        this.contentEncoding = builder.contentEncoding;
        this.correlationId = builder.correlationId;
        this.deliveryMode = builder.deliveryMode;
        this.exchangeName = builder.exchangeName;
        this.expiration = builder.expiration;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.messageId = builder.messageId;
        this.priority = builder.priority;
        this.replyTo = builder.replyTo;
        this.routingKey = builder.routingKey;
        this.timestamp = builder.timestamp;
        this.type = builder.type;
        this.userId = builder.userId;
        this.clusterId = builder.clusterId;
        this.redelivery = builder.redelivery;
    }

    static Builder builder() {
        return new Builder();
    }

    public long getDeliveryTag() {
        return deliveryTag;
    }

    public byte[] getBody() {
        return body.clone();
    }

    public String getAppId() {
        return appId;
    }

    public String getContentType() {
        return contentType;
    }

    public String getContentEncoding() {
        return contentEncoding;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    /**
     * @return 1 (non persistent), 2 (persistent) or 0 when not set
     * @see DeliveryMode
     */
    public int getDeliveryMode() {
        return deliveryMode;
    }

    public String getExchangeName() {
        return exchangeName;
    }

    public String getExpiration() {
        return expiration;
    }

    public Map<String, Object> getHeaders() {
        return headers;
    }

    public Optional<Object> getHeader(String key) {
        return Optional.ofNullable(headers.get(key));
    }

    public String getMessageId() {
        return messageId;
    }

    public int getPriority() {
        return priority;
    }

    public String getReplyTo() {
        return replyTo;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    /**
     * @return seconds since the epoch, 0 when not set
     */
    public long getTimestamp() {
        return timestamp;
    }

    public String getType() {
        return type;
    }

    public String getUserId() {
        return userId;
    }

    public String getClusterId() {
        return clusterId;
    }

    public boolean isRedelivery() {
        return redelivery;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Envelope that = (Envelope) o;
        return deliveryTag == that.deliveryTag
                && deliveryMode == that.deliveryMode
                && priority == that.priority
                && timestamp == that.timestamp
                && redelivery == that.redelivery
                && Arrays.equals(body, that.body)
                && appId.equals(that.appId)
                && contentType.equals(that.contentType)
                && contentEncoding.equals(that.contentEncoding)
                && correlationId.equals(that.correlationId)
                && exchangeName.equals(that.exchangeName)
                && expiration.equals(that.expiration)
                && headers.equals(that.headers)
                && messageId.equals(that.messageId)
                && replyTo.equals(that.replyTo)
                && routingKey.equals(that.routingKey)
                && type.equals(that.type)
                && userId.equals(that.userId)
                && clusterId.equals(that.clusterId);
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(deliveryTag);
        result = 31 * result + Arrays.hashCode(body);
        result = 31 * result + messageId.hashCode();
        result = 31 * result + routingKey.hashCode();
        result = 31 * result + exchangeName.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "{deliveryTag:" + deliveryTag +
                ", exchange:'" + exchangeName + '\'' +
                ", routingKey:'" + routingKey + '\'' +
                ", messageId:'" + messageId + '\'' +
                ", redelivery:" + redelivery +
                ", body:<" + body.length + " bytes>" +
                '}';
    }

    static class Builder {
        private long deliveryTag;
        private byte[] body = new byte[0];
        private String appId = "";
        private String contentType = "";
        private String contentEncoding = "";
        private String correlationId = "";
        private int deliveryMode;
        private String exchangeName = "";
        private String expiration = "";
        private final Map<String, Object> headers = new LinkedHashMap<>();
        private String messageId = "";
        private int priority;
        private String replyTo = "";
        private String routingKey = "";
        private long timestamp;
        private String type = "";
        private String userId = "";
        private String clusterId = "";
        private boolean redelivery;

        Builder deliveryTag(long deliveryTag) {
            this.deliveryTag = deliveryTag;
            return this;
        }

        Builder body(byte[] body) {
            this.body = body == null ? new byte[0] : body.clone();
            return this;
        }

        Builder appId(String appId) {
            this.appId = orEmpty(appId);
            return this;
        }

        Builder contentType(String contentType) {
            this.contentType = orEmpty(contentType);
            return this;
        }

        Builder contentEncoding(String contentEncoding) {
            this.contentEncoding = orEmpty(contentEncoding);
            return this;
        }

        Builder correlationId(String correlationId) {
            this.correlationId = orEmpty(correlationId);
            return this;
        }

        Builder deliveryMode(Integer deliveryMode) {
            this.deliveryMode = deliveryMode == null ? 0 : deliveryMode;
            return this;
        }

        Builder exchangeName(String exchangeName) {
            this.exchangeName = orEmpty(exchangeName);
            return this;
        }

        Builder expiration(String expiration) {
            this.expiration = orEmpty(expiration);
            return this;
        }

        Builder headers(Map<String, Object> headers) {
            this.headers.putAll(headers);
            return this;
        }

        Builder messageId(String messageId) {
            this.messageId = orEmpty(messageId);
            return this;
        }

        Builder priority(Integer priority) {
            this.priority = priority == null ? 0 : priority;
            return this;
        }

        Builder replyTo(String replyTo) {
            this.replyTo = orEmpty(replyTo);
            return this;
        }

        Builder routingKey(String routingKey) {
            this.routingKey = orEmpty(routingKey);
            return this;
        }

        Builder timestamp(long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        Builder type(String type) {
            this.type = orEmpty(type);
            return this;
        }

        Builder userId(String userId) {
            this.userId = orEmpty(userId);
            return this;
        }

        Builder clusterId(String clusterId) {
            this.clusterId = orEmpty(clusterId);
            return this;
        }

        Builder redelivery(boolean redelivery) {
            this.redelivery = redelivery;
            return this;
        }

        Envelope build() {
            return new Envelope(this);
        }

        private static String orEmpty(String value) {
            return value == null ? "" : value;
        }
    }
}
