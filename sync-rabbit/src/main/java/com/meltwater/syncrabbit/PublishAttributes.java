package com.meltwater.syncrabbit;

import com.google.common.collect.ImmutableSet;
import com.rabbitmq.client.AMQP;

import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Translates the attribute map of {@link AmqpExchange#publish(byte[], String, int, Map)} into message properties.
 *
 * Recognized keys: {@code app_id, cluster_id, content_type, content_encoding, correlation_id, delivery_mode,
 * expiration, headers, message_id, priority, reply_to, timestamp, type, user_id}. The {@code headers} value (a map)
 * becomes the application headers table. {@code timestamp} is in seconds since the epoch (or a {@link Date}),
 * {@code delivery_mode} a number or a {@link DeliveryMode}.
 */
final class PublishAttributes {

    static final Set<String> KEYS = ImmutableSet.of(
            "app_id", "cluster_id", "content_type", "content_encoding", "correlation_id", "delivery_mode",
            "expiration", "headers", "message_id", "priority", "reply_to", "timestamp", "type", "user_id");

    private PublishAttributes() {
    }

    /**
     * @throws IllegalArgumentException for unknown keys and values of the wrong type
     */
    static AMQP.BasicProperties toProperties(Map<String, ?> attributes) {
        AMQP.BasicProperties.Builder builder = new AMQP.BasicProperties.Builder();
        if (attributes == null) {
            return builder.build();
        }
        for (Map.Entry<String, ?> entry : attributes.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            checkArgument(KEYS.contains(key), "Unknown message attribute '%s', known attributes are %s", key, KEYS);
            if (value == null) {
                continue;
            }
            switch (key) {
                case "app_id":
                    builder.appId(value.toString());
                    break;
                case "cluster_id":
                    builder.clusterId(value.toString());
                    break;
                case "content_type":
                    builder.contentType(value.toString());
                    break;
                case "content_encoding":
                    builder.contentEncoding(value.toString());
                    break;
                case "correlation_id":
                    builder.correlationId(value.toString());
                    break;
                case "delivery_mode":
                    builder.deliveryMode(value instanceof DeliveryMode ? ((DeliveryMode) value).code : asInt(key, value));
                    break;
                case "expiration":
                    builder.expiration(value.toString());
                    break;
                case "headers":
                    builder.headers(asHeaders(value));
                    break;
                case "message_id":
                    builder.messageId(value.toString());
                    break;
                case "priority":
                    builder.priority(asInt(key, value));
                    break;
                case "reply_to":
                    builder.replyTo(value.toString());
                    break;
                case "timestamp":
                    builder.timestamp(value instanceof Date ? (Date) value : new Date(asLong(key, value) * 1000));
                    break;
                case "type":
                    builder.type(value.toString());
                    break;
                case "user_id":
                    builder.userId(value.toString());
                    break;
                default:
                    throw new IllegalArgumentException("Unhandled message attribute '" + key + "'");
            }
        }
        return builder.build();
    }

    private static Map<String, Object> asHeaders(Object value) {
        checkArgument(value instanceof Map, "Message attribute 'headers' must be a map, was %s", value.getClass().getSimpleName());
        Map<String, Object> headers = new HashMap<>();
        for (Map.Entry<?, ?> header : ((Map<?, ?>) value).entrySet()) {
            headers.put(String.valueOf(header.getKey()), header.getValue());
        }
        return headers;
    }

    private static int asInt(String key, Object value) {
        return (int) asLong(key, value);
    }

    private static long asLong(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Message attribute '" + key + "' must be a number, was '" + value + "'", e);
        }
    }
}
