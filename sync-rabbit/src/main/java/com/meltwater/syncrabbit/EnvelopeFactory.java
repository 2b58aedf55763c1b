package com.meltwater.syncrabbit;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.LongString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link Envelope}s from the deliveries handed out by the RabbitMQ client.
 *
 * The conversion has no side effects and never fails: absent properties become the envelope defaults and the
 * header table is flattened into plain java values ({@link LongString} becomes {@link String}, nested tables and
 * arrays are converted recursively).
 */
public final class EnvelopeFactory {

    private EnvelopeFactory() {
    }

    public static Envelope fromDelivery(Delivery delivery) {
        Envelope.Builder builder = Envelope.builder().body(delivery.getBody());

        com.rabbitmq.client.Envelope envelope = delivery.getEnvelope();
        if (envelope != null) {
            builder.deliveryTag(envelope.getDeliveryTag())
                    .redelivery(envelope.isRedeliver())
                    .exchangeName(envelope.getExchange())
                    .routingKey(envelope.getRoutingKey());
        }

        AMQP.BasicProperties properties = delivery.getProperties();
        if (properties != null) {
            builder.appId(properties.getAppId())
                    .contentType(properties.getContentType())
                    .contentEncoding(properties.getContentEncoding())
                    .correlationId(properties.getCorrelationId())
                    .deliveryMode(properties.getDeliveryMode())
                    .expiration(properties.getExpiration())
                    .headers(flattenTable(properties.getHeaders()))
                    .messageId(properties.getMessageId())
                    .priority(properties.getPriority())
                    .replyTo(properties.getReplyTo())
                    .timestamp(properties.getTimestamp() == null ? 0 : properties.getTimestamp().getTime() / 1000)
                    .type(properties.getType())
                    .userId(properties.getUserId())
                    .clusterId(properties.getClusterId());
        }
        return builder.build();
    }

    static Map<String, Object> flattenTable(Map<String, Object> table) {
        if (table == null) {
            return Collections.emptyMap();
        }
        Map<String, Object> flat = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : table.entrySet()) {
            flat.put(entry.getKey(), flattenValue(entry.getValue()));
        }
        return flat;
    }

    private static Object flattenValue(Object value) {
        if (value instanceof LongString) {
            return value.toString();
        }
        if (value instanceof Map) {
            Map<String, Object> flat = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                flat.put(String.valueOf(entry.getKey()), flattenValue(entry.getValue()));
            }
            return Collections.unmodifiableMap(flat);
        }
        if (value instanceof List) {
            List<Object> flat = new ArrayList<>();
            for (Object element : (List<?>) value) {
                flat.add(flattenValue(element));
            }
            return Collections.unmodifiableList(flat);
        }
        return value;
    }
}
