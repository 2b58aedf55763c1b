package com.meltwater.syncrabbit;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.impl.LongStringHelper;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class EnvelopeFactoryTest {

    @Test
    public void missing_properties_become_defaults() {
        Delivery delivery = new Delivery(
                new com.rabbitmq.client.Envelope(7, false, "", "key"),
                new AMQP.BasicProperties.Builder().build(),
                null);

        Envelope envelope = EnvelopeFactory.fromDelivery(delivery);

        assertThat(envelope.getDeliveryTag(), is(7L));
        assertThat(envelope.getRoutingKey(), is("key"));
        assertThat(envelope.getExchangeName(), is(""));
        assertThat(envelope.getBody().length, is(0));
        assertThat(envelope.getAppId(), is(""));
        assertThat(envelope.getContentType(), is(""));
        assertThat(envelope.getContentEncoding(), is(""));
        assertThat(envelope.getCorrelationId(), is(""));
        assertThat(envelope.getDeliveryMode(), is(0));
        assertThat(envelope.getExpiration(), is(""));
        assertThat(envelope.getHeaders().isEmpty(), is(true));
        assertThat(envelope.getMessageId(), is(""));
        assertThat(envelope.getPriority(), is(0));
        assertThat(envelope.getReplyTo(), is(""));
        assertThat(envelope.getTimestamp(), is(0L));
        assertThat(envelope.getType(), is(""));
        assertThat(envelope.getUserId(), is(""));
        assertThat(envelope.getClusterId(), is(""));
        assertThat(envelope.isRedelivery(), is(false));
    }

    @Test
    public void copies_all_properties() {
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .appId("app")
                .contentType("text/plain")
                .contentEncoding("utf-8")
                .correlationId("corr")
                .deliveryMode(2)
                .expiration("60000")
                .messageId("msg-1")
                .priority(5)
                .replyTo("replies")
                .timestamp(new Date(1_500_000_000_000L))
                .type("order.created")
                .userId("guest")
                .clusterId("cluster")
                .build();
        Delivery delivery = new Delivery(
                new com.rabbitmq.client.Envelope(42, true, "orders", "order.created"),
                properties,
                "hello".getBytes(StandardCharsets.UTF_8));

        Envelope envelope = EnvelopeFactory.fromDelivery(delivery);

        assertThat(new String(envelope.getBody(), StandardCharsets.UTF_8), is("hello"));
        assertThat(envelope.getDeliveryTag(), is(42L));
        assertThat(envelope.isRedelivery(), is(true));
        assertThat(envelope.getExchangeName(), is("orders"));
        assertThat(envelope.getAppId(), is("app"));
        assertThat(envelope.getContentType(), is("text/plain"));
        assertThat(envelope.getContentEncoding(), is("utf-8"));
        assertThat(envelope.getCorrelationId(), is("corr"));
        assertThat(envelope.getDeliveryMode(), is(DeliveryMode.persistent.code));
        assertThat(envelope.getExpiration(), is("60000"));
        assertThat(envelope.getMessageId(), is("msg-1"));
        assertThat(envelope.getPriority(), is(5));
        assertThat(envelope.getReplyTo(), is("replies"));
        assertThat(envelope.getTimestamp(), is(1_500_000_000L));
        assertThat(envelope.getType(), is("order.created"));
        assertThat(envelope.getUserId(), is("guest"));
        assertThat(envelope.getClusterId(), is("cluster"));
    }

    @Test
    public void flattens_header_values() {
        Map<String, Object> nested = new HashMap<>();
        nested.put("inner", LongStringHelper.asLongString("deep"));
        Map<String, Object> headers = new HashMap<>();
        headers.put("text", LongStringHelper.asLongString("value"));
        headers.put("count", 3);
        headers.put("table", nested);
        headers.put("list", Arrays.<Object>asList(LongStringHelper.asLongString("a"), 1));
        headers.put("nothing", null);
        Delivery delivery = new Delivery(
                new com.rabbitmq.client.Envelope(1, false, "ex", ""),
                new AMQP.BasicProperties.Builder().headers(headers).build(),
                new byte[0]);

        Envelope envelope = EnvelopeFactory.fromDelivery(delivery);

        assertThat(envelope.getHeader("text"), is(Optional.<Object>of("value")));
        assertThat(envelope.getHeader("count"), is(Optional.<Object>of(3)));
        assertThat(envelope.getHeader("nothing"), is(Optional.empty()));
        assertThat(envelope.getHeader("missing"), is(Optional.empty()));
        assertThat(envelope.getHeaders().containsKey("nothing"), is(true));

        Object table = envelope.getHeader("table").get();
        assertThat(table, instanceOf(Map.class));
        assertThat(((Map<?, ?>) table).get("inner"), equalTo((Object) "deep"));

        @SuppressWarnings("unchecked")
        List<Object> list = (List<Object>) envelope.getHeader("list").get();
        assertThat(list, contains((Object) "a", 1));
    }

    @Test
    public void nested_tables_are_flattened_recursively() {
        Map<String, Object> inner = new HashMap<>();
        inner.put("deepest", Arrays.<Object>asList(LongStringHelper.asLongString("x")));
        Map<String, Object> outer = new HashMap<>();
        outer.put("inner", inner);
        Map<String, Object> headers = new HashMap<>();
        headers.put("outer", outer);
        Delivery delivery = new Delivery(
                new com.rabbitmq.client.Envelope(1, false, "ex", ""),
                new AMQP.BasicProperties.Builder().headers(headers).build(),
                new byte[0]);

        Map<?, ?> flatOuter = (Map<?, ?>) EnvelopeFactory.fromDelivery(delivery).getHeader("outer").get();
        Map<?, ?> flatInner = (Map<?, ?>) flatOuter.get("inner");

        assertThat(flatInner.get("deepest"), equalTo((Object) Arrays.<Object>asList("x")));
    }

    @Test
    public void body_can_not_be_changed_from_outside() {
        byte[] body = {1, 2, 3};
        Envelope envelope = EnvelopeFactory.fromDelivery(new Delivery(
                new com.rabbitmq.client.Envelope(1, false, "", ""),
                new AMQP.BasicProperties.Builder().build(),
                body));

        body[0] = 9;
        envelope.getBody()[1] = 9;

        assertThat(envelope.getBody()[0], is((byte) 1));
        assertThat(envelope.getBody()[1], is((byte) 2));
    }

    @Test
    public void envelopes_with_the_same_content_are_equal() {
        Delivery delivery = new Delivery(
                new com.rabbitmq.client.Envelope(3, false, "ex", "rk"),
                new AMQP.BasicProperties.Builder().messageId("m").build(),
                new byte[]{1});

        assertThat(EnvelopeFactory.fromDelivery(delivery), equalTo(EnvelopeFactory.fromDelivery(delivery)));
    }
}
