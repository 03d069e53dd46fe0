package com.acme.notification.rabbit;

import com.acme.notification.core.MessageEnvelope;
import com.acme.notification.spi.BrokerChannel;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.CancelCallback;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DeliverCallback;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RabbitBrokerChannelTest {

    private Channel amqp;
    private RabbitBrokerChannel channel;

    @BeforeEach
    void setUp() throws Exception {
        amqp = mock(Channel.class);
        when(amqp.isOpen()).thenReturn(true);
        when(amqp.waitForConfirms(anyLong())).thenReturn(true);
        channel = new RabbitBrokerChannel(amqp, 1000);
    }

    private static Delivery delivery(long tag, byte[] body, Map<String, Object> headers) {
        var props = new AMQP.BasicProperties.Builder().headers(headers).build();
        return new Delivery(new Envelope(tag, false, "", "q"), props, body);
    }

    @Test
    void testEnablesPublisherConfirms() throws Exception {
        verify(amqp).confirmSelect();
    }

    @Test
    void testDeclarePassesArgumentsOrNull() throws Exception {
        channel.queueDeclare("plain", true, Map.of());
        channel.queueDeclare("ttl", true, Map.of("x-message-ttl", 1000L));

        verify(amqp).queueDeclare("plain", true, false, false, null);
        verify(amqp).queueDeclare("ttl", true, false, false, Map.of("x-message-ttl", 1000L));
    }

    @Test
    void testPublishSetsHeadersAndDeliveryModeThenWaitsForConfirm() throws Exception {
        byte[] body = {1, 2, 3};

        channel.basicPublish("", "retry-1", body, Map.of("x-retry-count", 1), BrokerChannel.PERSISTENT);

        ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        var order = inOrder(amqp);
        order.verify(amqp).basicPublish(eq(""), eq("retry-1"), props.capture(), same(body));
        order.verify(amqp).waitForConfirms(1000);
        assertEquals(2, props.getValue().getDeliveryMode());
        assertEquals(Map.of("x-retry-count", 1), props.getValue().getHeaders());
    }

    @Test
    void testNegativeConfirmFailsPublish() throws Exception {
        when(amqp.waitForConfirms(anyLong())).thenReturn(false);

        assertThrows(IOException.class,
            () -> channel.basicPublish("", "q", new byte[] {1}, Map.of(), BrokerChannel.PERSISTENT));
    }

    @Test
    void testConfirmTimeoutFailsPublish() throws Exception {
        when(amqp.waitForConfirms(anyLong())).thenThrow(new TimeoutException());

        var ex = assertThrows(IOException.class,
            () -> channel.basicPublish("", "q", new byte[] {1}, Map.of(), BrokerChannel.PERSISTENT));
        assertInstanceOf(TimeoutException.class, ex.getCause());
    }

    @Test
    void testConsumeUsesManualAckAndAdaptsDeliveries() throws Exception {
        when(amqp.basicConsume(eq("q"), eq(false), any(DeliverCallback.class), any(CancelCallback.class)))
            .thenReturn("ctag");
        List<MessageEnvelope> received = new ArrayList<>();

        assertEquals("ctag", channel.basicConsume("q", received::add));

        ArgumentCaptor<DeliverCallback> callback = ArgumentCaptor.forClass(DeliverCallback.class);
        verify(amqp).basicConsume(eq("q"), eq(false), callback.capture(), any(CancelCallback.class));
        callback.getValue().handle("ctag", delivery(7, new byte[] {42}, Map.of("x-retry-count", 0)));

        assertEquals(1, received.size());
        assertArrayEquals(new byte[] {42}, received.get(0).body());
        assertEquals(0, received.get(0).headers().get("x-retry-count"));
    }

    @Test
    void testEmptyBodyBecomesNull() {
        MessageEnvelope envelope = channel.toEnvelope(delivery(1, new byte[0], null));

        assertNull(envelope.body());
        assertFalse(envelope.hasBody());
        assertTrue(envelope.headers().isEmpty());
    }

    @Test
    void testHandleSettlesItsOwnDeliveryTag() throws Exception {
        channel.toEnvelope(delivery(5, new byte[] {1}, null)).handle().ack();
        channel.toEnvelope(delivery(6, new byte[] {1}, null)).handle().nack(true, false);

        verify(amqp).basicAck(5, false);
        verify(amqp).basicNack(6, false, true);
    }

    @Test
    void testHandleSettlesOnlyOnce() throws Exception {
        MessageEnvelope envelope = channel.toEnvelope(delivery(9, new byte[] {1}, null));
        envelope.handle().ack();

        assertThrows(IllegalStateException.class, () -> envelope.handle().nack(false, false));
        verify(amqp, never()).basicNack(anyLong(), anyBoolean(), anyBoolean());
    }

    @Test
    void testCancelAndCloseSkipClosedChannel() throws Exception {
        when(amqp.isOpen()).thenReturn(false);

        channel.basicCancel("ctag");
        channel.close();

        verify(amqp, never()).basicCancel(anyString());
        verify(amqp, never()).close();
    }
}
