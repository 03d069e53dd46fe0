package com.acme.notification.rabbit;

import com.acme.notification.spi.BrokerConnection;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RabbitBrokerClientTest {

    @Test
    void testOpensNamedConnectionAndConfirmingChannel() throws Exception {
        ConnectionFactory factory = mock(ConnectionFactory.class);
        Connection connection = mock(Connection.class);
        Channel channel = mock(Channel.class);
        when(factory.newConnection("notification-queues")).thenReturn(connection);
        when(connection.createChannel()).thenReturn(channel);
        when(connection.isOpen()).thenReturn(true);

        try (BrokerConnection opened = new RabbitBrokerClient(factory, "notification-queues", 500).connect()) {
            assertNotNull(opened.channel());
        }

        verify(channel).confirmSelect();
        verify(connection).close();
    }

    @Test
    void testNoChannelAvailable() throws Exception {
        Connection connection = mock(Connection.class);
        when(connection.createChannel()).thenReturn(null);

        assertThrows(IOException.class, () -> new RabbitBrokerConnection(connection, 500).channel());
    }

    @Test
    void testCloseSkipsClosedConnection() throws Exception {
        Connection connection = mock(Connection.class);
        when(connection.isOpen()).thenReturn(false);

        new RabbitBrokerConnection(connection, 500).close();

        verify(connection, never()).close();
    }

    private static IOException channelClosedWith(int replyCode) {
        var close = new AMQP.Channel.Close.Builder().replyCode(replyCode).replyText("closed").build();
        return new IOException(new ShutdownSignalException(false, false, close, null));
    }

    @Test
    void testQueueExistsUsesOwnChannel() throws Exception {
        Connection connection = mock(Connection.class);
        Channel checkChannel = mock(Channel.class);
        when(connection.createChannel()).thenReturn(checkChannel);
        when(checkChannel.isOpen()).thenReturn(true);

        assertTrue(new RabbitBrokerConnection(connection, 500).queueExists("notifications.dlq"));

        verify(checkChannel).queueDeclarePassive("notifications.dlq");
        verify(checkChannel).close();
    }

    @Test
    void testMissingQueueIsReportedAsAbsent() throws Exception {
        Connection connection = mock(Connection.class);
        Channel checkChannel = mock(Channel.class);
        when(connection.createChannel()).thenReturn(checkChannel);
        when(checkChannel.queueDeclarePassive("notifications.dlq")).thenThrow(channelClosedWith(AMQP.NOT_FOUND));

        assertFalse(new RabbitBrokerConnection(connection, 500).queueExists("notifications.dlq"));
    }

    @Test
    void testOtherPassiveDeclareFailuresPropagate() throws Exception {
        Connection connection = mock(Connection.class);
        Channel checkChannel = mock(Channel.class);
        when(connection.createChannel()).thenReturn(checkChannel);
        when(checkChannel.queueDeclarePassive("notifications.dlq")).thenThrow(channelClosedWith(AMQP.ACCESS_REFUSED));

        assertThrows(IOException.class, () -> new RabbitBrokerConnection(connection, 500).queueExists("notifications.dlq"));
    }
}
