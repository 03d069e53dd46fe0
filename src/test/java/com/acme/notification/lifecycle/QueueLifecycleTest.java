package com.acme.notification.lifecycle;

import com.acme.notification.rabbit.RabbitTopologyInitializer;
import com.acme.notification.sample.Notification;
import com.acme.notification.spi.MessageConsumer;
import com.acme.notification.spi.MessageProducer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class QueueLifecycleTest {

    private MessageProducer<Notification> producer;
    private MessageConsumer batch;
    private MessageConsumer retry;
    private RabbitTopologyInitializer topology;

    @BeforeEach
    void setUp() {
        producer = mock();
        batch = mock(MessageConsumer.class);
        retry = mock(MessageConsumer.class);
        topology = mock(RabbitTopologyInitializer.class);
    }

    @Test
    void testStartDeclaresTopologyThenStartsComponents() {
        new QueueLifecycle(producer, batch, retry, topology).start();

        InOrder order = inOrder(topology, producer, batch, retry);
        order.verify(topology).ensureTopology();
        order.verify(producer).start();
        order.verify(batch).start();
        order.verify(retry).start();
    }

    @Test
    void testStartWithoutTopology() {
        assertDoesNotThrow(() -> new QueueLifecycle(producer, batch, retry, null).start());
        verify(retry).start();
    }

    @Test
    void testStopRunsInReverseOrderAndSurvivesFailures() {
        doThrow(new RuntimeException("close failed")).when(retry).shutdown();

        new QueueLifecycle(producer, batch, retry, topology).stop();

        InOrder order = inOrder(retry, batch, producer);
        order.verify(retry).shutdown();
        order.verify(batch).shutdown();
        order.verify(producer).shutdown();
    }

    @Test
    void testStartFailurePropagates() {
        doThrow(new IllegalStateException("Failed to declare RabbitMQ queues")).when(topology).ensureTopology();

        assertThrows(IllegalStateException.class, () -> new QueueLifecycle(producer, batch, retry, topology).start());
        verifyNoInteractions(producer, batch, retry);
    }
}
