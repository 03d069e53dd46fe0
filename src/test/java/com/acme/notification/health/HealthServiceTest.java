package com.acme.notification.health;

import com.acme.notification.core.BrokerUnavailableException;
import com.acme.notification.spi.MessageConsumer;
import com.acme.notification.spi.MessageProducer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HealthServiceTest {

    @Test
    void testChecksEveryComponent() {
        MessageConsumer batch = mock(MessageConsumer.class);
        MessageConsumer retry = mock(MessageConsumer.class);
        MessageProducer<?> producer = mock(MessageProducer.class);

        new HealthService(List.of(batch, retry), List.of(producer)).checkHealth();

        verify(batch).checkHealth();
        verify(retry).checkHealth();
        verify(producer).checkHealth();
    }

    @Test
    void testFirstFailureIsPropagated() {
        MessageConsumer batch = mock(MessageConsumer.class);
        MessageConsumer retry = mock(MessageConsumer.class);
        doThrow(new BrokerUnavailableException("RabbitMQ недоступен", null)).when(batch).checkHealth();

        var service = new HealthService(List.of(batch, retry), List.of());

        var ex = assertThrows(BrokerUnavailableException.class, service::checkHealth);
        assertEquals("RabbitMQ недоступен", ex.getMessage());
        verify(retry, never()).checkHealth();
    }

    @Test
    void testNoComponentsIsHealthy() {
        assertDoesNotThrow(() -> new HealthService(List.of(), List.of()).checkHealth());
    }
}
