package com.acme.notification.health;

import com.acme.notification.spi.MessageConsumer;
import com.acme.notification.spi.MessageProducer;
import jakarta.inject.Singleton;
import java.util.List;

/**
 * Readiness check over every broker-facing component. The first failure is rethrown.
 */
@Singleton
public class HealthService {
    private final List<MessageConsumer> consumers;
    private final List<MessageProducer<?>> producers;

    public HealthService(List<MessageConsumer> consumers, List<MessageProducer<?>> producers) {
        this.consumers = consumers;
        this.producers = producers;
    }

    public void checkHealth() {
        for (MessageConsumer consumer : consumers) {
            consumer.checkHealth();
        }
        for (MessageProducer<?> producer : producers) {
            producer.checkHealth();
        }
    }
}
