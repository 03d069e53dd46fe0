package com.acme.notification.lifecycle;

import com.acme.notification.rabbit.RabbitFactoryProvider;
import com.acme.notification.rabbit.RabbitTopologyInitializer;
import com.acme.notification.sample.Notification;
import com.acme.notification.spi.MessageConsumer;
import com.acme.notification.spi.MessageProducer;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import io.micronaut.core.annotation.Nullable;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the producer and the consumers once the application is up and stops them in reverse
 * order on shutdown.
 * <p>
 * The producer is started here but never called from inside the service. It is the ingress
 * point: whatever accepts notifications (an HTTP endpoint, another listener) injects the
 * {@code MessageProducer<Notification>} bean and calls {@code publish}.
 */
@Singleton
@Requires(beans = RabbitFactoryProvider.class)
@Requires(property = "rabbitmq.consumers.enabled", value = "true", defaultValue = "false")
public class QueueLifecycle implements ApplicationEventListener<StartupEvent> {
    private static final Logger LOG = LoggerFactory.getLogger(QueueLifecycle.class);

    private final MessageProducer<Notification> producer;
    private final MessageConsumer batchConsumer;
    private final MessageConsumer retryConsumer;
    private final RabbitTopologyInitializer topology;

    public QueueLifecycle(MessageProducer<Notification> producer,
                          @Named("batchConsumer") MessageConsumer batchConsumer,
                          @Named("retryConsumer") MessageConsumer retryConsumer,
                          @Nullable RabbitTopologyInitializer topology) {
        this.producer = producer;
        this.batchConsumer = batchConsumer;
        this.retryConsumer = retryConsumer;
        this.topology = topology;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        start();
    }

    void start() {
        if (topology != null) {
            topology.ensureTopology();
        }
        producer.start();
        batchConsumer.start();
        retryConsumer.start();
        LOG.info("Queue consumers started");
    }

    @PreDestroy
    void stop() {
        stopQuietly("retry consumer", retryConsumer::shutdown);
        stopQuietly("batch consumer", batchConsumer::shutdown);
        stopQuietly("producer", producer::shutdown);
        LOG.info("Queue consumers stopped");
    }

    // keeps shutting the rest down when one component fails
    private static void stopQuietly(String component, Runnable shutdown) {
        try {
            shutdown.run();
        } catch (RuntimeException e) {
            LOG.warn("Error stopping {}", component, e);
        }
    }
}
