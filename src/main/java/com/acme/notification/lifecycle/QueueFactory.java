package com.acme.notification.lifecycle;

import com.acme.notification.config.BatchConsumerConfig;
import com.acme.notification.config.ProducerConfig;
import com.acme.notification.config.RetryConsumerConfig;
import com.acme.notification.config.TopologyConfig;
import com.acme.notification.logging.LoggedConsumer;
import com.acme.notification.logging.LoggedProducer;
import com.acme.notification.logging.LoggingErrorListener;
import com.acme.notification.rabbit.BatchConsumer;
import com.acme.notification.rabbit.RabbitFactoryProvider;
import com.acme.notification.rabbit.RabbitProducer;
import com.acme.notification.rabbit.RabbitTopologyInitializer;
import com.acme.notification.rabbit.RetryConsumer;
import com.acme.notification.sample.Notification;
import com.acme.notification.sample.NotificationBatchHandler;
import com.acme.notification.spi.BrokerClient;
import com.acme.notification.spi.MessageConsumer;
import com.acme.notification.spi.MessageProducer;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.TaskScheduler;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

/**
 * Builds the consumers and the producer, each wrapped in its logging decorator.
 */
@Factory
@Requires(beans = RabbitFactoryProvider.class)
@Requires(property = "rabbitmq.consumers.enabled", value = "true", defaultValue = "false")
public class QueueFactory {

    @Singleton
    @Named("batchConsumer")
    public MessageConsumer batchConsumer(BrokerClient client, NotificationBatchHandler handler,
                                         BatchConsumerConfig config, TopologyConfig topology,
                                         @Named(TaskExecutors.SCHEDULED) TaskScheduler scheduler) {
        var consumer = new BatchConsumer<>(
            client,
            handler,
            Notification.class,
            config,
            scheduler,
            RabbitTopologyInitializer.argumentsFor(topology, config.getQueue()),
            new LoggingErrorListener("batch consumer " + config.getQueue())
        );
        return new LoggedConsumer(consumer, "batch:" + config.getQueue());
    }

    @Singleton
    @Named("retryConsumer")
    public MessageConsumer retryConsumer(BrokerClient client, RetryConsumerConfig config, TopologyConfig topology) {
        config.validate();
        var consumer = new RetryConsumer(
            client,
            config,
            RabbitTopologyInitializer.argumentsFor(topology, config.getQueue()),
            new LoggingErrorListener("retry consumer " + config.getQueue())
        );
        return new LoggedConsumer(consumer, "retry:" + config.getQueue());
    }

    @Singleton
    public MessageProducer<Notification> notificationProducer(BrokerClient client, ProducerConfig config) {
        return new LoggedProducer<>(new RabbitProducer<>(client, config.getQueue()), "notifications:" + config.getQueue());
    }
}
