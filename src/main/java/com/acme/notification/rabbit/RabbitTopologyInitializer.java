package com.acme.notification.rabbit;

import com.acme.notification.config.TopologyConfig;
import com.acme.notification.spi.BrokerChannel;
import com.acme.notification.spi.BrokerClient;
import com.acme.notification.spi.BrokerConnection;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declares the retry topology:
 * <pre>
 * main queue --dead-letter--> retry router --publish--> retry queue (TTL) --dead-letter--> main queue
 *                                  |
 *                                  +--publish--> DLQ
 * </pre>
 * If any declaration fails, the queues this run created are deleted again in reverse order.
 * Queues that already existed are never deleted.
 */
@Singleton
@Requires(beans = RabbitFactoryProvider.class)
@Requires(property = "rabbitmq.topology.declare", value = "true")
public class RabbitTopologyInitializer {
    private static final Logger LOG = LoggerFactory.getLogger(RabbitTopologyInitializer.class);

    private static final String DLX = "x-dead-letter-exchange";
    private static final String DLX_ROUTING_KEY = "x-dead-letter-routing-key";
    private static final String MESSAGE_TTL = "x-message-ttl";

    private final BrokerClient client;
    private final TopologyConfig config;

    public RabbitTopologyInitializer(BrokerClient client, TopologyConfig config) {
        config.validate();
        this.client = client;
        this.config = config;
    }

    public void ensureTopology() {
        Map<String, Map<String, Object>> queues = queues(config);
        LOG.info("Ensuring RabbitMQ queues {}", queues.keySet());

        try (BrokerConnection connection = client.connect()) {
            declare(connection, queues);
        } catch (IOException | TimeoutException e) {
            throw new IllegalStateException("Failed to declare RabbitMQ queues", e);
        }
    }

    private void declare(BrokerConnection connection, Map<String, Map<String, Object>> queues) throws IOException {
        // only queues created by this run are rolled back
        Deque<String> created = new ArrayDeque<>();
        BrokerChannel channel = connection.channel();
        try {
            for (var entry : queues.entrySet()) {
                boolean existed = connection.queueExists(entry.getKey());
                channel.queueDeclare(entry.getKey(), true, entry.getValue());
                if (!existed) {
                    created.push(entry.getKey());
                }
            }
            LOG.info("RabbitMQ queues declared: {}, created: {}", queues.keySet(), created);
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to declare RabbitMQ queues, rolling back {}", created, e);
            rollback(connection, created);
            throw new IllegalStateException("Failed to declare RabbitMQ queues", e);
        } finally {
            close(channel);
        }
    }

    // a failed declare closes its channel, so deletes go through a new one
    private void rollback(BrokerConnection connection, Deque<String> created) {
        if (created.isEmpty()) {
            return;
        }
        BrokerChannel channel;
        try {
            channel = connection.channel();
        } catch (IOException | RuntimeException e) {
            LOG.error("Cannot open a channel to roll back queues {}", created, e);
            return;
        }
        try {
            while (!created.isEmpty()) {
                String queue = created.pop();
                try {
                    channel.queueDelete(queue);
                    LOG.info("Rolled back queue {}", queue);
                } catch (IOException | RuntimeException e) {
                    LOG.warn("Could not delete queue {} during rollback", queue, e);
                }
            }
        } finally {
            close(channel);
        }
    }

    private static void close(BrokerChannel channel) {
        try {
            channel.close();
        } catch (IOException | TimeoutException | RuntimeException e) {
            LOG.warn("Error closing RabbitMQ channel after declaring queues", e);
        }
    }

    /**
     * Queue arguments in declaration order: dead-letter targets are declared before the queues
     * that route into them.
     */
    public static Map<String, Map<String, Object>> queues(TopologyConfig config) {
        var queues = new LinkedHashMap<String, Map<String, Object>>();
        queues.put(config.getRetryRouterDeadLetterQueue(), Map.of());
        queues.put(config.getDeadLetterQueue(), Map.of());
        for (int i = 0; i < config.getRetryQueues().size(); i++) {
            queues.put(config.getRetryQueues().get(i), Map.of(
                DLX, "",
                DLX_ROUTING_KEY, config.getMainQueue(),
                MESSAGE_TTL, config.getRetryQueueTtls().get(i).toMillis()
            ));
        }
        queues.put(config.getRetryRouterQueue(), Map.of(
            DLX, "",
            DLX_ROUTING_KEY, config.getRetryRouterDeadLetterQueue()
        ));
        queues.put(config.getMainQueue(), Map.of(
            DLX, "",
            DLX_ROUTING_KEY, config.getRetryRouterQueue()
        ));
        return queues;
    }

    /**
     * Arguments a consumer must use when it redeclares {@code queue}; RabbitMQ rejects a
     * redeclaration whose arguments differ from the existing queue.
     */
    public static Map<String, Object> argumentsFor(TopologyConfig config, String queue) {
        if (!config.isDeclare()) {
            return Map.of();
        }
        return queues(config).getOrDefault(queue, Map.of());
    }
}
