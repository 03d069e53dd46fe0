package com.acme.notification.rabbit;

import com.acme.notification.core.BrokerUnavailableException;
import com.acme.notification.core.Jsons;
import com.acme.notification.core.RetryRouter;
import com.acme.notification.spi.BrokerChannel;
import com.acme.notification.spi.BrokerClient;
import com.acme.notification.spi.MessageProducer;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Publishes items as persistent JSON messages with a zero retry count, the entry point of the
 * retry chain. All operations are serialized, so {@link #publish(List)} never overlaps a
 * {@link #shutdown()} and fails once the producer is stopped.
 */
public class RabbitProducer<T> implements MessageProducer<T> {
    private static final Map<String, Object> INITIAL_HEADERS = Map.of(RetryRouter.RETRY_COUNT_HEADER, 0);

    private final BrokerClient client;
    private final String queue;

    private BrokerSession session;

    public RabbitProducer(BrokerClient client, String queue) {
        if (queue == null || queue.isBlank()) {
            throw new IllegalArgumentException("queue must not be blank");
        }
        this.client = client;
        this.queue = queue;
    }

    @Override
    public synchronized void start() {
        if (session != null) {
            return;
        }
        try {
            session = BrokerSession.open(client);
        } catch (IOException | TimeoutException e) {
            throw new BrokerUnavailableException("Failed to start producer for queue " + queue, e);
        }
    }

    @Override
    public synchronized void publish(List<T> items) {
        if (session == null) {
            throw new IllegalStateException("Producer for queue " + queue + " is not started");
        }
        BrokerChannel channel = session.channel();
        for (T item : items) {
            try {
                channel.basicPublish("", queue, Jsons.toBytes(item), INITIAL_HEADERS, BrokerChannel.PERSISTENT);
            } catch (IOException e) {
                throw new RuntimeException("Failed to publish message to queue: " + queue, e);
            }
        }
    }

    @Override
    public synchronized void shutdown() {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (IOException e) {
            throw new BrokerUnavailableException("Failed to shut down producer for queue " + queue, e);
        } finally {
            session = null;
        }
    }

    @Override
    public void checkHealth() {
        BrokerSession.checkReachable(client);
    }
}
