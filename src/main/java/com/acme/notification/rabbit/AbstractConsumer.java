package com.acme.notification.rabbit;

import com.acme.notification.core.BrokerUnavailableException;
import com.acme.notification.core.ErrorListener;
import com.acme.notification.core.MessageEnvelope;
import com.acme.notification.spi.BrokerChannel;
import com.acme.notification.spi.BrokerClient;
import com.acme.notification.spi.MessageConsumer;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Connection lifecycle shared by the consumers: one connection and one channel per instance,
 * a durable queue, manual acknowledgements.
 * <p>
 * Each delivery is handled under the read side of {@code inFlight}; {@link #shutdown()} takes the
 * write side after cancelling the subscription, so it waits for the message being handled and
 * no ack or nack is ever issued against a closed channel.
 */
public abstract class AbstractConsumer implements MessageConsumer {
    private final BrokerClient client;
    private final Map<String, Object> queueArguments;
    private final Object lifecycleLock = new Object();
    private final ReadWriteLock inFlight = new ReentrantReadWriteLock();

    protected final String queue;
    protected final ErrorListener errorListener;

    private volatile BrokerSession session;
    private volatile boolean stopping;
    private String consumerTag;

    protected AbstractConsumer(BrokerClient client, String queue, Map<String, Object> queueArguments,
                               ErrorListener errorListener) {
        if (queue == null || queue.isBlank()) {
            throw new IllegalArgumentException("queue must not be blank");
        }
        this.client = client;
        this.queue = queue;
        this.queueArguments = queueArguments == null ? Map.of() : Map.copyOf(queueArguments);
        this.errorListener = errorListener == null ? ErrorListener.NOOP : errorListener;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (session != null) {
                return;
            }
            BrokerSession opened = null;
            try {
                opened = BrokerSession.open(client);
                BrokerChannel ch = opened.channel();
                ch.queueDeclare(queue, true, queueArguments);
                configure(ch);
                session = opened;
                stopping = false;
                consumerTag = ch.basicConsume(queue, this::dispatch);
                afterStart();
            } catch (IOException | TimeoutException | RuntimeException e) {
                session = null;
                consumerTag = null;
                if (opened != null) {
                    try {
                        opened.close();
                    } catch (IOException closeEx) {
                        e.addSuppressed(closeEx);
                    }
                }
                throw new BrokerUnavailableException("Failed to start consumer on queue " + queue, e);
            }
        }
    }

    @Override
    public void shutdown() {
        synchronized (lifecycleLock) {
            BrokerSession current = session;
            if (current == null) {
                return;
            }
            stopping = true;
            Exception failure = null;
            try {
                if (consumerTag != null) {
                    current.channel().basicCancel(consumerTag);
                }
            } catch (IOException | RuntimeException e) {
                failure = e;
            }

            inFlight.writeLock().lock();
            try {
                beforeClose();
            } catch (RuntimeException e) {
                failure = collect(failure, e);
            } finally {
                inFlight.writeLock().unlock();
            }

            try {
                current.close();
            } catch (IOException e) {
                failure = collect(failure, e);
            } finally {
                session = null;
                consumerTag = null;
            }

            if (failure != null) {
                throw new BrokerUnavailableException("Failed to shut down consumer on queue " + queue, failure);
            }
        }
    }

    @Override
    public void checkHealth() {
        BrokerSession.checkReachable(client);
    }

    public boolean isStarted() {
        return session != null;
    }

    /** Channel setup between the queue declaration and the subscription. */
    protected void configure(BrokerChannel channel) throws IOException {
    }

    /** Runs once the subscription is active. */
    protected void afterStart() {
    }

    /** Runs during shutdown once no delivery is in flight, while the channel is still open. */
    protected void beforeClose() {
    }

    protected abstract void onMessage(MessageEnvelope message) throws IOException;

    protected BrokerChannel channel() {
        BrokerSession current = session;
        if (current == null) {
            throw new IllegalStateException("Consumer on queue " + queue + " is not started");
        }
        return current.channel();
    }

    private void dispatch(MessageEnvelope message) {
        inFlight.readLock().lock();
        try {
            // left unsettled; the broker redelivers it once the channel closes
            if (stopping) {
                return;
            }
            onMessage(message);
        } catch (IOException | RuntimeException e) {
            errorListener.onError(e);
        } finally {
            inFlight.readLock().unlock();
        }
    }

    private static Exception collect(Exception failure, Exception next) {
        if (failure == null) {
            return next;
        }
        failure.addSuppressed(next);
        return failure;
    }
}
