package com.acme.notification.rabbit;

import com.acme.notification.config.BatchConsumerConfig;
import com.acme.notification.core.BatchHandler;
import com.acme.notification.core.DeliveryHandle;
import com.acme.notification.core.ErrorListener;
import com.acme.notification.core.HandlerResult;
import com.acme.notification.core.Jsons;
import com.acme.notification.core.MessageEnvelope;
import com.acme.notification.spi.BrokerChannel;
import com.acme.notification.spi.BrokerClient;
import io.micronaut.scheduling.TaskScheduler;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Buffers JSON deliveries and hands them to a {@link BatchHandler} one batch at a time, then acks
 * or nacks every message according to the handler's per-item result.
 * <ul>
 *   <li>empty body: acked, never batched</li>
 *   <li>body that does not parse as {@code T}: nacked, never batched</li>
 *   <li>handler failure or wrong number of results: the whole batch is nacked</li>
 * </ul>
 * Prefetch is set to the batch size, so the broker never has more unacked messages
 * outstanding than one batch can hold. A positive flush interval also flushes partial batches
 * on the given {@link TaskScheduler}.
 */
public class BatchConsumer<T> extends AbstractConsumer {
    private final BatchHandler<T> handler;
    private final Class<T> payloadType;
    private final TaskScheduler scheduler;
    private final int maxBatchSize;
    private final Duration flushInterval;
    private final boolean nackRequeue;
    private final boolean nackMultiple;

    private final Object batchLock = new Object();
    private final ReentrantLock flushLock = new ReentrantLock();
    private List<BatchItem<T>> batch;
    private volatile ScheduledFuture<?> flushTask;

    public BatchConsumer(BrokerClient client, BatchHandler<T> handler, Class<T> payloadType,
                         BatchConsumerConfig config, TaskScheduler scheduler, Map<String, Object> queueArguments,
                         ErrorListener errorListener) {
        super(client, config.getQueue(), queueArguments, errorListener);
        config.validate();
        if (scheduler == null && !config.getFlushInterval().isZero()) {
            throw new IllegalArgumentException("a scheduler is required when rabbitmq.batch-consumer.flush-interval is set");
        }
        this.handler = handler;
        this.payloadType = payloadType;
        this.scheduler = scheduler;
        this.maxBatchSize = config.getMaxBatchSize();
        this.flushInterval = config.getFlushInterval();
        this.nackRequeue = config.isNackRequeue();
        this.nackMultiple = config.isNackMultiple();
        this.batch = new ArrayList<>(maxBatchSize);
    }

    @Override
    protected void configure(BrokerChannel channel) throws IOException {
        channel.basicQos(maxBatchSize);
    }

    @Override
    protected void afterStart() {
        if (!flushInterval.isZero()) {
            flushTask = scheduler.scheduleWithFixedDelay(flushInterval, flushInterval, this::flushPending);
        }
    }

    @Override
    protected void beforeClose() {
        ScheduledFuture<?> task = flushTask;
        if (task != null) {
            flushTask = null;
            task.cancel(false);
        }
        flushPending();
    }

    @Override
    protected void onMessage(MessageEnvelope message) throws IOException {
        if (!message.hasBody()) {
            message.handle().ack();
            return;
        }

        T payload;
        try {
            payload = Jsons.fromBytes(message.body(), payloadType);
        } catch (IOException e) {
            reject(message.handle());
            return;
        }

        List<BatchItem<T>> full = null;
        synchronized (batchLock) {
            batch.add(new BatchItem<>(payload, message.handle()));
            if (batch.size() >= maxBatchSize) {
                full = swap();
            }
        }
        if (full != null) {
            flush(full);
        }
    }

    /** Flushes whatever has accumulated so far; no-op on an empty batch. Waits for a running flush first. */
    void flushPending() {
        flushLock.lock();
        try {
            List<BatchItem<T>> pending;
            synchronized (batchLock) {
                if (batch.isEmpty()) {
                    return;
                }
                pending = swap();
            }
            flush(pending);
        } finally {
            flushLock.unlock();
        }
    }

    int pendingCount() {
        synchronized (batchLock) {
            return batch.size();
        }
    }

    // callers hold batchLock
    private List<BatchItem<T>> swap() {
        List<BatchItem<T>> current = batch;
        batch = new ArrayList<>(maxBatchSize);
        return current;
    }

    private void flush(List<BatchItem<T>> items) {
        flushLock.lock();
        try {
            List<HandlerResult> results = invokeHandler(items);
            for (int i = 0; i < items.size(); i++) {
                DeliveryHandle handle = items.get(i).handle();
                HandlerResult result = results == null ? null : results.get(i);
                try {
                    if (result != null && result.success()) {
                        handle.ack();
                    } else {
                        reject(handle);
                    }
                } catch (IOException | RuntimeException e) {
                    errorListener.onError(e);
                }
            }
        } finally {
            flushLock.unlock();
        }
    }

    /**
     * @return results aligned with {@code items}, or null when the batch has to be treated as failed
     */
    private List<HandlerResult> invokeHandler(List<BatchItem<T>> items) {
        List<T> payloads = new ArrayList<>(items.size());
        for (BatchItem<T> item : items) {
            payloads.add(item.payload());
        }
        try {
            List<HandlerResult> results = handler.handle(payloads);
            if (results == null || results.size() != items.size()) {
                errorListener.onError(new IllegalStateException("Handler returned "
                    + (results == null ? "no" : String.valueOf(results.size()))
                    + " results for a batch of " + items.size()));
                return null;
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            errorListener.onError(e);
            return null;
        } catch (Exception e) {
            errorListener.onError(e);
            return null;
        }
    }

    private void reject(DeliveryHandle handle) throws IOException {
        handle.nack(nackRequeue, nackMultiple);
    }

    private record BatchItem<T>(T payload, DeliveryHandle handle) {}
}
