package com.acme.notification.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import java.time.Duration;

/**
 * Settings of the batch consumer. A zero {@code flushInterval} disables the flush timer,
 * so batches are flushed only when full and on shutdown.
 */
@ConfigurationProperties("rabbitmq.batch-consumer")
public class BatchConsumerConfig {

    private String queue = "notifications";
    private int maxBatchSize = 1000;
    private Duration flushInterval = Duration.ZERO;
    private boolean nackRequeue = false;
    private boolean nackMultiple = false;

    public String getQueue() {
        return queue;
    }

    public void setQueue(String queue) {
        this.queue = queue;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public void setMaxBatchSize(int maxBatchSize) {
        this.maxBatchSize = maxBatchSize;
    }

    public Duration getFlushInterval() {
        return flushInterval;
    }

    public void setFlushInterval(Duration flushInterval) {
        this.flushInterval = flushInterval;
    }

    public boolean isNackRequeue() {
        return nackRequeue;
    }

    public void setNackRequeue(boolean nackRequeue) {
        this.nackRequeue = nackRequeue;
    }

    public boolean isNackMultiple() {
        return nackMultiple;
    }

    public void setNackMultiple(boolean nackMultiple) {
        this.nackMultiple = nackMultiple;
    }

    public void validate() {
        if (queue == null || queue.isBlank()) {
            throw new IllegalArgumentException("rabbitmq.batch-consumer.queue must not be blank");
        }
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("rabbitmq.batch-consumer.max-batch-size must be positive, got " + maxBatchSize);
        }
        if (flushInterval == null || flushInterval.isNegative()) {
            throw new IllegalArgumentException("rabbitmq.batch-consumer.flush-interval must not be negative");
        }
    }
}
