package com.acme.notification.config;

import com.acme.notification.core.RetryPolicy;
import io.micronaut.context.annotation.ConfigurationProperties;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the retry-routing consumer: the queue it listens on and the escalation chain.
 */
@ConfigurationProperties("rabbitmq.retry-consumer")
public class RetryConsumerConfig {

    private String queue = "notifications.retry.router";
    private List<String> retryQueues = new ArrayList<>(List.of("notifications.retry.30m", "notifications.retry.2h"));
    private String deadLetterQueue = "notifications.dlq";

    public String getQueue() {
        return queue;
    }

    public void setQueue(String queue) {
        this.queue = queue;
    }

    public List<String> getRetryQueues() {
        return retryQueues;
    }

    public void setRetryQueues(List<String> retryQueues) {
        this.retryQueues = retryQueues;
    }

    public String getDeadLetterQueue() {
        return deadLetterQueue;
    }

    public void setDeadLetterQueue(String deadLetterQueue) {
        this.deadLetterQueue = deadLetterQueue;
    }

    public RetryPolicy toPolicy() {
        return new RetryPolicy(retryQueues, deadLetterQueue);
    }

    public void validate() {
        if (queue == null || queue.isBlank()) {
            throw new IllegalArgumentException("rabbitmq.retry-consumer.queue must not be blank");
        }
        toPolicy();
    }
}
