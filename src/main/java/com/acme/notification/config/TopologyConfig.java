package com.acme.notification.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Retry topology declared at startup. Each retry queue holds messages for its TTL and then
 * dead-letters them back to the main queue, which is where the delay between attempts comes from.
 */
@ConfigurationProperties("rabbitmq.topology")
public class TopologyConfig {

    private boolean declare = false;
    private String mainQueue = "notifications";
    private String retryRouterQueue = "notifications.retry.router";
    private String retryRouterDeadLetterQueue = "notifications.retry.router.dlq";
    private String deadLetterQueue = "notifications.dlq";
    private List<String> retryQueues = new ArrayList<>(List.of("notifications.retry.30m", "notifications.retry.2h"));
    private List<Duration> retryQueueTtls = new ArrayList<>(List.of(Duration.ofMinutes(30), Duration.ofHours(2)));

    public boolean isDeclare() {
        return declare;
    }

    public void setDeclare(boolean declare) {
        this.declare = declare;
    }

    public String getMainQueue() {
        return mainQueue;
    }

    public void setMainQueue(String mainQueue) {
        this.mainQueue = mainQueue;
    }

    public String getRetryRouterQueue() {
        return retryRouterQueue;
    }

    public void setRetryRouterQueue(String retryRouterQueue) {
        this.retryRouterQueue = retryRouterQueue;
    }

    public String getRetryRouterDeadLetterQueue() {
        return retryRouterDeadLetterQueue;
    }

    public void setRetryRouterDeadLetterQueue(String retryRouterDeadLetterQueue) {
        this.retryRouterDeadLetterQueue = retryRouterDeadLetterQueue;
    }

    public String getDeadLetterQueue() {
        return deadLetterQueue;
    }

    public void setDeadLetterQueue(String deadLetterQueue) {
        this.deadLetterQueue = deadLetterQueue;
    }

    public List<String> getRetryQueues() {
        return retryQueues;
    }

    public void setRetryQueues(List<String> retryQueues) {
        this.retryQueues = retryQueues;
    }

    public List<Duration> getRetryQueueTtls() {
        return retryQueueTtls;
    }

    public void setRetryQueueTtls(List<Duration> retryQueueTtls) {
        this.retryQueueTtls = retryQueueTtls;
    }

    public void validate() {
        if (retryQueues.size() != retryQueueTtls.size()) {
            throw new IllegalArgumentException("rabbitmq.topology.retry-queues and retry-queue-ttls must have the same length");
        }
    }
}
