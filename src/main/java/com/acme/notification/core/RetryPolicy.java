package com.acme.notification.core;

import java.util.List;

/**
 * Escalation chain of retry queues ending in a dead-letter queue.
 */
public record RetryPolicy(List<String> retryQueues, String deadLetterQueue) {

    public RetryPolicy {
        if (retryQueues == null) {
            throw new IllegalArgumentException("retryQueues must not be null");
        }
        if (deadLetterQueue == null || deadLetterQueue.isBlank()) {
            throw new IllegalArgumentException("deadLetterQueue must not be blank");
        }
        for (String q : retryQueues) {
            if (q == null || q.isBlank()) {
                throw new IllegalArgumentException("retry queue names must not be blank");
            }
        }
        retryQueues = List.copyOf(retryQueues);
    }

    public int maxAttempts() {
        return retryQueues.size();
    }
}
