package com.acme.notification.core;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Computes where a message goes next based on its retry-count header.
 * Pure function of the policy and the headers; never touches the broker.
 */
public final class RetryRouter {
    public static final String RETRY_COUNT_HEADER = "x-retry-count";
    public static final String CONSUMER_FAILURE_HEADER = "x-retry-consumer-failure";
    public static final String ORIGINAL_RETRY_COUNT_HEADER = "x-original-retry-count";

    private final RetryPolicy policy;

    public RetryRouter(RetryPolicy policy) {
        this.policy = policy;
    }

    /**
     * Valid count {@code n}: next retry queue (or the DLQ once the chain is used up) with the
     * header set to {@code n + 1}. Invalid or missing count: DLQ with the headers untouched.
     */
    public RetryDecision route(Map<String, Object> headers) {
        OptionalLong count = retryCount(headers);
        if (count.isEmpty()) {
            return new RetryDecision(policy.deadLetterQueue(), new HashMap<>(headers));
        }

        long n = count.getAsLong();
        var next = new HashMap<String, Object>(headers);
        next.put(RETRY_COUNT_HEADER, headerValue(n + 1));

        String target = n < policy.maxAttempts()
            ? policy.retryQueues().get((int) n)
            : policy.deadLetterQueue();
        return new RetryDecision(target, next);
    }

    /**
     * DLQ decision used when publishing the routed message failed. Keeps the original
     * headers and marks the message with the pre-increment count (0 when it was invalid).
     */
    public RetryDecision fallback(Map<String, Object> headers) {
        var marked = new HashMap<String, Object>(headers);
        marked.put(CONSUMER_FAILURE_HEADER, Boolean.TRUE);
        marked.put(ORIGINAL_RETRY_COUNT_HEADER, headerValue(retryCount(headers).orElse(0L)));
        return new RetryDecision(policy.deadLetterQueue(), marked);
    }

    /**
     * Only integral header values {@code >= 0} count. Strings, floating point values
     * (NaN included), booleans, null and absence are all invalid.
     */
    public static OptionalLong retryCount(Map<String, Object> headers) {
        Object raw = headers.get(RETRY_COUNT_HEADER);
        if (raw instanceof Byte || raw instanceof Short || raw instanceof Integer || raw instanceof Long) {
            long n = ((Number) raw).longValue();
            if (n >= 0 && n < Long.MAX_VALUE) {
                return OptionalLong.of(n);
            }
        }
        return OptionalLong.empty();
    }

    // smallest AMQP integer type that holds the value
    private static Object headerValue(long value) {
        if (value <= Integer.MAX_VALUE) {
            return (int) value;
        }
        return value;
    }
}
