package com.acme.notification.core;

import java.util.List;

/**
 * Processes one batch of parsed payloads. Must return one result per item, in the
 * same order as {@code items}; anything else fails the whole batch.
 */
@FunctionalInterface
public interface BatchHandler<T> {
    List<HandlerResult> handle(List<T> items) throws Exception;
}
