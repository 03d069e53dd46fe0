package com.acme.notification.core;

/**
 * Side channel for failures the consumers recover from on their own.
 * Invoked synchronously at the point of failure.
 */
@FunctionalInterface
public interface ErrorListener {

    ErrorListener NOOP = error -> { };

    void onError(Throwable error);
}
