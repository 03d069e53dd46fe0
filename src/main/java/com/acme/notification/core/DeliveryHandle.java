package com.acme.notification.core;

import java.io.IOException;

/**
 * Settles a single delivery. Exactly one of {@link #ack()} or {@link #nack(boolean, boolean)}
 * may be called per delivery; a second call fails with {@link IllegalStateException}.
 */
public interface DeliveryHandle {
    void ack() throws IOException;

    void nack(boolean requeue, boolean multiple) throws IOException;
}
