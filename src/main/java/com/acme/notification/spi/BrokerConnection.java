package com.acme.notification.spi;

import java.io.IOException;

public interface BrokerConnection extends AutoCloseable {
    BrokerChannel channel() throws IOException;

    /**
     * Checks for a queue on a short-lived channel of its own, since a failed passive declare
     * closes the channel it ran on.
     */
    boolean queueExists(String queue) throws IOException;

    @Override
    void close() throws IOException;
}
