package com.acme.notification.rabbit;

import com.acme.notification.core.BrokerUnavailableException;
import com.acme.notification.spi.BrokerChannel;
import com.acme.notification.spi.BrokerClient;
import com.acme.notification.spi.BrokerConnection;
import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * One connection plus one channel, opened together and closed channel first.
 */
final class BrokerSession {
    static final String UNAVAILABLE = "RabbitMQ недоступен";

    private final BrokerConnection connection;
    private final BrokerChannel channel;

    private BrokerSession(BrokerConnection connection, BrokerChannel channel) {
        this.connection = connection;
        this.channel = channel;
    }

    static BrokerSession open(BrokerClient client) throws IOException, TimeoutException {
        BrokerConnection connection = client.connect();
        try {
            return new BrokerSession(connection, connection.channel());
        } catch (IOException | RuntimeException e) {
            try {
                connection.close();
            } catch (IOException closeEx) {
                e.addSuppressed(closeEx);
            }
            throw e;
        }
    }

    /**
     * Opens and immediately closes a throwaway connection. Never touches a long-lived session.
     */
    static void checkReachable(BrokerClient client) {
        try (BrokerConnection ignored = client.connect()) {
            // reachable
        } catch (IOException | TimeoutException | RuntimeException e) {
            throw new BrokerUnavailableException(UNAVAILABLE, e);
        }
    }

    BrokerChannel channel() {
        return channel;
    }

    /**
     * Attempts both closes even if the first fails; the first failure is rethrown.
     */
    void close() throws IOException {
        IOException failure = null;
        try {
            channel.close();
        } catch (IOException e) {
            failure = e;
        } catch (TimeoutException e) {
            failure = new IOException("Timed out closing channel", e);
        }
        try {
            connection.close();
        } catch (IOException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
