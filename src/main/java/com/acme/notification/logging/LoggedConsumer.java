package com.acme.notification.logging;

import com.acme.notification.spi.MessageConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs lifecycle and health outcomes of a consumer with their duration. Failures are rethrown unchanged.
 */
public class LoggedConsumer implements MessageConsumer {
    private static final Logger LOG = LoggerFactory.getLogger(LoggedConsumer.class);

    private final MessageConsumer delegate;
    private final String name;

    public LoggedConsumer(MessageConsumer delegate, String name) {
        this.delegate = delegate;
        this.name = name;
    }

    @Override
    public void start() {
        long startTs = System.currentTimeMillis();
        try {
            delegate.start();
            LOG.debug("Consumer {} started in {} ms", name, System.currentTimeMillis() - startTs);
        } catch (RuntimeException e) {
            LOG.error("Consumer {} failed to start after {} ms", name, System.currentTimeMillis() - startTs, e);
            throw e;
        }
    }

    @Override
    public void shutdown() {
        long startTs = System.currentTimeMillis();
        try {
            delegate.shutdown();
            LOG.debug("Consumer {} stopped in {} ms", name, System.currentTimeMillis() - startTs);
        } catch (RuntimeException e) {
            LOG.warn("Consumer {} failed to stop cleanly after {} ms", name, System.currentTimeMillis() - startTs, e);
            throw e;
        }
    }

    @Override
    public void checkHealth() {
        long startTs = System.currentTimeMillis();
        try {
            delegate.checkHealth();
            LOG.debug("Consumer {} is healthy ({} ms)", name, System.currentTimeMillis() - startTs);
        } catch (RuntimeException e) {
            LOG.error("Consumer {} is unavailable ({} ms)", name, System.currentTimeMillis() - startTs, e);
            throw e;
        }
    }
}
