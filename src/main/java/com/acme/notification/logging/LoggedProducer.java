package com.acme.notification.logging;

import com.acme.notification.spi.MessageProducer;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggedProducer<T> implements MessageProducer<T> {
    private static final Logger LOG = LoggerFactory.getLogger(LoggedProducer.class);

    private final MessageProducer<T> delegate;
    private final String name;

    public LoggedProducer(MessageProducer<T> delegate, String name) {
        this.delegate = delegate;
        this.name = name;
    }

    @Override
    public void start() {
        long startTs = System.currentTimeMillis();
        try {
            delegate.start();
            LOG.debug("Producer {} started in {} ms", name, System.currentTimeMillis() - startTs);
        } catch (RuntimeException e) {
            LOG.error("Producer {} failed to start after {} ms", name, System.currentTimeMillis() - startTs, e);
            throw e;
        }
    }

    @Override
    public void publish(List<T> items) {
        long startTs = System.currentTimeMillis();
        try {
            delegate.publish(items);
            LOG.debug("Producer {} published {} messages in {} ms", name, items.size(), System.currentTimeMillis() - startTs);
        } catch (RuntimeException e) {
            LOG.error("Producer {} failed to publish {} messages after {} ms", name, items.size(),
                System.currentTimeMillis() - startTs, e);
            throw e;
        }
    }

    @Override
    public void shutdown() {
        long startTs = System.currentTimeMillis();
        try {
            delegate.shutdown();
            LOG.debug("Producer {} stopped in {} ms", name, System.currentTimeMillis() - startTs);
        } catch (RuntimeException e) {
            LOG.warn("Producer {} failed to stop cleanly after {} ms", name, System.currentTimeMillis() - startTs, e);
            throw e;
        }
    }

    @Override
    public void checkHealth() {
        long startTs = System.currentTimeMillis();
        try {
            delegate.checkHealth();
            LOG.debug("Producer {} is healthy ({} ms)", name, System.currentTimeMillis() - startTs);
        } catch (RuntimeException e) {
            LOG.error("Producer {} is unavailable ({} ms)", name, System.currentTimeMillis() - startTs, e);
            throw e;
        }
    }
}
