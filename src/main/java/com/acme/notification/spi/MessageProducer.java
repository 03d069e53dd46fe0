package com.acme.notification.spi;

import java.util.List;

public interface MessageProducer<T> {
    void start();

    void publish(List<T> items);

    void shutdown();

    void checkHealth();
}
