package com.acme.notification.spi;

public interface MessageConsumer {
    void start();

    void shutdown();

    void checkHealth();
}
