package com.acme.notification.spi;

import com.acme.notification.core.MessageEnvelope;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeoutException;

public interface BrokerChannel {
    int PERSISTENT = 2;

    void queueDeclare(String queue, boolean durable, Map<String, Object> arguments) throws IOException;

    void queueDelete(String queue) throws IOException;

    void basicQos(int prefetchCount) throws IOException;

    /**
     * Starts a manual-ack consumer. Deliveries for one channel are handed to the callback one at a time.
     *
     * @return the consumer tag
     */
    String basicConsume(String queue, DeliveryCallback callback) throws IOException;

    void basicCancel(String consumerTag) throws IOException;

    void basicPublish(String exchange, String routingKey, byte[] body,
                      Map<String, Object> headers, int deliveryMode) throws IOException;

    void close() throws IOException, TimeoutException;

    @FunctionalInterface
    interface DeliveryCallback {
        void handle(MessageEnvelope message);
    }
}
