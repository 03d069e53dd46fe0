package com.acme.notification.rabbit;

import com.acme.notification.spi.BrokerClient;
import com.acme.notification.spi.BrokerConnection;
import com.rabbitmq.client.ConnectionFactory;
import java.io.IOException;
import java.util.concurrent.TimeoutException;

public class RabbitBrokerClient implements BrokerClient {
    private final ConnectionFactory factory;
    private final String connectionName;
    private final long confirmTimeoutMillis;

    public RabbitBrokerClient(ConnectionFactory factory, String connectionName, long confirmTimeoutMillis) {
        this.factory = factory;
        this.connectionName = connectionName;
        this.confirmTimeoutMillis = confirmTimeoutMillis;
    }

    @Override
    public BrokerConnection connect() throws IOException, TimeoutException {
        return new RabbitBrokerConnection(factory.newConnection(connectionName), confirmTimeoutMillis);
    }
}
