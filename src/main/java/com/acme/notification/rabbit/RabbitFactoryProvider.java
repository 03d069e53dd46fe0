package com.acme.notification.rabbit;

import com.acme.notification.config.RabbitConfig;
import com.acme.notification.spi.BrokerClient;
import com.rabbitmq.client.ConnectionFactory;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

@Factory
@Requires(notEnv = "test")
public class RabbitFactoryProvider {

    @Singleton
    public ConnectionFactory rabbitConnectionFactory(RabbitConfig config) {
        var cf = new ConnectionFactory();
        try {
            cf.setUri(config.getUrl());
        } catch (Exception e) {
            throw new IllegalArgumentException("Invalid rabbitmq.url: " + config.getUrl(), e);
        }
        // health checks and consumers surface connectivity failures instead of recovering silently
        cf.setAutomaticRecoveryEnabled(false);
        cf.setTopologyRecoveryEnabled(false);
        cf.setConnectionTimeout(config.getHealthcheckTimeoutMillis());
        cf.setHandshakeTimeout(config.getHealthcheckTimeoutMillis());
        return cf;
    }

    @Singleton
    public BrokerClient brokerClient(ConnectionFactory cf, RabbitConfig config) {
        return new RabbitBrokerClient(cf, config.getConnectionName(), config.getPublishTimeout().toMillis());
    }
}
