package com.acme.notification.rabbit;

import com.acme.notification.core.MessageEnvelope;
import com.acme.notification.spi.BrokerChannel;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * {@link BrokerChannel} over a RabbitMQ channel in publisher-confirm mode, so a publish
 * only returns once the broker has taken responsibility for the message.
 */
public class RabbitBrokerChannel implements BrokerChannel {
    private final Channel channel;
    private final long confirmTimeoutMillis;

    public RabbitBrokerChannel(Channel channel, long confirmTimeoutMillis) throws IOException {
        this.channel = channel;
        this.confirmTimeoutMillis = confirmTimeoutMillis;
        channel.confirmSelect();
    }

    @Override
    public void queueDeclare(String queue, boolean durable, Map<String, Object> arguments) throws IOException {
        channel.queueDeclare(queue, durable, false, false,
            arguments == null || arguments.isEmpty() ? null : arguments);
    }

    @Override
    public void queueDelete(String queue) throws IOException {
        channel.queueDelete(queue);
    }

    @Override
    public void basicQos(int prefetchCount) throws IOException {
        channel.basicQos(prefetchCount);
    }

    @Override
    public String basicConsume(String queue, DeliveryCallback callback) throws IOException {
        return channel.basicConsume(queue, false,
            (consumerTag, delivery) -> callback.handle(toEnvelope(delivery)),
            consumerTag -> { });
    }

    @Override
    public void basicCancel(String consumerTag) throws IOException {
        if (channel.isOpen()) {
            channel.basicCancel(consumerTag);
        }
    }

    @Override
    public void basicPublish(String exchange, String routingKey, byte[] body,
                             Map<String, Object> headers, int deliveryMode) throws IOException {
        var props = new AMQP.BasicProperties.Builder()
            .headers(headers)
            .deliveryMode(deliveryMode)
            .build();
        channel.basicPublish(exchange, routingKey, props, body);
        awaitConfirm(routingKey);
    }

    @Override
    public void close() throws IOException, TimeoutException {
        if (channel.isOpen()) {
            channel.close();
        }
    }

    private void awaitConfirm(String routingKey) throws IOException {
        try {
            if (!channel.waitForConfirms(confirmTimeoutMillis)) {
                throw new IOException("Broker rejected message published to " + routingKey);
            }
        } catch (TimeoutException e) {
            throw new IOException("Timed out waiting for publish confirm from " + routingKey, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for publish confirm from " + routingKey, e);
        }
    }

    MessageEnvelope toEnvelope(Delivery delivery) {
        byte[] body = delivery.getBody();
        Map<String, Object> headers = delivery.getProperties() == null ? null : delivery.getProperties().getHeaders();
        return new MessageEnvelope(
            body == null || body.length == 0 ? null : body,
            headers,
            new RabbitDeliveryHandle(channel, delivery.getEnvelope().getDeliveryTag())
        );
    }
}
