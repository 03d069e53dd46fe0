package com.acme.notification.rabbit;

import com.acme.notification.core.DeliveryHandle;
import com.rabbitmq.client.Channel;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Acks or nacks one delivery tag on the channel it arrived on. Settles at most once.
 */
final class RabbitDeliveryHandle implements DeliveryHandle {
    private final Channel channel;
    private final long deliveryTag;
    private final AtomicBoolean settled = new AtomicBoolean();

    RabbitDeliveryHandle(Channel channel, long deliveryTag) {
        this.channel = channel;
        this.deliveryTag = deliveryTag;
    }

    @Override
    public void ack() throws IOException {
        markSettled();
        channel.basicAck(deliveryTag, false);
    }

    @Override
    public void nack(boolean requeue, boolean multiple) throws IOException {
        markSettled();
        channel.basicNack(deliveryTag, multiple, requeue);
    }

    private void markSettled() {
        if (!settled.compareAndSet(false, true)) {
            throw new IllegalStateException("Delivery " + deliveryTag + " was already settled");
        }
    }
}
