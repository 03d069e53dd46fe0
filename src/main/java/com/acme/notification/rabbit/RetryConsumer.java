package com.acme.notification.rabbit;

import com.acme.notification.config.RetryConsumerConfig;
import com.acme.notification.core.ErrorListener;
import com.acme.notification.core.MessageEnvelope;
import com.acme.notification.core.RetryDecision;
import com.acme.notification.core.RetryPolicy;
import com.acme.notification.core.RetryRouter;
import com.acme.notification.spi.BrokerChannel;
import com.acme.notification.spi.BrokerClient;
import java.io.IOException;
import java.util.Map;

/**
 * Moves failed messages along the retry chain. Every delivery is re-published to the queue chosen by
 * {@link RetryRouter} and then acked. The delay between attempts comes from the retry queues
 * themselves, not from this consumer.
 * <p>
 * If the publish fails the message goes to the dead-letter queue with
 * {@code x-retry-consumer-failure} set. Only when that publish fails as well is the delivery
 * nacked without requeue.
 */
public class RetryConsumer extends AbstractConsumer {
    private static final String DEFAULT_EXCHANGE = "";

    private final RetryRouter router;

    public RetryConsumer(BrokerClient client, RetryConsumerConfig config, Map<String, Object> queueArguments,
                         ErrorListener errorListener) {
        this(client, config.getQueue(), config.toPolicy(), queueArguments, errorListener);
    }

    public RetryConsumer(BrokerClient client, String queue, RetryPolicy policy, Map<String, Object> queueArguments,
                         ErrorListener errorListener) {
        super(client, queue, queueArguments, errorListener);
        this.router = new RetryRouter(policy);
    }

    @Override
    protected void onMessage(MessageEnvelope message) throws IOException {
        if (!message.hasBody()) {
            message.handle().ack();
            return;
        }

        RetryDecision decision = router.route(message.headers());
        try {
            publish(decision, message.body());
        } catch (IOException | RuntimeException e) {
            errorListener.onError(e);
            parkAfterFailure(message);
            return;
        }
        message.handle().ack();
    }

    private void parkAfterFailure(MessageEnvelope message) throws IOException {
        RetryDecision fallback = router.fallback(message.headers());
        try {
            publish(fallback, message.body());
        } catch (IOException | RuntimeException e) {
            errorListener.onError(e);
            message.handle().nack(false, false);
            return;
        }
        message.handle().ack();
    }

    private void publish(RetryDecision decision, byte[] body) throws IOException {
        channel().basicPublish(DEFAULT_EXCHANGE, decision.targetQueue(), body, decision.headers(),
            BrokerChannel.PERSISTENT);
    }
}
