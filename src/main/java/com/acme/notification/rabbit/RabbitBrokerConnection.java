package com.acme.notification.rabbit;

import com.acme.notification.spi.BrokerChannel;
import com.acme.notification.spi.BrokerConnection;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.util.concurrent.TimeoutException;

public class RabbitBrokerConnection implements BrokerConnection {
    private final Connection connection;
    private final long confirmTimeoutMillis;

    public RabbitBrokerConnection(Connection connection, long confirmTimeoutMillis) {
        this.connection = connection;
        this.confirmTimeoutMillis = confirmTimeoutMillis;
    }

    @Override
    public BrokerChannel channel() throws IOException {
        return new RabbitBrokerChannel(createChannel(), confirmTimeoutMillis);
    }

    @Override
    public boolean queueExists(String queue) throws IOException {
        Channel checkChannel = createChannel();
        try {
            checkChannel.queueDeclarePassive(queue);
        } catch (IOException e) {
            if (isNotFound(e)) {
                return false;
            }
            try {
                closeChannel(checkChannel);
            } catch (IOException closeEx) {
                e.addSuppressed(closeEx);
            }
            throw e;
        }
        closeChannel(checkChannel);
        return true;
    }

    @Override
    public void close() throws IOException {
        if (connection.isOpen()) {
            connection.close();
        }
    }

    private Channel createChannel() throws IOException {
        Channel channel = connection.createChannel();
        if (channel == null) {
            throw new IOException("No channel available on connection " + connection.getClientProvidedName());
        }
        return channel;
    }

    // the broker has already closed the channel with 404
    private static boolean isNotFound(IOException e) {
        return e.getCause() instanceof ShutdownSignalException signal
            && signal.getReason() instanceof AMQP.Channel.Close close
            && close.getReplyCode() == AMQP.NOT_FOUND;
    }

    private static void closeChannel(Channel channel) throws IOException {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.close();
        } catch (TimeoutException e) {
            throw new IOException("Timed out closing channel", e);
        }
    }
}
