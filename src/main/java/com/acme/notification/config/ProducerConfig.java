package com.acme.notification.config;

import io.micronaut.context.annotation.ConfigurationProperties;

@ConfigurationProperties("rabbitmq.producer")
public class ProducerConfig {

    private String queue = "notifications";

    public String getQueue() {
        return queue;
    }

    public void setQueue(String queue) {
        this.queue = queue;
    }
}
