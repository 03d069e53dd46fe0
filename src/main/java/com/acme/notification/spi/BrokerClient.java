package com.acme.notification.spi;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

public interface BrokerClient {
    BrokerConnection connect() throws IOException, TimeoutException;
}
