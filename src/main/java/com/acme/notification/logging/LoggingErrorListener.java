package com.acme.notification.logging;

import com.acme.notification.core.ErrorListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingErrorListener implements ErrorListener {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingErrorListener.class);

    private final String source;

    public LoggingErrorListener(String source) {
        this.source = source;
    }

    @Override
    public void onError(Throwable error) {
        LOG.error("Failure in {}: {}", source, error.getMessage(), error);
    }
}
