package com.acme.notification.sample;

import com.acme.notification.core.BatchHandler;
import com.acme.notification.core.HandlerResult;
import jakarta.inject.Singleton;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepts notifications that have a message and at least one usable contact. Delivery to the
 * actual channels is plugged in behind this handler.
 */
@Singleton
public class NotificationBatchHandler implements BatchHandler<Notification> {
    private static final Logger LOG = LoggerFactory.getLogger(NotificationBatchHandler.class);

    @Override
    public List<HandlerResult> handle(List<Notification> items) {
        List<HandlerResult> results = new ArrayList<>(items.size());
        for (Notification n : items) {
            if (isValid(n)) {
                LOG.info("Accepted notification {} for {} contact(s)", n.id(), n.contacts().size());
                results.add(HandlerResult.ok());
            } else {
                LOG.warn("Rejected invalid notification {}", n.id());
                results.add(HandlerResult.failed());
            }
        }
        return results;
    }

    static boolean isValid(Notification n) {
        if (n.message() == null || n.message().isBlank()) {
            return false;
        }
        if (n.contacts() == null || n.contacts().isEmpty()) {
            return false;
        }
        return n.contacts().stream()
            .allMatch(c -> c != null && c.type() != null && !c.type().isBlank()
                && c.value() != null && !c.value().isBlank());
    }
}
