package com.acme.notification.core;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A delivered message as seen by the consumers. {@code body} is null for empty
 * deliveries; {@code headers} is never null and may contain null values.
 */
public record MessageEnvelope(
    byte[] body,
    Map<String, Object> headers,
    DeliveryHandle handle
) {
    public MessageEnvelope {
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(headers));
    }

    public boolean hasBody() {
        return body != null;
    }
}
