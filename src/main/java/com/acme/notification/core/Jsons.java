package com.acme.notification.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;

public final class Jsons {
    private static final ObjectMapper M = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private Jsons() {
    }

    public static byte[] toBytes(Object o) {
        try {
            return M.writeValueAsBytes(o);
        } catch(Exception e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Parses a JSON document. Unlike {@link #toBytes(Object)} the failure is checked:
     * callers decide what an unparseable payload means.
     */
    public static <T> T fromBytes(byte[] json, Class<T> clazz) throws IOException {
        T value = M.readValue(json, clazz);
        if (value == null) {
            throw new IOException("JSON document is null");
        }
        return value;
    }
}
