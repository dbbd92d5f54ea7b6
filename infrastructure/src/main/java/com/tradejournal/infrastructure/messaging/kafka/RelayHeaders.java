package com.tradejournal.infrastructure.messaging.kafka;

import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;

import java.nio.charset.StandardCharsets;

/**
 * Record header names used by the trade-event relay.
 */
public final class RelayHeaders {

    public static final String CORRELATION_ID = "X-Correlation-ID";
    public static final String RELAY_ERROR = "X-Relay-Error";
    public static final String RELAY_REASON = "X-Relay-Reason";
    public static final String ORIGINAL_PARTITION = "X-Original-Partition";
    public static final String ORIGINAL_OFFSET = "X-Original-Offset";

    /**
     * MDC key the correlation id lives under while a request or record is handled.
     */
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    private RelayHeaders() {
    }

    public static void put(Headers headers, String name, String value) {
        headers.remove(name);
        headers.add(name, value.getBytes(StandardCharsets.UTF_8));
    }

    public static String get(Headers headers, String name) {
        Header header = headers.lastHeader(name);
        if (header == null || header.value() == null) {
            return null;
        }
        return new String(header.value(), StandardCharsets.UTF_8);
    }
}
