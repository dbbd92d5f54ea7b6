package com.tradejournal.application.service;

import com.tradejournal.infrastructure.messaging.kafka.RelayHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Service for managing correlation IDs in the logging context. The relay
 * producer forwards the current id as a record header.
 */
@Service
public class CorrelationIdService {

    private static final Logger log = LoggerFactory.getLogger(CorrelationIdService.class);

    public String generateCorrelationId() {
        String correlationId = UUID.randomUUID().toString();
        MDC.put(RelayHeaders.CORRELATION_ID_MDC_KEY, correlationId);
        log.debug("Generated correlation ID: {}", correlationId);
        return correlationId;
    }

    public void setCorrelationId(String correlationId) {
        if (correlationId != null && !correlationId.isEmpty()) {
            MDC.put(RelayHeaders.CORRELATION_ID_MDC_KEY, correlationId);
        }
    }

    public void clear() {
        MDC.remove(RelayHeaders.CORRELATION_ID_MDC_KEY);
    }
}
