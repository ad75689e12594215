package com.give.payout.application.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Keeps the correlation id of the current request or message in MDC
 */
@Service
public class CorrelationIdService {

    private static final Logger log = LoggerFactory.getLogger(CorrelationIdService.class);

    public static final String CORRELATION_ID_KEY = "correlationId";

    public String generateCorrelationId() {
        String correlationId = UUID.randomUUID().toString();
        MDC.put(CORRELATION_ID_KEY, correlationId);
        log.debug("Generated correlation ID: {}", correlationId);
        return correlationId;
    }

    public String getCurrentCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY);
    }

    public void setCorrelationId(String correlationId) {
        if (correlationId != null && !correlationId.isEmpty()) {
            MDC.put(CORRELATION_ID_KEY, correlationId);
        }
    }

    public void clear() {
        MDC.remove(CORRELATION_ID_KEY);
    }
}
