package com.flagship.debt_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys the service logs with, and helpers to scope them.
 *
 * {@code correlationId} is bound for the whole HTTP request by
 * {@link CorrelationIdFilter}; {@code positionId} only while one debt
 * position is being worked on.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String POSITION_ID_MDC_KEY = "positionId";

    private CorrelationContext() {
    }

    /**
     * @param headerValue Incoming X-Correlation-ID, may be null or blank
     * @return The caller's id when present, otherwise a fresh short id
     */
    public static String resolveCorrelationId(String headerValue) {
        if (headerValue != null && !headerValue.isBlank()) {
            return headerValue;
        }
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static void bindPosition(String positionId) {
        MDC.put(POSITION_ID_MDC_KEY, positionId);
    }

    public static void unbindPosition() {
        MDC.remove(POSITION_ID_MDC_KEY);
    }
}
