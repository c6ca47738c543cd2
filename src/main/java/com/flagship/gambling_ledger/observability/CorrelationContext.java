package com.flagship.gambling_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys printed by the log pattern, and the correlation id of the
 * request being served.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String USER_ID_MDC_KEY = "userId";
    public static final String OPERATION_ID_MDC_KEY = "operationId";

    static final int MAX_INBOUND_LENGTH = 64;

    private CorrelationContext() {
    }

    /**
     * Scheduler and publisher threads run outside a request and report "none".
     */
    public static String getCorrelationId() {
        String id = MDC.get(CORRELATION_ID_MDC_KEY);
        return id != null ? id : "none";
    }

    /**
     * Keeps a caller-supplied id unless it is blank or oversized, which would
     * bloat every log line of the request.
     */
    static String resolve(String inbound) {
        if (inbound == null || inbound.isBlank() || inbound.length() > MAX_INBOUND_LENGTH) {
            return UUID.randomUUID().toString().substring(0, 8);
        }
        return inbound.trim();
    }
}
