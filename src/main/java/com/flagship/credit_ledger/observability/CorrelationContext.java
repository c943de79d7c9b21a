package com.flagship.credit_ledger.observability;

import java.util.UUID;

/**
 * Correlation id and MDC keys shared by the HTTP filter and the billing event consumer.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String HOLDER_ID_MDC_KEY = "holderId";
    public static final String CREDIT_KEY_MDC_KEY = "creditKey";

    private CorrelationContext() {
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static String orGenerate(String candidate) {
        return candidate == null || candidate.isBlank() ? generateCorrelationId() : candidate;
    }
}
