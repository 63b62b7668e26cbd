package com.flagship.split_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * MDC keys carried on ledger log lines and the correlation id that ties the
 * lines of one request together.
 *
 * The correlation id lives only in the MDC; services add and remove the
 * record keys around each operation.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String GROUP_ID_MDC_KEY = "groupId";
    public static final String EXPENSE_ID_MDC_KEY = "expenseId";
    public static final String SETTLEMENT_ID_MDC_KEY = "settlementId";

    private static final int MAX_LENGTH = 64;
    private static final Pattern SAFE_ID = Pattern.compile("^[A-Za-z0-9._:-]+$");

    private CorrelationContext() {
    }

    /**
     * Returns the caller's id if it is short and log-safe, otherwise a fresh one.
     */
    public static String accept(String incoming) {
        if (incoming == null) {
            return newId();
        }
        String trimmed = incoming.trim();
        if (trimmed.isEmpty() || trimmed.length() > MAX_LENGTH || !SAFE_ID.matcher(trimmed).matches()) {
            return newId();
        }
        return trimmed;
    }

    public static String current() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    static String newId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    static void clearAll() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(GROUP_ID_MDC_KEY);
        MDC.remove(EXPENSE_ID_MDC_KEY);
        MDC.remove(SETTLEMENT_ID_MDC_KEY);
    }
}
