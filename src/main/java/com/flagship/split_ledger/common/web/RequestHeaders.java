package com.flagship.split_ledger.common.web;

import com.flagship.split_ledger.common.exception.LedgerValidationException;

/**
 * Header names shared by the ledger controllers and the parsing of {@code If-Match}.
 */
public final class RequestHeaders {

    public static final String USER_ID = "X-User-Id";
    public static final String IDEMPOTENCY_KEY = "Idempotency-Key";
    public static final String IF_MATCH = "If-Match";

    private RequestHeaders() {
    }

    /**
     * Reads the expected record version from an {@code If-Match} value.
     * Accepts {@code 3}, {@code "3"} and {@code W/"3"}.
     *
     * @return the version, or null when the header is absent
     */
    public static Long expectedVersion(String ifMatch) {
        if (ifMatch == null || ifMatch.isBlank()) {
            return null;
        }
        String value = ifMatch.trim();
        if (value.startsWith("W/")) {
            value = value.substring(2);
        }
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            value = value.substring(1, value.length() - 1);
        }
        try {
            long version = Long.parseLong(value);
            if (version < 1) {
                throw new LedgerValidationException("INVALID_VERSION", "If-Match version must be at least 1");
            }
            return version;
        } catch (NumberFormatException e) {
            throw new LedgerValidationException("INVALID_VERSION", "If-Match must carry a record version");
        }
    }

    public static String etag(long version) {
        return "\"" + version + "\"";
    }
}
