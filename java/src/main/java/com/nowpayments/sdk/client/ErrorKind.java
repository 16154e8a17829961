package com.nowpayments.sdk.client;

/**
 * Classifies a failed API call.
 *
 * <p>Status codes win over the endpoint path: a 401 on {@code /payment/123} is
 * {@link #AUTHENTICATION}, not {@link #PAYMENT}.
 */
public enum ErrorKind {
    /** Network, DNS or timeout failure after all retries. */
    TRANSPORT,
    /** HTTP 429 after all retries. */
    RATE_LIMITED,
    /** HTTP 401. */
    AUTHENTICATION,
    /** HTTP 422. */
    VALIDATION,
    PAYMENT,
    PAYOUT,
    SUBSCRIPTION,
    CUSTODY,
    CONVERSION,
    /** Anything else at or above 400, including 5xx once retries run out. */
    GENERIC;

    /**
     * Maps an HTTP error status and the request path onto a kind.
     *
     * @param statusCode HTTP status, expected to be {@code >= 400}
     * @param path the request path relative to the base URL
     * @return the matching kind, never null
     */
    public static ErrorKind classify(int statusCode, String path) {
        if (statusCode == 401) {
            return AUTHENTICATION;
        }
        if (statusCode == 422) {
            return VALIDATION;
        }
        if (statusCode == 429) {
            return RATE_LIMITED;
        }
        String p = path == null ? "" : path;
        if (p.contains("/payment")) {
            return PAYMENT;
        }
        if (p.contains("/payout")) {
            return PAYOUT;
        }
        if (p.contains("/subscription")) {
            return SUBSCRIPTION;
        }
        if (p.contains("/custody")) {
            return CUSTODY;
        }
        if (p.contains("/conversion")) {
            return CONVERSION;
        }
        return GENERIC;
    }
}
