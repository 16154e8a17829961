package com.nowpayments.sdk.client;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Raised for every failed API call. The {@link #kind()} tells callers which
 * business area (or transport layer) the failure belongs to.
 */
public class NowPaymentsException extends IOException {

    private final ErrorKind kind;
    private final int statusCode;
    private final Map<String, Object> responseBody;

    /**
     * @param kind classification of the failure
     * @param message human-readable message
     * @param statusCode HTTP status, or {@code 0} when no response was received
     * @param responseBody parsed error body, may be null
     */
    public NowPaymentsException(ErrorKind kind, String message, int statusCode,
                                Map<String, Object> responseBody) {
        this(kind, message, statusCode, responseBody, null);
    }

    public NowPaymentsException(ErrorKind kind, String message, int statusCode,
                                Map<String, Object> responseBody, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.statusCode = statusCode;
        this.responseBody = responseBody == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(responseBody));
    }

    /** Creates a transport failure (no HTTP response). */
    public static NowPaymentsException transport(IOException cause) {
        return new NowPaymentsException(ErrorKind.TRANSPORT,
                "Request failed: " + describe(cause), 0, null, cause);
    }

    /**
     * First non-blank message along the cause chain. The JDK client often
     * throws a message-less {@code ConnectException}; its class name is used then.
     */
    static String describe(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message != null && !message.isBlank()) {
                return message;
            }
        }
        return error.getClass().getName();
    }

    public ErrorKind kind() {
        return kind;
    }

    /** HTTP status of the failed response; {@code 0} for transport failures. */
    public int statusCode() {
        return statusCode;
    }

    /** Parsed error body; empty when the server sent none. */
    public Map<String, Object> responseBody() {
        return responseBody;
    }

    @Override
    public String toString() {
        return "NowPaymentsException{kind=" + kind + ", status=" + statusCode
                + ", message=" + getMessage() + "}";
    }
}
