package com.nowpayments.sdk.model;

/** JSON returned by GET /status. */
public class ApiStatus {
    /** "OK" when the API is up. */
    public String message;
}
