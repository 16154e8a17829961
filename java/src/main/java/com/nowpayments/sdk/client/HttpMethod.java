package com.nowpayments.sdk.client;

/** HTTP verbs used by the NOWPayments API. */
public enum HttpMethod {
    GET,
    POST,
    PATCH,
    DELETE
}
