package com.nowpayments.sdk.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.math.BigDecimal;
import java.util.Objects;

/** Body of POST /subscriptions/plans. */
public class SubscriptionPlanRequest {
    public String title;
    public int intervalDay;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    public BigDecimal amount;
    public String currency;
    public String ipnCallbackUrl;
    public String successUrl;
    public String cancelUrl;
    public String partiallyPaidUrl;

    /** Default constructor for Jackson. */
    public SubscriptionPlanRequest() {}

    /** Constructor with required fields. */
    public SubscriptionPlanRequest(String title, int intervalDay, BigDecimal amount, String currency) {
        if (intervalDay <= 0) {
            throw new IllegalArgumentException("intervalDay must be > 0, got: " + intervalDay);
        }
        this.title = Objects.requireNonNull(title, "title");
        this.intervalDay = intervalDay;
        this.amount = Objects.requireNonNull(amount, "amount");
        this.currency = Objects.requireNonNull(currency, "currency");
    }
}
