package com.nowpayments.sdk.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/** Recurring-payment plan. */
public class SubscriptionPlan {
    @JsonAlias("plan_id")
    public String id;
    public String title;
    /** Billing period in days. */
    public Integer intervalDay;
    public BigDecimal amount;
    public String currency;
    public String ipnCallbackUrl;
    public String successUrl;
    public String cancelUrl;
    public String partiallyPaidUrl;
    public OffsetDateTime createdAt;
    public OffsetDateTime updatedAt;
}
