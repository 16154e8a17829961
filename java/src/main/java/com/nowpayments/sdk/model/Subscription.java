package com.nowpayments.sdk.model;

import java.time.OffsetDateTime;
import java.util.Map;

/** A customer's subscription to a {@link SubscriptionPlan}. */
public class Subscription {
    public String subscriptionId;
    public String planId;
    public String email;
    public String status;
    public String orderId;
    public String orderDescription;
    public OffsetDateTime nextPaymentDate;
    public OffsetDateTime createdAt;
    public OffsetDateTime lastPaymentDate;
    /** Raw description of the most recent charge; shape varies by payment method. */
    public Map<String, Object> lastPayment;
}
