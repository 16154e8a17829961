package com.nowpayments.sdk.model;

import java.util.Objects;

/** Body of POST /subscriptions: signs a customer up to a plan. */
public class SubscriptionRequest {
    public String planId;
    public String email;
    public String orderId;
    public String orderDescription;
    public String customerName;
    /** Day of the month the first charge happens on. */
    public Integer startingDay;

    /** Default constructor for Jackson. */
    public SubscriptionRequest() {}

    public SubscriptionRequest(String planId, String email) {
        this.planId = Objects.requireNonNull(planId, "planId");
        this.email = Objects.requireNonNull(email, "email");
    }
}
