package com.nowpayments.sdk.model;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/** Deposit into a custody sub-account, returned by POST /sub-partner/payment. */
public class UserPayment {
    public Long paymentId;
    public String status;
    public String payAddress;
    public BigDecimal amount;
    public String currency;
    /** Caller-chosen reference echoed back by the API. */
    public String trackId;
    public OffsetDateTime createdAt;
    public OffsetDateTime updatedAt;
}
