package com.nowpayments.sdk.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/** JSON returned by the payout endpoints. */
public class PayoutBatch {
    /** Batch identifier; the API also calls it {@code id}. */
    @JsonAlias("id")
    public String batchId;
    public String status;
    public List<PayoutWithdrawal> withdrawals = new ArrayList<>();
    public BigDecimal totalAmount;
    public String totalCurrency;
    public OffsetDateTime createdAt;
    public OffsetDateTime updatedAt;
    /** Set once the batch has been confirmed with a 2FA code. */
    public OffsetDateTime verifiedAt;
    public String ipnCallbackUrl;
}
