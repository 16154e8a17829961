package com.nowpayments.sdk.model;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/** One withdrawal inside a {@link PayoutBatch}. */
public class PayoutWithdrawal {
    public String id;
    public String address;
    public String currency;
    public BigDecimal amount;
    public String status;
    public String ipnCallbackUrl;
    public BigDecimal fiatAmount;
    public String fiatCurrency;
    public String txid;            // on-chain hash once sent
    public OffsetDateTime finishedAt;
}
