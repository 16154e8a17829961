package com.nowpayments.sdk.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/** Hosted-checkout invoice. */
public class Invoice {
    @JsonAlias("id")
    public String invoiceId;
    public String invoiceUrl;
    public String orderId;
    public BigDecimal priceAmount;
    public String priceCurrency;
    public String invoiceStatus;
    public String payCurrency;
    public BigDecimal payAmount;
    public Long paymentId;
    public OffsetDateTime createdAt;
    public OffsetDateTime updatedAt;
}
