package com.nowpayments.sdk.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.math.BigDecimal;
import java.util.Objects;

/** Body of POST /payment. Optional fields are left out of the JSON when null. */
public class PaymentRequest {
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    public BigDecimal priceAmount;
    public String priceCurrency;
    public String payCurrency;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    public BigDecimal payAmount;
    public String ipnCallbackUrl;
    public String orderId;
    public String orderDescription;
    public String purchaseId;
    public String payoutAddress;
    public String payoutCurrency;
    public String externalId;

    /** Default constructor for Jackson. */
    public PaymentRequest() {}

    /** Constructor with required fields. */
    public PaymentRequest(BigDecimal priceAmount, String priceCurrency, String payCurrency) {
        this.priceAmount = Objects.requireNonNull(priceAmount, "priceAmount");
        this.priceCurrency = Objects.requireNonNull(priceCurrency, "priceCurrency");
        this.payCurrency = Objects.requireNonNull(payCurrency, "payCurrency");
    }
}
