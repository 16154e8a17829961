package com.nowpayments.sdk.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.math.BigDecimal;
import java.util.Objects;

/** Body of POST /invoice. */
public class InvoiceRequest {
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    public BigDecimal priceAmount;
    public String priceCurrency;
    public String orderId;
    public String orderDescription;
    public String ipnCallbackUrl;
    public String successUrl;
    public String cancelUrl;

    /** Default constructor for Jackson. */
    public InvoiceRequest() {}

    /** Constructor with required fields. */
    public InvoiceRequest(BigDecimal priceAmount, String priceCurrency, String orderId) {
        this.priceAmount = Objects.requireNonNull(priceAmount, "priceAmount");
        this.priceCurrency = Objects.requireNonNull(priceCurrency, "priceCurrency");
        this.orderId = Objects.requireNonNull(orderId, "orderId");
    }
}
