package com.nowpayments.sdk.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Body of POST /invoice-payment: pays an existing invoice in a chosen coin. */
public class InvoicePaymentRequest {
    @JsonProperty("iid")
    public String invoiceId;
    public String payCurrency;
    public String purchaseId;
    public String orderDescription;
    public String customerEmail;
    public String payoutAddress;
    public String payoutExtraId;
    public String payoutCurrency;

    /** Default constructor for Jackson. */
    public InvoicePaymentRequest() {}

    public InvoicePaymentRequest(String invoiceId, String payCurrency) {
        this.invoiceId = Objects.requireNonNull(invoiceId, "invoiceId");
        this.payCurrency = Objects.requireNonNull(payCurrency, "payCurrency");
    }
}
