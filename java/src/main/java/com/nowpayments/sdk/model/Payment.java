package com.nowpayments.sdk.model;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * A payment as returned by POST /payment, GET /payment/{id},
 * POST /invoice-payment and the merchant-estimate update.
 *
 * <p>The status endpoint returns a subset of these fields; the rest stay null.
 */
public class Payment {
    public Long paymentId;
    /** waiting, confirming, confirmed, sending, partially_paid, finished, failed, refunded, expired. */
    public String paymentStatus;
    public String payAddress;
    public BigDecimal priceAmount;
    public String priceCurrency;
    public BigDecimal payAmount;
    public String payCurrency;
    public String orderId;
    public String orderDescription;
    public String purchaseId;
    public OffsetDateTime createdAt;
    public OffsetDateTime updatedAt;
    public BigDecimal outcomeAmount;
    public String outcomeCurrency;
    public BigDecimal actuallyPaid;
    public BigDecimal commissionFee;
    public String payinExtraId;
    public String ipnCallbackUrl;
    public String payoutAddress;
    public String payoutCurrency;
    public String externalId;
    /** When the deposit address stops accepting funds. */
    public OffsetDateTime expireAt;
}
