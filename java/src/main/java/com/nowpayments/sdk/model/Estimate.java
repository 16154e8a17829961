package com.nowpayments.sdk.model;

import java.math.BigDecimal;

/** Price estimate returned by GET /estimate. */
public class Estimate {
    public BigDecimal amountFrom;
    public String currencyFrom;
    public String currencyTo;
    public BigDecimal estimatedAmount;
}
