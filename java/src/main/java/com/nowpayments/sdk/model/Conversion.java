package com.nowpayments.sdk.model;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/** Currency conversion inside the custody balance. */
public class Conversion {
    public String conversionId;
    public String fromCurrency;
    public String toCurrency;
    public BigDecimal fromAmount;
    public BigDecimal toAmount;
    public String status;
    public BigDecimal rate;
    public OffsetDateTime createdAt;
    public OffsetDateTime completedAt;
}
