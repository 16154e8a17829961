package com.nowpayments.sdk.model;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/** Movement of funds between custody sub-accounts. */
public class Transfer {
    public String transferId;
    public Long fromId;
    public Long toId;
    public String currency;
    public BigDecimal amount;
    public String status;
    public OffsetDateTime createdAt;
    public OffsetDateTime completedAt;
}
