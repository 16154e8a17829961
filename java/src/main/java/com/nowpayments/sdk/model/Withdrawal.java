package com.nowpayments.sdk.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.math.BigDecimal;
import java.util.Objects;

/** One payout destination in POST /payout. */
public class Withdrawal {
    public String address;
    public String currency;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    public BigDecimal amount;
    public String extraId;         // memo / destination tag
    public String ipnCallbackUrl;

    /** Default constructor for Jackson. */
    public Withdrawal() {}

    public Withdrawal(String address, String currency, BigDecimal amount) {
        this.address = Objects.requireNonNull(address, "address");
        this.currency = Objects.requireNonNull(currency, "currency");
        this.amount = Objects.requireNonNull(amount, "amount");
    }
}
