package com.nowpayments.sdk.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/** One entry of GET /full-currencies. */
public class Currency {
    public String currency;        // ticker, e.g. "btc"
    public String name;
    public BigDecimal minAmount;
    public BigDecimal maxAmount;
    public boolean enabled = true;
    public List<String> networks = new ArrayList<>();

    /** Default constructor for Jackson. */
    public Currency() {}

    public Currency(String currency) {
        this.currency = currency;
    }
}
