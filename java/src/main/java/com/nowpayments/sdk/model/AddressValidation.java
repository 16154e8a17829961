package com.nowpayments.sdk.model;

/** Result of POST /payout/validate-address. */
public class AddressValidation {
    public String address;
    public String currency;
    public boolean result;
    public String message;
    public String extraId;
}
