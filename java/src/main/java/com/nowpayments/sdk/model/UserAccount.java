package com.nowpayments.sdk.model;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Custody sub-account. */
public class UserAccount {
    public Long userId;
    public String externalId;
    public String email;
    /** Per-currency balances, passed through as the API sends them. */
    public List<Map<String, Object>> balance = new ArrayList<>();
    public OffsetDateTime createdAt;
}
