package com.nowpayments.sdk.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Paging, ordering and filter parameters for the list endpoints. Parameter
 * names differ between endpoints (payments use {@code dateFrom}, payouts use
 * {@code date_from}), so filters are set by wire name.
 */
public final class ListQuery {

    private final Map<String, Object> params = new LinkedHashMap<>();

    private ListQuery() {}

    public static ListQuery create() {
        return new ListQuery();
    }

    public ListQuery limit(int limit) {
        return with("limit", limit);
    }

    public ListQuery page(int page) {
        return with("page", page);
    }

    public ListQuery offset(int offset) {
        return with("offset", offset);
    }

    public ListQuery orderBy(String field) {
        return with("order_by", field);
    }

    /** "asc" or "desc". */
    public ListQuery order(String direction) {
        return with("order", direction);
    }

    /** Sets an endpoint-specific filter; a null value removes it. */
    public ListQuery with(String name, Object value) {
        Objects.requireNonNull(name, "name");
        if (value == null) {
            params.remove(name);
        } else {
            params.put(name, value);
        }
        return this;
    }

    public Map<String, Object> toMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }
}
