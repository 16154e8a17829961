package com.nowpayments.sdk.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One logical call against the API: verb, path, optional JSON body, query
 * parameters and extra headers. Instances are immutable; use {@link #builder}.
 */
public final class ApiRequest {

    private final HttpMethod method;
    private final String path;
    private final Object body;
    private final Map<String, String> query;
    private final Map<String, String> headers;

    private ApiRequest(Builder b) {
        this.method = b.method;
        this.path = b.path;
        this.body = b.body;
        this.query = Collections.unmodifiableMap(new LinkedHashMap<>(b.query));
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
    }

    public static Builder builder(HttpMethod method, String path) {
        return new Builder(method, path);
    }

    public static ApiRequest get(String path) {
        return builder(HttpMethod.GET, path).build();
    }

    public static ApiRequest post(String path, Object body) {
        return builder(HttpMethod.POST, path).body(body).build();
    }

    public static ApiRequest delete(String path) {
        return builder(HttpMethod.DELETE, path).build();
    }

    public HttpMethod method() {
        return method;
    }

    public String path() {
        return path;
    }

    /** JSON body (a map or a Jackson-serializable object), or null. */
    public Object body() {
        return body;
    }

    /** Query parameters in insertion order. */
    public Map<String, String> query() {
        return query;
    }

    public Map<String, String> headers() {
        return headers;
    }

    @Override
    public String toString() {
        return method + " " + path;
    }

    /** Fluent builder for {@link ApiRequest}. */
    public static final class Builder {
        private final HttpMethod method;
        private final String path;
        private Object body;
        private final Map<String, String> query = new LinkedHashMap<>();
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder(HttpMethod method, String path) {
            this.method = Objects.requireNonNull(method, "method");
            Objects.requireNonNull(path, "path");
            if (path.isEmpty() || !path.startsWith("/")) {
                throw new IllegalArgumentException("path must start with '/', got: '" + path + "'");
            }
            this.path = path;
        }

        public Builder body(Object body) {
            this.body = body;
            return this;
        }

        /** Adds a query parameter; null values are skipped. */
        public Builder query(String name, Object value) {
            Objects.requireNonNull(name, "name");
            if (value != null) {
                query.put(name, String.valueOf(value));
            }
            return this;
        }

        public Builder queryAll(Map<String, ?> params) {
            if (params != null) {
                params.forEach(this::query);
            }
            return this;
        }

        public Builder header(String name, String value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            headers.put(name, value);
            return this;
        }

        public ApiRequest build() {
            return new ApiRequest(this);
        }
    }
}
