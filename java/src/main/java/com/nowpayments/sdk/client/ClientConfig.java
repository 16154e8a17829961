package com.nowpayments.sdk.client;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable transport settings for a {@link RequestDispatcher}.
 *
 * <p>The base URL resolves in this order: explicit override, sandbox host,
 * production host.
 */
public final class ClientConfig {

    public static final String PRODUCTION_URL = "https://api.nowpayments.io/v1";
    public static final String SANDBOX_URL = "https://api-sandbox.nowpayments.io/v1";
    public static final String DEFAULT_USER_AGENT = "NOWPayments-Java-SDK/1.0.0";

    static final String ENV_API_KEY = "NOWPAYMENTS_API_KEY";
    static final String ENV_ENVIRONMENT = "NOWPAYMENTS_ENVIRONMENT";
    static final String ENV_BASE_URL = "NOWPAYMENTS_BASE_URL";
    static final String ENV_TIMEOUT_SECONDS = "NOWPAYMENTS_TIMEOUT_SECONDS";
    static final String ENV_MAX_RETRIES = "NOWPAYMENTS_MAX_RETRIES";

    private final String apiKey;
    private final boolean sandbox;
    private final String baseUrl;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration backoffBase;
    private final String userAgent;

    private ClientConfig(Builder b) {
        this.apiKey = b.apiKey;
        this.sandbox = b.sandbox;
        this.baseUrl = resolveBaseUrl(b.baseUrl, b.sandbox);
        this.timeout = b.timeout;
        this.maxRetries = b.maxRetries;
        this.backoffBase = b.backoffBase;
        this.userAgent = b.userAgent;
    }

    public static Builder builder(String apiKey) {
        return new Builder(apiKey);
    }

    /**
     * Reads settings from an environment map (usually {@code System.getenv()}).
     *
     * @throws IllegalArgumentException if {@code NOWPAYMENTS_API_KEY} is missing
     *                                  or a numeric setting is malformed
     */
    public static ClientConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        String apiKey = env.get(ENV_API_KEY);
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException(ENV_API_KEY + " is not set");
        }
        Builder b = builder(apiKey)
                .sandbox("sandbox".equalsIgnoreCase(env.getOrDefault(ENV_ENVIRONMENT, "production").trim()));
        String baseUrl = env.get(ENV_BASE_URL);
        if (baseUrl != null && !baseUrl.isBlank()) {
            b.baseUrl(baseUrl.trim());
        }
        String timeout = env.get(ENV_TIMEOUT_SECONDS);
        if (timeout != null && !timeout.isBlank()) {
            b.timeout(Duration.ofSeconds(parseInt(ENV_TIMEOUT_SECONDS, timeout)));
        }
        String retries = env.get(ENV_MAX_RETRIES);
        if (retries != null && !retries.isBlank()) {
            b.maxRetries(parseInt(ENV_MAX_RETRIES, retries));
        }
        return b.build();
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got: " + value, e);
        }
    }

    private static String resolveBaseUrl(String override, boolean sandbox) {
        String url;
        if (override != null) {
            url = override;
        } else {
            url = sandbox ? SANDBOX_URL : PRODUCTION_URL;
        }
        // paths always start with '/'
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public String apiKey() {
        return apiKey;
    }

    public boolean sandbox() {
        return sandbox;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public Duration timeout() {
        return timeout;
    }

    public int maxRetries() {
        return maxRetries;
    }

    /** Delay before the first retry; doubles on every further attempt. */
    public Duration backoffBase() {
        return backoffBase;
    }

    public String userAgent() {
        return userAgent;
    }

    @Override
    public String toString() {
        // never print the apiKey
        return "ClientConfig{baseUrl=" + baseUrl + ", sandbox=" + sandbox + ", timeout=" + timeout
                + ", maxRetries=" + maxRetries + ", backoffBase=" + backoffBase + "}";
    }

    /** Builder for {@link ClientConfig}. */
    public static final class Builder {
        private final String apiKey;
        private boolean sandbox;
        private String baseUrl;
        private Duration timeout = Duration.ofSeconds(30);
        private int maxRetries = 3;
        private Duration backoffBase = Duration.ofSeconds(1);
        private String userAgent = DEFAULT_USER_AGENT;

        private Builder(String apiKey) {
            Objects.requireNonNull(apiKey, "apiKey");
            if (apiKey.isBlank()) {
                throw new IllegalArgumentException("apiKey must not be blank");
            }
            this.apiKey = apiKey;
        }

        public Builder sandbox(boolean sandbox) {
            this.sandbox = sandbox;
            return this;
        }

        /** Overrides both the production and the sandbox host. */
        public Builder baseUrl(String baseUrl) {
            this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
            return this;
        }

        public Builder timeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException("timeout must be > 0, got: " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder backoffBase(Duration backoffBase) {
            Objects.requireNonNull(backoffBase, "backoffBase");
            if (backoffBase.isNegative()) {
                throw new IllegalArgumentException("backoffBase must be >= 0, got: " + backoffBase);
            }
            this.backoffBase = backoffBase;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(this);
        }
    }
}
