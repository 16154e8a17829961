package com.nowpayments.sdk.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.nowpayments.sdk.json.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Executes {@link ApiRequest}s against the configured NOWPayments host.
 *
 * <p>Transport failures, HTTP 429 and HTTP 5xx are retried with exponential
 * backoff ({@code backoffBase * 2^attempt}, attempt starting at 0), for at most
 * {@code maxRetries + 1} attempts in total. Every other HTTP error fails
 * immediately with a {@link NowPaymentsException} classified by
 * {@link ErrorKind#classify(int, String)}.
 *
 * <p>Instances are thread-safe; they only hold immutable configuration and a
 * JDK {@link HttpClient}.
 */
public class RequestDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

    private final ClientConfig config;
    private final HttpClient http;

    public RequestDispatcher(ClientConfig config) {
        this(config, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Objects.requireNonNull(config, "config").timeout())
                .build());
    }

    /** Uses a caller-supplied HTTP client (proxy, SSL context, executor). */
    public RequestDispatcher(ClientConfig config, HttpClient http) {
        this.config = Objects.requireNonNull(config, "config");
        this.http = Objects.requireNonNull(http, "http");
    }

    public ClientConfig config() {
        return config;
    }

    /**
     * Sends the request and returns the parsed JSON object.
     *
     * @param request the call to make
     * @return the response object, empty when the server sent no body
     * @throws NowPaymentsException if the call failed, after retries where applicable
     * @throws InterruptedException if interrupted while sending or backing off
     */
    public Map<String, Object> execute(ApiRequest request) throws IOException, InterruptedException {
        Objects.requireNonNull(request, "request");
        HttpRequest httpRequest = toHttpRequest(request);
        int maxRetries = config.maxRetries();

        for (int attempt = 0; ; attempt++) {
            boolean canRetry = attempt < maxRetries;
            HttpResponse<String> response;
            try {
                response = http.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            } catch (IOException e) {
                if (!canRetry) {
                    log.warn("{} failed after {} attempt(s): {}", request, attempt + 1, e.toString());
                    throw NowPaymentsException.transport(e);
                }
                backoff(request, attempt, e.toString());
                continue;
            }

            int status = response.statusCode();
            log.debug("{} -> HTTP {} (attempt {})", request, status, attempt + 1);

            if (status == 429 || status >= 500) {
                if (canRetry) {
                    backoff(request, attempt, "HTTP " + status);
                    continue;
                }
                if (status == 429) {
                    Map<String, Object> body = parseErrorBody(response.body());
                    throw new NowPaymentsException(ErrorKind.RATE_LIMITED,
                            messageOf(body, "Rate limit exceeded"), status, body);
                }
                // 5xx after the last retry is classified like any other error status
            }

            if (status >= 400) {
                Map<String, Object> body = parseErrorBody(response.body());
                ErrorKind kind = ErrorKind.classify(status, request.path());
                throw new NowPaymentsException(kind, messageOf(body, "HTTP " + status), status, body);
            }

            return parseSuccessBody(request, status, response.body());
        }
    }

    /** Sends the request and binds the JSON object onto {@code type}. */
    public <T> T execute(ApiRequest request, Class<T> type) throws IOException, InterruptedException {
        return convert(request, execute(request), Json.model().constructType(type));
    }

    /** Sends the request and binds the JSON object onto a generic type. */
    public <T> T execute(ApiRequest request, TypeReference<T> type) throws IOException, InterruptedException {
        return convert(request, execute(request), Json.model().constructType(type));
    }

    /**
     * Delay before retry number {@code attempt + 1}, in milliseconds. Saturates
     * at {@link Long#MAX_VALUE} instead of overflowing.
     */
    static long backoffDelayMs(long baseMs, int attempt) {
        if (baseMs <= 0 || attempt < 0) {
            return 0L;
        }
        if (attempt >= 62 || baseMs > (Long.MAX_VALUE >> attempt)) {
            return Long.MAX_VALUE;
        }
        return baseMs << attempt;
    }

    private void backoff(ApiRequest request, int attempt, String reason) throws InterruptedException {
        long delayMs = backoffDelayMs(config.backoffBase().toMillis(), attempt);
        log.warn("{} attempt {}/{} failed ({}); retrying in {} ms",
                request, attempt + 1, config.maxRetries() + 1, reason, delayMs);
        if (delayMs > 0) {
            Thread.sleep(delayMs);
        }
    }

    private HttpRequest toHttpRequest(ApiRequest request) {
        HttpRequest.Builder b = HttpRequest.newBuilder(buildUri(request))
                .timeout(config.timeout())
                .setHeader("x-api-key", config.apiKey())
                .setHeader("Content-Type", "application/json")
                .setHeader("Accept", "application/json")
                .setHeader("User-Agent", config.userAgent());
        request.headers().forEach(b::setHeader);

        HttpRequest.BodyPublisher publisher = HttpRequest.BodyPublishers.noBody();
        if (request.body() != null) {
            try {
                publisher = HttpRequest.BodyPublishers.ofString(
                        Json.model().writeValueAsString(request.body()), StandardCharsets.UTF_8);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException(
                        "Request body of " + request + " is not serializable: " + e.getOriginalMessage(), e);
            }
        }
        return b.method(request.method().name(), publisher).build();
    }

    private URI buildUri(ApiRequest request) {
        StringBuilder url = new StringBuilder(config.baseUrl()).append(request.path());
        if (!request.query().isEmpty()) {
            StringJoiner qs = new StringJoiner("&");
            request.query().forEach((k, v) -> qs.add(
                    URLEncoder.encode(k, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(v, StandardCharsets.UTF_8)));
            url.append('?').append(qs);
        }
        return URI.create(url.toString());
    }

    private static Map<String, Object> parseSuccessBody(ApiRequest request, int status, String body)
            throws NowPaymentsException {
        if (body == null || body.isBlank()) {
            return new LinkedHashMap<>();
        }
        JsonNode node;
        try {
            node = Json.wire().readTree(body);
        } catch (JsonProcessingException e) {
            throw new NowPaymentsException(ErrorKind.GENERIC,
                    "Invalid JSON in response to " + request + ": " + e.getOriginalMessage(), status, null, e);
        }
        if (!node.isObject()) {
            throw new NowPaymentsException(ErrorKind.GENERIC,
                    "Expected a JSON object in response to " + request + " but got " + node.getNodeType(),
                    status, null);
        }
        return Json.wire().convertValue(node, Json.MAP_TYPE);
    }

    private static Map<String, Object> parseErrorBody(String body) {
        if (body == null || body.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            JsonNode node = Json.wire().readTree(body);
            return node.isObject() ? Json.wire().convertValue(node, Json.MAP_TYPE) : Collections.emptyMap();
        } catch (JsonProcessingException e) {
            log.debug("Error response body is not JSON: {}", e.getOriginalMessage());
            return Collections.emptyMap();
        }
    }

    private static String messageOf(Map<String, Object> body, String fallback) {
        Object message = body.get("message");
        return message != null ? String.valueOf(message) : fallback;
    }

    private static <T> T convert(ApiRequest request, Map<String, Object> body, JavaType type)
            throws NowPaymentsException {
        return convert(request, body, body, type);
    }

    /**
     * Binds {@code value}, a part of the response {@code body}, onto {@code type}.
     *
     * @throws NowPaymentsException GENERIC when the response does not fit the type
     */
    static <T> T convert(ApiRequest request, Map<String, Object> body, Object value, JavaType type)
            throws NowPaymentsException {
        try {
            return Json.model().convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new NowPaymentsException(ErrorKind.GENERIC,
                    "Cannot map response of " + request + " onto " + type.getTypeName(), 0, body, e);
        }
    }
}
