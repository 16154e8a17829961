package com.nowpayments.sdk.crypto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.nowpayments.sdk.json.Json;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * HMAC-SHA512 signer for IPN payloads.
 *
 * <p>The signed message is the payload with its top-level keys sorted in
 * natural {@link String} order, written as compact JSON (no whitespace,
 * non-ASCII characters escaped). Nested objects keep their own key order.
 */
public final class IpnSigner implements PayloadSigner {

    private final byte[] key;

    public IpnSigner(String secret) {
        Objects.requireNonNull(secret, "secret");
        this.key = secret.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String canonicalize(Map<String, ?> payload) {
        Objects.requireNonNull(payload, "payload");
        Map<String, Object> sorted = new TreeMap<>(payload);
        try {
            return Json.canonical().writeValueAsString(sorted);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not JSON-serializable: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public String sign(Map<String, ?> payload) {
        String message = canonicalize(payload);
        // Mac instances are not thread-safe, so each call gets its own
        return new HmacUtils(HmacAlgorithms.HMAC_SHA_512, key).hmacHex(message);
    }
}
