package com.nowpayments.sdk.crypto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.nowpayments.sdk.json.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;
import java.util.Objects;

/**
 * Verifies Instant Payment Notifications sent by NOWPayments.
 *
 * <p>A notification is genuine when the {@value #SIGNATURE_HEADER} header
 * equals the {@link IpnSigner} signature of its JSON body computed with the
 * merchant's IPN secret. Every failure, including a malformed payload, is
 * reported as {@code false}: callers reject the notification either way.
 *
 * <p>Thread-safe.
 */
public class IpnVerifier implements SignatureVerifier {

    private static final Logger log = LoggerFactory.getLogger(IpnVerifier.class);

    /** Header carrying the signature; matched case-insensitively. */
    public static final String SIGNATURE_HEADER = "x-nowpayments-sig";

    static final String ENV_IPN_SECRET = "NOWPAYMENTS_IPN_SECRET";

    private final PayloadSigner signer;

    public IpnVerifier(String ipnSecret) {
        this(new IpnSigner(ipnSecret));
    }

    public IpnVerifier(PayloadSigner signer) {
        this.signer = Objects.requireNonNull(signer, "signer");
    }

    /**
     * Builds a verifier from {@code NOWPAYMENTS_IPN_SECRET}.
     *
     * @throws IllegalArgumentException if the variable is missing or blank
     */
    public static IpnVerifier fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        String secret = env.get(ENV_IPN_SECRET);
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException(ENV_IPN_SECRET + " is not set");
        }
        return new IpnVerifier(secret);
    }

    /** One-shot verification with an explicit secret. */
    public static boolean verifySignature(String ipnSecret, Map<String, ?> payload, String signature) {
        if (ipnSecret == null) {
            return false;
        }
        return new IpnVerifier(ipnSecret).verifySignature(payload, signature);
    }

    @Override
    public boolean verifySignature(Map<String, ?> payload, String signature) {
        if (payload == null || signature == null) {
            return false;
        }
        try {
            String expected = signer.sign(payload);
            return MessageDigest.isEqual(
                    expected.getBytes(StandardCharsets.UTF_8),
                    signature.getBytes(StandardCharsets.UTF_8));
        } catch (RuntimeException e) {
            log.debug("IPN payload could not be canonicalized: {}", e.toString());
            return false;
        }
    }

    @Override
    public boolean verifyRequest(Map<String, ?> payload, Map<String, String> headers) {
        String signature = signatureHeader(headers);
        if (signature == null) {
            log.debug("IPN request without {} header", SIGNATURE_HEADER);
            return false;
        }
        return verifySignature(payload, signature);
    }

    /**
     * Verifies a raw request body as received over HTTP.
     *
     * @return false for a missing signature, malformed JSON, a non-object body or a mismatch
     */
    public boolean verifyBody(String rawJson, Map<String, String> headers) {
        if (rawJson == null || rawJson.isBlank()) {
            return false;
        }
        Map<String, Object> payload;
        try {
            payload = Json.canonical().readValue(rawJson, Json.MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.debug("IPN body is not a JSON object: {}", e.getOriginalMessage());
            return false;
        }
        return verifyRequest(payload, headers);
    }

    private static String signatureHeader(Map<String, String> headers) {
        if (headers == null) {
            return null;
        }
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (SIGNATURE_HEADER.equalsIgnoreCase(e.getKey())) {
                String value = e.getValue();
                return value == null || value.isBlank() ? null : value;
            }
        }
        return null;
    }
}
