package com.nowpayments.sdk.crypto;

import java.util.Map;

/** Checks that an incoming notification was signed with the shared secret. */
public interface SignatureVerifier {

    /** True only if {@code signature} matches the payload; never throws. */
    boolean verifySignature(Map<String, ?> payload, String signature);

    /** Looks the signature up in {@code headers} and verifies it; never throws. */
    boolean verifyRequest(Map<String, ?> payload, Map<String, String> headers);
}
