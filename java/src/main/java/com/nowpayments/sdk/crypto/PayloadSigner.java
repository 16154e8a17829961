package com.nowpayments.sdk.crypto;

import java.util.Map;

/**
 * Produces the keyed signature a notification sender attaches to a payload.
 * Implementations must be deterministic: the same payload always yields the
 * same signature, whatever the key order of the map.
 */
public interface PayloadSigner {

    /**
     * Returns the exact message that gets signed for {@code payload}.
     *
     * @throws IllegalArgumentException if the payload cannot be rendered as JSON
     */
    String canonicalize(Map<String, ?> payload);

    /**
     * Returns a lowercase hex signature covering the given payload map.
     *
     * @throws IllegalArgumentException if the payload cannot be rendered as JSON
     */
    String sign(Map<String, ?> payload);
}
