package com.nowpayments.examples.ipnreceiver;

import com.nowpayments.sdk.crypto.IpnVerifier;
import com.nowpayments.sdk.json.Json;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Minimal webhook endpoint for NOWPayments Instant Payment Notifications.
 *
 * <p>{@code POST /ipn} checks the {@code x-nowpayments-sig} header against the
 * raw body and hands genuine notifications to a listener. Forged or malformed
 * requests get a 401 and never reach the listener.
 */
public class IpnReceiverServer {

    private static final Logger log = LoggerFactory.getLogger(IpnReceiverServer.class);

    private final IpnVerifier verifier;
    private final Consumer<Map<String, Object>> listener;

    public IpnReceiverServer(IpnVerifier verifier, Consumer<Map<String, Object>> listener) {
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /** Builds the app without starting it. */
    public Javalin create() {
        Javalin app = Javalin.create();
        app.post("/ipn", this::receive);
        app.get("/health", ctx -> ctx.json(Map.of("status", "ok")));
        return app;
    }

    /** POST /ipn */
    private void receive(Context ctx) throws Exception {
        String body = ctx.body();
        if (!verifier.verifyBody(body, ctx.headerMap())) {
            log.warn("Rejected IPN from {}: invalid signature", ctx.ip());
            ctx.status(HttpStatus.UNAUTHORIZED).json(Map.of("error", "invalid signature"));
            return;
        }
        Map<String, Object> payload = Json.wire().readValue(body, Json.MAP_TYPE);
        log.info("IPN for payment {}: status={}", payload.get("payment_id"), payload.get("payment_status"));
        listener.accept(payload);
        ctx.json(Map.of("status", "ok"));
    }

    public static void main(String[] args) {
        IpnVerifier verifier = IpnVerifier.fromEnvironment(System.getenv());
        var server = new IpnReceiverServer(verifier,
                payload -> log.info("Notification payload: {}", payload));

        int port = Integer.parseInt(System.getenv().getOrDefault("PORT", "8080"));
        server.create().start(port);

        log.info("IPN receiver running on http://localhost:{}/ipn", port);
    }
}
