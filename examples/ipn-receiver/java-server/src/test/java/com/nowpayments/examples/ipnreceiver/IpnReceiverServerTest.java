package com.nowpayments.examples.ipnreceiver;

import com.nowpayments.sdk.crypto.IpnSigner;
import com.nowpayments.sdk.crypto.IpnVerifier;
import io.javalin.Javalin;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class IpnReceiverServerTest {

    private static final String SECRET = "receiver-secret";

    static Javalin app;
    static final List<Map<String, Object>> received = new CopyOnWriteArrayList<>();
    static final HttpClient http = HttpClient.newHttpClient();

    @BeforeAll
    static void startServer() {
        app = new IpnReceiverServer(new IpnVerifier(SECRET), received::add).create().start(0);
    }

    @AfterAll
    static void stopServer() { app.stop(); }

    @BeforeEach
    void setUp() {
        received.clear();
    }

    private HttpResponse<String> post(String body, String signature) throws Exception {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create("http://localhost:" + app.port() + "/ipn"))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body));
        if (signature != null) {
            b.header("x-nowpayments-sig", signature);
        }
        return http.send(b.build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void acceptsSignedNotification() throws Exception {
        String body = "{\"payment_status\":\"finished\",\"payment_id\":5077125051,\"actually_paid\":0.0017}";
        String sig = new IpnSigner(SECRET).sign(Map.of(
            "payment_status", "finished", "payment_id", 5077125051L, "actually_paid", 0.0017));

        HttpResponse<String> resp = post(body, sig);

        assertEquals(200, resp.statusCode());
        assertTrue(resp.body().contains("\"ok\""));
        assertEquals(1, received.size());
        assertEquals("finished", received.get(0).get("payment_status"));
    }

    @Test
    void rejectsForgedNotification() throws Exception {
        String body = "{\"payment_status\":\"finished\",\"payment_id\":1}";
        String sig = new IpnSigner("wrong-secret").sign(Map.of("payment_status", "finished", "payment_id", 1));

        HttpResponse<String> resp = post(body, sig);

        assertEquals(401, resp.statusCode());
        assertTrue(resp.body().contains("invalid signature"));
        assertTrue(received.isEmpty());
    }

    @Test
    void rejectsUnsignedOrMalformedBody() throws Exception {
        assertEquals(401, post("{\"payment_id\":1}", null).statusCode());
        assertEquals(401, post("not json", "abc").statusCode());
        assertTrue(received.isEmpty());
    }
}
