package com.nowpayments.sdk.client;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.http.Fault;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

class RequestDispatcherTest {

    static WireMockServer wm;

    @BeforeAll
    static void startServer() {
        wm = new WireMockServer(0);   // random port
        wm.start();
    }

    @AfterAll
    static void stopServer() { wm.stop(); }

    @BeforeEach
    void setUp() {
        wm.resetAll();
    }

    private RequestDispatcher dispatcher(int maxRetries) {
        return new RequestDispatcher(ClientConfig.builder("test-key")
                .baseUrl("http://localhost:" + wm.port())
                .maxRetries(maxRetries)
                .backoffBase(Duration.ofMillis(1))
                .timeout(Duration.ofSeconds(5))
                .build());
    }

    private static RequestDispatcher scripted(ScriptedHttpClient http, int maxRetries) {
        return new RequestDispatcher(ClientConfig.builder("test-key")
                .baseUrl("http://nowpayments.test/v1")
                .maxRetries(maxRetries)
                .backoffBase(Duration.ZERO)
                .build(), http);
    }

    @Test
    void persistent500IsRetriedThenReportedAsGeneric() {
        wm.stubFor(get(urlEqualTo("/status"))
            .willReturn(aResponse()
                .withStatus(500)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"message\":\"internal error\"}")));

        NowPaymentsException ex = assertThrows(NowPaymentsException.class,
            () -> dispatcher(3).execute(ApiRequest.get("/status")));

        assertEquals(ErrorKind.GENERIC, ex.kind());
        assertEquals(500, ex.statusCode());
        assertEquals("internal error", ex.getMessage());
        assertEquals("internal error", ex.responseBody().get("message"));
        wm.verify(4, getRequestedFor(urlEqualTo("/status")));
    }

    @Test
    void exhausted5xxOnBusinessPathUsesPathClassification() {
        wm.stubFor(get(urlEqualTo("/payment/42"))
            .willReturn(aResponse().withStatus(503)));

        NowPaymentsException ex = assertThrows(NowPaymentsException.class,
            () -> dispatcher(1).execute(ApiRequest.get("/payment/42")));

        assertEquals(ErrorKind.PAYMENT, ex.kind());
        assertEquals("HTTP 503", ex.getMessage());
        assertTrue(ex.responseBody().isEmpty());
        wm.verify(2, getRequestedFor(urlEqualTo("/payment/42")));
    }

    @Test
    void serverErrorFollowedBySuccessReturnsBody() throws Exception {
        wm.stubFor(get(urlEqualTo("/status")).inScenario("recovering")
            .whenScenarioStateIs(Scenario.STARTED)
            .willReturn(aResponse().withStatus(502))
            .willSetStateTo("up"));
        wm.stubFor(get(urlEqualTo("/status")).inScenario("recovering")
            .whenScenarioStateIs("up")
            .willReturn(aResponse()
                .withHeader("Content-Type", "application/json")
                .withBody("{\"message\":\"OK\"}")));

        Map<String, Object> body = dispatcher(3).execute(ApiRequest.get("/status"));

        assertEquals("OK", body.get("message"));
        wm.verify(2, getRequestedFor(urlEqualTo("/status")));
    }

    @Test
    void connectionResetTwiceThenSuccess() throws Exception {
        wm.stubFor(get(urlEqualTo("/status")).inScenario("flaky")
            .whenScenarioStateIs(Scenario.STARTED)
            .willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER))
            .willSetStateTo("second"));
        wm.stubFor(get(urlEqualTo("/status")).inScenario("flaky")
            .whenScenarioStateIs("second")
            .willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER))
            .willSetStateTo("third"));
        wm.stubFor(get(urlEqualTo("/status")).inScenario("flaky")
            .whenScenarioStateIs("third")
            .willReturn(aResponse()
                .withHeader("Content-Type", "application/json")
                .withBody("{\"message\":\"OK\"}")));

        Map<String, Object> body = dispatcher(2).execute(ApiRequest.get("/status"));

        assertEquals("OK", body.get("message"));
    }

    @Test
    void transportErrorsThenSuccessWithScriptedClient() throws Exception {
        ScriptedHttpClient http = new ScriptedHttpClient()
            .fail(new ConnectException("Connection refused"))
            .fail(new ConnectException("Connection refused"))
            .respond(200, "{\"payment_id\":5077125051}");

        Map<String, Object> body = scripted(http, 3).execute(ApiRequest.get("/payment/5077125051"));

        assertEquals(5077125051L, ((Number) body.get("payment_id")).longValue());
        assertEquals(3, http.sent().size());
    }

    @Test
    void transportErrorsExhaustRetryBudget() {
        ScriptedHttpClient http = new ScriptedHttpClient()
            .fail(new ConnectException("refused 1"))
            .fail(new HttpTimeoutException("timed out 2"))
            .fail(new ConnectException("refused 3"));

        NowPaymentsException ex = assertThrows(NowPaymentsException.class,
            () -> scripted(http, 2).execute(ApiRequest.get("/status")));

        assertEquals(ErrorKind.TRANSPORT, ex.kind());
        assertEquals(0, ex.statusCode());
        assertEquals("Request failed: refused 3", ex.getMessage());
        assertInstanceOf(ConnectException.class, ex.getCause());
        assertEquals(3, http.sent().size());
    }

    @Test
    void zeroRetriesMeansSingleAttempt() {
        ScriptedHttpClient http = new ScriptedHttpClient()
            .fail(new ConnectException("refused"));

        NowPaymentsException ex = assertThrows(NowPaymentsException.class,
            () -> scripted(http, 0).execute(ApiRequest.get("/status")));

        assertEquals(ErrorKind.TRANSPORT, ex.kind());
        assertEquals(1, http.sent().size());
    }

    @Test
    void unreachableHostIsTransportFailure() {
        RequestDispatcher bad = new RequestDispatcher(ClientConfig.builder("k")
            .baseUrl("http://localhost:1")   // Port 1 should not be listening
            .maxRetries(1)
            .backoffBase(Duration.ZERO)
            .timeout(Duration.ofSeconds(2))
            .build());

        NowPaymentsException ex = assertThrows(NowPaymentsException.class,
            () -> bad.execute(ApiRequest.get("/status")));

        assertEquals(ErrorKind.TRANSPORT, ex.kind());
        assertTrue(ex.getMessage().startsWith("Request failed: "));
        assertNotEquals("Request failed: null", ex.getMessage());
        assertFalse(ex.getMessage().endsWith("null"));
    }

    @Test
    void messageLessTransportErrorIsStillDescribed() {
        ScriptedHttpClient http = new ScriptedHttpClient()
            .fail(new ConnectException());

        NowPaymentsException ex = assertThrows(NowPaymentsException.class,
            () -> scripted(http, 0).execute(ApiRequest.get("/status")));

        assertEquals("Request failed: java.net.ConnectException", ex.getMessage());
    }

    @Test
    void transportMessageIsTakenFromTheCauseChain() {
        IOException wrapped = new IOException(null, new ConnectException("Connection refused"));
        ScriptedHttpClient http = new ScriptedHttpClient().fail(wrapped);

        NowPaymentsException ex = assertThrows(NowPaymentsException.class,
            () -> scripted(http, 0).execute(ApiRequest.get("/status")));

        assertEquals("Request failed: Connection refused", ex.getMessage());
        assertSame(wrapped, ex.getCause());
    }

    @Test
    void rateLimitIsRetriedThenReported() {
        wm.stubFor(get(urlEqualTo("/estimate"))
            .willReturn(aResponse().withStatus(429)));

        NowPaymentsException ex = assertThrows(NowPaymentsException.class,
            () -> dispatcher(2).execute(ApiRequest.get("/estimate")));

        assertEquals(ErrorKind.RATE_LIMITED, ex.kind());
        assertEquals(429, ex.statusCode());
        assertEquals("Rate limit exceeded", ex.getMessage());
        wm.verify(3, getRequestedFor(urlEqualTo("/estimate")));
    }

    @Test
    void authenticationWinsOverPaymentPath() {
        wm.stubFor(get(urlEqualTo("/payment/123"))
            .willReturn(aResponse()
                .withStatus(401)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"statusCode\":401,\"code\":\"INVALID_API_KEY\",\"message\":\"Invalid api key\"}")));

        NowPaymentsException ex = assertThrows(NowPaymentsException.class,
            () -> dispatcher(3).execute(ApiRequest.get("/payment/123")));

        assertEquals(ErrorKind.AUTHENTICATION, ex.kind());
        assertEquals(401, ex.statusCode());
        assertEquals("Invalid api key", ex.getMessage());
        assertEquals("INVALID_API_KEY", ex.responseBody().get("code"));
        // 4xx are never retried
        wm.verify(1, getRequestedFor(urlEqualTo("/payment/123")));
    }

    @Test
    void validationFailure() {
        wm.stubFor(post(urlEqualTo("/payment"))
            .willReturn(aResponse()
                .withStatus(422)
                .withBody("{\"message\":\"pay_currency is required\"}")));

        NowPaymentsException ex = assertThrows(NowPaymentsException.class,
            () -> dispatcher(3).execute(ApiRequest.post("/payment", Map.of("price_amount", "10"))));

        assertEquals(ErrorKind.VALIDATION, ex.kind());
        assertEquals("pay_currency is required", ex.getMessage());
    }

    @Test
    void badRequestClassifiedByPath() {
        wm.stubFor(post(urlEqualTo("/payout"))
            .willReturn(aResponse().withStatus(400).withBody("{\"message\":\"bad address\"}")));
        wm.stubFor(get(urlEqualTo("/merchant/coins"))
            .willReturn(aResponse().withStatus(400)));

        NowPaymentsException payout = assertThrows(NowPaymentsException.class,
            () -> dispatcher(3).execute(ApiRequest.post("/payout", Map.of())));
        NowPaymentsException generic = assertThrows(NowPaymentsException.class,
            () -> dispatcher(3).execute(ApiRequest.get("/merchant/coins")));

        assertEquals(ErrorKind.PAYOUT, payout.kind());
        assertEquals("bad address", payout.getMessage());
        assertEquals(ErrorKind.GENERIC, generic.kind());
        assertEquals(400, generic.statusCode());
        assertEquals("HTTP 400", generic.getMessage());
    }

    @Test
    void nonJsonErrorBodyYieldsEmptyBody() {
        wm.stubFor(get(urlEqualTo("/conversion/9"))
            .willReturn(aResponse().withStatus(404).withBody("<html>not found</html>")));

        NowPaymentsException ex = assertThrows(NowPaymentsException.class,
            () -> dispatcher(0).execute(ApiRequest.get("/conversion/9")));

        assertEquals(ErrorKind.CONVERSION, ex.kind());
        assertTrue(ex.responseBody().isEmpty());
        assertEquals("HTTP 404", ex.getMessage());
    }

    @Test
    void emptySuccessBodyIsEmptyMap() throws Exception {
        wm.stubFor(delete(urlEqualTo("/subscriptions/77"))
            .willReturn(aResponse().withStatus(200)));

        Map<String, Object> body = dispatcher(0).execute(ApiRequest.delete("/subscriptions/77"));

        assertNotNull(body);
        assertTrue(body.isEmpty());
    }

    @Test
    void invalidJsonOnSuccessIsGenericFailure() {
        wm.stubFor(get(urlEqualTo("/status"))
            .willReturn(aResponse().withStatus(200).withBody("OK")));

        NowPaymentsException ex = assertThrows(NowPaymentsException.class,
            () -> dispatcher(0).execute(ApiRequest.get("/status")));

        assertEquals(ErrorKind.GENERIC, ex.kind());
        assertEquals(200, ex.statusCode());
    }

    @Test
    void sendsCredentialsQueryAndExtraHeaders() throws Exception {
        wm.stubFor(get(urlPathEqualTo("/estimate"))
            .willReturn(aResponse().withBody("{\"estimated_amount\":0.0017}")));

        ApiRequest request = ApiRequest.builder(HttpMethod.GET, "/estimate")
            .query("amount", "100")
            .query("currency_from", "usd")
            .query("currency_to", "btc")
            .query("skipped", null)
            .header("X-Request-Id", "abc 123")
            .build();
        dispatcher(0).execute(request);

        wm.verify(getRequestedFor(urlEqualTo("/estimate?amount=100&currency_from=usd&currency_to=btc"))
            .withHeader("x-api-key", equalTo("test-key"))
            .withHeader("Content-Type", equalTo("application/json"))
            .withHeader("User-Agent", equalTo(ClientConfig.DEFAULT_USER_AGENT))
            .withHeader("X-Request-Id", equalTo("abc 123")));
    }

    @Test
    void postsJsonBody() throws Exception {
        wm.stubFor(post(urlEqualTo("/conversion"))
            .willReturn(aResponse().withBody("{\"conversion_id\":\"c1\"}")));

        dispatcher(0).execute(ApiRequest.post("/conversion",
            Map.of("from_currency", "usdttrc20", "to_currency", "btc", "amount", "50")));

        wm.verify(postRequestedFor(urlEqualTo("/conversion"))
            .withRequestBody(equalToJson(
                "{\"from_currency\":\"usdttrc20\",\"to_currency\":\"btc\",\"amount\":\"50\"}")));
    }

    @Test
    void floatsAreParsedAsBigDecimal() throws Exception {
        wm.stubFor(get(urlEqualTo("/payment/1"))
            .willReturn(aResponse().withBody("{\"pay_amount\":0.10000001}")));

        Map<String, Object> body = dispatcher(0).execute(ApiRequest.get("/payment/1"));

        assertEquals(new java.math.BigDecimal("0.10000001"), body.get("pay_amount"));
    }

    @Test
    void interruptStopsTheCall() {
        wm.stubFor(get(urlEqualTo("/status"))
            .willReturn(aResponse().withStatus(500)));
        RequestDispatcher slow = new RequestDispatcher(ClientConfig.builder("k")
            .baseUrl("http://localhost:" + wm.port())
            .maxRetries(5)
            .backoffBase(Duration.ofMinutes(1))
            .build());

        Thread.currentThread().interrupt();
        try {
            assertThrows(InterruptedException.class, () -> slow.execute(ApiRequest.get("/status")));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void backoffDoublesFromBase() {
        assertEquals(1000L, RequestDispatcher.backoffDelayMs(1000, 0));
        assertEquals(2000L, RequestDispatcher.backoffDelayMs(1000, 1));
        assertEquals(8000L, RequestDispatcher.backoffDelayMs(1000, 3));
        assertEquals(0L, RequestDispatcher.backoffDelayMs(0, 5));
        assertEquals(Long.MAX_VALUE, RequestDispatcher.backoffDelayMs(1000, 62));
        assertEquals(Long.MAX_VALUE, RequestDispatcher.backoffDelayMs(Long.MAX_VALUE / 2, 2));
    }
}
