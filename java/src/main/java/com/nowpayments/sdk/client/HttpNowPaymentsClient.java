package com.nowpayments.sdk.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.nowpayments.sdk.json.Json;
import com.nowpayments.sdk.model.AddressValidation;
import com.nowpayments.sdk.model.ApiStatus;
import com.nowpayments.sdk.model.Conversion;
import com.nowpayments.sdk.model.Currency;
import com.nowpayments.sdk.model.Estimate;
import com.nowpayments.sdk.model.Invoice;
import com.nowpayments.sdk.model.InvoicePaymentRequest;
import com.nowpayments.sdk.model.InvoiceRequest;
import com.nowpayments.sdk.model.Payment;
import com.nowpayments.sdk.model.PaymentRequest;
import com.nowpayments.sdk.model.PayoutBatch;
import com.nowpayments.sdk.model.Subscription;
import com.nowpayments.sdk.model.SubscriptionPlan;
import com.nowpayments.sdk.model.SubscriptionPlanRequest;
import com.nowpayments.sdk.model.SubscriptionRequest;
import com.nowpayments.sdk.model.Transfer;
import com.nowpayments.sdk.model.UserAccount;
import com.nowpayments.sdk.model.UserPayment;
import com.nowpayments.sdk.model.Withdrawal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** {@link NowPaymentsClient} backed by a {@link RequestDispatcher}. */
public class HttpNowPaymentsClient implements NowPaymentsClient {

    private static final Logger log = LoggerFactory.getLogger(HttpNowPaymentsClient.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<List<Currency>> CURRENCY_LIST = new TypeReference<>() {};
    private static final TypeReference<List<SubscriptionPlan>> PLAN_LIST = new TypeReference<>() {};

    private final RequestDispatcher dispatcher;

    public HttpNowPaymentsClient(ClientConfig config) {
        this(new RequestDispatcher(config));
    }

    public HttpNowPaymentsClient(RequestDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    /** Direct access for endpoints this interface does not wrap yet. */
    public RequestDispatcher dispatcher() {
        return dispatcher;
    }

    // General

    @Override
    public ApiStatus status() throws IOException, InterruptedException {
        return dispatcher.execute(ApiRequest.get("/status"), ApiStatus.class);
    }

    @Override
    public List<String> currencies() throws IOException, InterruptedException {
        return listField(ApiRequest.get("/currencies"), "currencies", STRING_LIST);
    }

    @Override
    public List<String> merchantCurrencies() throws IOException, InterruptedException {
        return listField(ApiRequest.get("/merchant/coins"), "currencies", STRING_LIST);
    }

    @Override
    public List<Currency> fullCurrencies() throws IOException, InterruptedException {
        return listField(ApiRequest.get("/full-currencies"), "currencies", CURRENCY_LIST);
    }

    @Override
    public Map<String, Object> minAmount(String currencyFrom, String currencyTo)
            throws IOException, InterruptedException {
        return dispatcher.execute(ApiRequest.builder(HttpMethod.GET, "/min-amount")
                .query("currency_from", required(currencyFrom, "currencyFrom"))
                .query("currency_to", required(currencyTo, "currencyTo"))
                .build());
    }

    @Override
    public Estimate estimate(BigDecimal amount, String currencyFrom, String currencyTo)
            throws IOException, InterruptedException {
        return dispatcher.execute(ApiRequest.builder(HttpMethod.GET, "/estimate")
                .query("amount", Objects.requireNonNull(amount, "amount").toPlainString())
                .query("currency_from", required(currencyFrom, "currencyFrom"))
                .query("currency_to", required(currencyTo, "currencyTo"))
                .build(), Estimate.class);
    }

    // Payments

    @Override
    public Payment createPayment(PaymentRequest request) throws IOException, InterruptedException {
        Objects.requireNonNull(request, "request");
        return dispatcher.execute(ApiRequest.post("/payment", request), Payment.class);
    }

    @Override
    public Payment paymentStatus(long paymentId) throws IOException, InterruptedException {
        return dispatcher.execute(ApiRequest.get("/payment/" + paymentId), Payment.class);
    }

    @Override
    public Map<String, Object> listPayments(ListQuery query) throws IOException, InterruptedException {
        return dispatcher.execute(listRequest("/payment", query));
    }

    @Override
    public Payment updatePaymentEstimate(long paymentId) throws IOException, InterruptedException {
        return dispatcher.execute(ApiRequest.builder(HttpMethod.POST,
                "/payment/" + paymentId + "/update-merchant-estimate").build(), Payment.class);
    }

    // Invoices

    @Override
    public Invoice createInvoice(InvoiceRequest request) throws IOException, InterruptedException {
        Objects.requireNonNull(request, "request");
        return dispatcher.execute(ApiRequest.post("/invoice", request), Invoice.class);
    }

    @Override
    public Invoice invoiceStatus(String invoiceId) throws IOException, InterruptedException {
        return dispatcher.execute(ApiRequest.get("/invoice/" + segment(invoiceId, "invoiceId")), Invoice.class);
    }

    @Override
    public Payment createInvoicePayment(InvoicePaymentRequest request) throws IOException, InterruptedException {
        Objects.requireNonNull(request, "request");
        return dispatcher.execute(ApiRequest.post("/invoice-payment", request), Payment.class);
    }

    // Subscriptions

    @Override
    public SubscriptionPlan createSubscriptionPlan(SubscriptionPlanRequest request)
            throws IOException, InterruptedException {
        Objects.requireNonNull(request, "request");
        return plan(ApiRequest.post("/subscriptions/plans", request));
    }

    @Override
    public SubscriptionPlan updateSubscriptionPlan(String planId, Map<String, ?> fields)
            throws IOException, InterruptedException {
        Objects.requireNonNull(fields, "fields");
        ApiRequest request = ApiRequest.builder(HttpMethod.PATCH, "/subscriptions/plans/" + segment(planId, "planId"))
                .body(new LinkedHashMap<>(fields))
                .build();
        return plan(request);
    }

    @Override
    public SubscriptionPlan subscriptionPlan(String planId) throws IOException, InterruptedException {
        return plan(ApiRequest.get("/subscriptions/plans/" + segment(planId, "planId")));
    }

    @Override
    public List<SubscriptionPlan> subscriptionPlans() throws IOException, InterruptedException {
        return listField(ApiRequest.get("/subscriptions/plans"), "plans", PLAN_LIST);
    }

    @Override
    public Subscription createSubscription(SubscriptionRequest request) throws IOException, InterruptedException {
        Objects.requireNonNull(request, "request");
        return dispatcher.execute(ApiRequest.post("/subscriptions", request), Subscription.class);
    }

    @Override
    public Map<String, Object> listSubscriptions(ListQuery query) throws IOException, InterruptedException {
        return dispatcher.execute(listRequest("/subscriptions", query));
    }

    @Override
    public Subscription subscription(String subscriptionId) throws IOException, InterruptedException {
        return dispatcher.execute(
                ApiRequest.get("/subscriptions/" + segment(subscriptionId, "subscriptionId")), Subscription.class);
    }

    @Override
    public boolean deleteSubscription(String subscriptionId) throws InterruptedException {
        String path = "/subscriptions/" + segment(subscriptionId, "subscriptionId");
        try {
            dispatcher.execute(ApiRequest.delete(path));
            return true;
        } catch (IOException e) {
            log.info("Deleting subscription {} failed: {}", subscriptionId, e.toString());
            return false;
        }
    }

    // Payouts

    @Override
    public PayoutBatch createPayout(List<Withdrawal> withdrawals, String ipnCallbackUrl, String authToken)
            throws IOException, InterruptedException {
        Objects.requireNonNull(withdrawals, "withdrawals");
        if (withdrawals.isEmpty()) {
            throw new IllegalArgumentException("withdrawals must not be empty");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("withdrawals", new ArrayList<>(withdrawals));
        putIfPresent(body, "ipn_callback_url", ipnCallbackUrl);

        ApiRequest.Builder request = ApiRequest.builder(HttpMethod.POST, "/payout").body(body);
        if (authToken != null && !authToken.isBlank()) {
            request.header("Authorization", "Bearer " + authToken);
        }
        return dispatcher.execute(request.build(), PayoutBatch.class);
    }

    @Override
    public PayoutBatch verifyPayout(String batchId, String verificationCode)
            throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", required(verificationCode, "verificationCode"));
        return dispatcher.execute(
                ApiRequest.post("/payout/" + segment(batchId, "batchId") + "/verify", body), PayoutBatch.class);
    }

    @Override
    public PayoutBatch payoutStatus(String batchId) throws IOException, InterruptedException {
        return dispatcher.execute(ApiRequest.get("/payout/" + segment(batchId, "batchId")), PayoutBatch.class);
    }

    @Override
    public Map<String, Object> listPayouts(ListQuery query) throws IOException, InterruptedException {
        return dispatcher.execute(listRequest("/payout", query));
    }

    @Override
    public AddressValidation validateAddress(String address, String currency, String extraId)
            throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("address", required(address, "address"));
        body.put("currency", required(currency, "currency"));
        putIfPresent(body, "extra_id", extraId);
        return dispatcher.execute(ApiRequest.post("/payout/validate-address", body), AddressValidation.class);
    }

    // Custody

    @Override
    public UserAccount createUserAccount(String externalId, String email) throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        putIfPresent(body, "external_id", externalId);
        putIfPresent(body, "email", email);
        return dispatcher.execute(ApiRequest.post("/sub-partner/balance", body), UserAccount.class);
    }

    @Override
    public UserAccount userBalance(long userId) throws IOException, InterruptedException {
        return dispatcher.execute(ApiRequest.get("/sub-partner/balance/" + userId), UserAccount.class);
    }

    @Override
    public Map<String, Object> listUserAccounts(ListQuery query) throws IOException, InterruptedException {
        return dispatcher.execute(listRequest("/sub-partner", query));
    }

    @Override
    public UserPayment createUserPayment(long userId, String currency, BigDecimal amount, String trackId)
            throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user_id", userId);
        body.put("currency", required(currency, "currency"));
        if (amount != null) {
            body.put("amount", amount.toPlainString());
        }
        putIfPresent(body, "track_id", trackId);
        return dispatcher.execute(ApiRequest.post("/sub-partner/payment", body), UserPayment.class);
    }

    @Override
    public Transfer transferFunds(long fromId, long toId, String currency, BigDecimal amount)
            throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("from_id", fromId);
        body.put("to_id", toId);
        body.put("currency", required(currency, "currency"));
        body.put("amount", Objects.requireNonNull(amount, "amount").toPlainString());
        return dispatcher.execute(ApiRequest.post("/sub-partner/transfer", body), Transfer.class);
    }

    @Override
    public Map<String, Object> listTransfers(ListQuery query) throws IOException, InterruptedException {
        return dispatcher.execute(listRequest("/sub-partner/transfers", query));
    }

    @Override
    public Transfer transfer(String transferId) throws IOException, InterruptedException {
        return dispatcher.execute(
                ApiRequest.get("/sub-partner/transfer/" + segment(transferId, "transferId")), Transfer.class);
    }

    @Override
    public Map<String, Object> withdrawFunds(long userId, String currency, BigDecimal amount, String address,
                                             String addressExtra, String ipnCallbackUrl)
            throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user_id", userId);
        body.put("currency", required(currency, "currency"));
        body.put("amount", Objects.requireNonNull(amount, "amount").toPlainString());
        putIfPresent(body, "address", address);
        putIfPresent(body, "address_extra", addressExtra);
        putIfPresent(body, "ipn_callback_url", ipnCallbackUrl);
        return dispatcher.execute(ApiRequest.post("/sub-partner/write-off", body));
    }

    // Conversions

    @Override
    public Conversion createConversion(String fromCurrency, String toCurrency, BigDecimal amount)
            throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("from_currency", required(fromCurrency, "fromCurrency"));
        body.put("to_currency", required(toCurrency, "toCurrency"));
        body.put("amount", Objects.requireNonNull(amount, "amount").toPlainString());
        return dispatcher.execute(ApiRequest.post("/conversion", body), Conversion.class);
    }

    @Override
    public Conversion conversionStatus(String conversionId) throws IOException, InterruptedException {
        return dispatcher.execute(
                ApiRequest.get("/conversion/" + segment(conversionId, "conversionId")), Conversion.class);
    }

    @Override
    public Map<String, Object> listConversions(Integer limit, Integer offset) throws IOException, InterruptedException {
        return dispatcher.execute(ApiRequest.builder(HttpMethod.GET, "/conversion")
                .query("limit", limit)
                .query("offset", offset)
                .build());
    }

    // helpers

    private static ApiRequest listRequest(String path, ListQuery query) {
        return ApiRequest.builder(HttpMethod.GET, path)
                .queryAll(query == null ? null : query.toMap())
                .build();
    }

    /** Plan endpoints wrap the plan in {@code result}; older responses do not. */
    private SubscriptionPlan plan(ApiRequest request) throws IOException, InterruptedException {
        Map<String, Object> response = dispatcher.execute(request);
        Object result = response.get("result");
        Object source = result instanceof Map ? result : response;
        return RequestDispatcher.convert(request, response, source,
                Json.model().constructType(SubscriptionPlan.class));
    }

    private <T> List<T> listField(ApiRequest request, String field, TypeReference<List<T>> type)
            throws IOException, InterruptedException {
        Map<String, Object> response = dispatcher.execute(request);
        Object value = response.get(field);
        if (value == null) {
            return new ArrayList<>();
        }
        return RequestDispatcher.convert(request, response, value, Json.model().constructType(type));
    }

    private static void putIfPresent(Map<String, Object> body, String name, String value) {
        if (value != null && !value.isEmpty()) {
            body.put(name, value);
        }
    }

    private static String required(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }

    private static String segment(String id, String name) {
        return URLEncoder.encode(required(id, name), StandardCharsets.UTF_8);
    }
}
