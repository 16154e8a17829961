package com.nowpayments.sdk.client;

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

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Contract for calling the NOWPayments API.
 *
 * <p>Every method throws {@link NowPaymentsException} (an {@link IOException})
 * when the call fails, and {@link InterruptedException} when the calling thread
 * is interrupted while waiting for a response or a retry.
 */
public interface NowPaymentsClient {

    // General

    /** GET /status. */
    ApiStatus status() throws IOException, InterruptedException;

    /** Tickers of all coins the API supports. */
    List<String> currencies() throws IOException, InterruptedException;

    /** Tickers enabled in the merchant's dashboard. */
    List<String> merchantCurrencies() throws IOException, InterruptedException;

    List<Currency> fullCurrencies() throws IOException, InterruptedException;

    /** Minimum payment amount for a currency pair, as sent by the API. */
    Map<String, Object> minAmount(String currencyFrom, String currencyTo) throws IOException, InterruptedException;

    Estimate estimate(BigDecimal amount, String currencyFrom, String currencyTo)
            throws IOException, InterruptedException;

    // Payments

    Payment createPayment(PaymentRequest request) throws IOException, InterruptedException;

    Payment paymentStatus(long paymentId) throws IOException, InterruptedException;

    /**
     * Lists payments. Filters: {@code limit, page, order_by, order, dateFrom,
     * dateTo, payment_status, pay_currency}.
     */
    Map<String, Object> listPayments(ListQuery query) throws IOException, InterruptedException;

    /** Re-quotes a waiting payment at the current rate. */
    Payment updatePaymentEstimate(long paymentId) throws IOException, InterruptedException;

    // Invoices

    Invoice createInvoice(InvoiceRequest request) throws IOException, InterruptedException;

    Invoice invoiceStatus(String invoiceId) throws IOException, InterruptedException;

    Payment createInvoicePayment(InvoicePaymentRequest request) throws IOException, InterruptedException;

    // Subscriptions

    SubscriptionPlan createSubscriptionPlan(SubscriptionPlanRequest request) throws IOException, InterruptedException;

    /** Sends only the given fields (snake_case names) as a partial update. */
    SubscriptionPlan updateSubscriptionPlan(String planId, Map<String, ?> fields)
            throws IOException, InterruptedException;

    SubscriptionPlan subscriptionPlan(String planId) throws IOException, InterruptedException;

    List<SubscriptionPlan> subscriptionPlans() throws IOException, InterruptedException;

    Subscription createSubscription(SubscriptionRequest request) throws IOException, InterruptedException;

    Map<String, Object> listSubscriptions(ListQuery query) throws IOException, InterruptedException;

    Subscription subscription(String subscriptionId) throws IOException, InterruptedException;

    /**
     * Cancels a subscription.
     *
     * @return true if the API accepted the deletion, false on any API error
     * @throws InterruptedException if interrupted
     */
    boolean deleteSubscription(String subscriptionId) throws InterruptedException;

    // Payouts

    /**
     * Creates a payout batch.
     *
     * @param withdrawals destinations, at least one
     * @param ipnCallbackUrl optional batch-level callback
     * @param authToken optional JWT from POST /auth, sent as a bearer token
     */
    PayoutBatch createPayout(List<Withdrawal> withdrawals, String ipnCallbackUrl, String authToken)
            throws IOException, InterruptedException;

    /** Confirms a batch with the 2FA code the merchant received. */
    PayoutBatch verifyPayout(String batchId, String verificationCode) throws IOException, InterruptedException;

    PayoutBatch payoutStatus(String batchId) throws IOException, InterruptedException;

    Map<String, Object> listPayouts(ListQuery query) throws IOException, InterruptedException;

    AddressValidation validateAddress(String address, String currency, String extraId)
            throws IOException, InterruptedException;

    // Custody

    UserAccount createUserAccount(String externalId, String email) throws IOException, InterruptedException;

    UserAccount userBalance(long userId) throws IOException, InterruptedException;

    Map<String, Object> listUserAccounts(ListQuery query) throws IOException, InterruptedException;

    /** Opens a deposit into a sub-account; {@code amount} and {@code trackId} may be null. */
    UserPayment createUserPayment(long userId, String currency, BigDecimal amount, String trackId)
            throws IOException, InterruptedException;

    Transfer transferFunds(long fromId, long toId, String currency, BigDecimal amount)
            throws IOException, InterruptedException;

    Map<String, Object> listTransfers(ListQuery query) throws IOException, InterruptedException;

    Transfer transfer(String transferId) throws IOException, InterruptedException;

    /** Moves funds out of a sub-account, to the master balance or to {@code address} when given. */
    Map<String, Object> withdrawFunds(long userId, String currency, BigDecimal amount, String address,
                                      String addressExtra, String ipnCallbackUrl)
            throws IOException, InterruptedException;

    // Conversions

    Conversion createConversion(String fromCurrency, String toCurrency, BigDecimal amount)
            throws IOException, InterruptedException;

    Conversion conversionStatus(String conversionId) throws IOException, InterruptedException;

    Map<String, Object> listConversions(Integer limit, Integer offset) throws IOException, InterruptedException;
}
