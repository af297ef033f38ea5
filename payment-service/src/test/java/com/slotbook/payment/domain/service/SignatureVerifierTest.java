package com.slotbook.payment.domain.service;

import com.slotbook.payment.config.RazorpayProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class SignatureVerifierTest {

    private static final String KEY_SECRET = "test_key_secret";
    private static final String WEBHOOK_SECRET = "test_webhook_secret";

    /** HMAC-SHA256(test_key_secret, "order_N1|pay_P1") */
    private static final String PAYMENT_SIGNATURE = "5cec31b5347d4787cca2b064902580327444e718b2b5e901d3d6e92bc352012c";

    private final SignatureVerifier verifier = new SignatureVerifier(
            new RazorpayProperties("http://localhost", "rzp_test_key", KEY_SECRET, WEBHOOK_SECRET, "INR"));

    @Test
    @DisplayName("hmacHex matches RFC 4231 test case 2")
    void hmacHex_knownVector() {
        String hex = SignatureVerifier.hmacHex("Jefe", "what do ya want for nothing?".getBytes(StandardCharsets.UTF_8));

        assertThat(hex).isEqualTo("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843");
    }

    @Test
    @DisplayName("payment signature over orderId|paymentId is accepted, case-insensitively")
    void paymentSignature_valid() {
        assertThat(verifier.isValidPaymentSignature("order_N1", "pay_P1", PAYMENT_SIGNATURE)).isTrue();
        assertThat(verifier.isValidPaymentSignature("order_N1", "pay_P1", PAYMENT_SIGNATURE.toUpperCase())).isTrue();
    }

    @Test
    @DisplayName("payment signature is rejected when orderId or paymentId is tampered with")
    void paymentSignature_tampered() {
        assertThat(verifier.isValidPaymentSignature("order_N2", "pay_P1", PAYMENT_SIGNATURE)).isFalse();
        assertThat(verifier.isValidPaymentSignature("order_N1", "pay_P2", PAYMENT_SIGNATURE)).isFalse();
        assertThat(verifier.isValidPaymentSignature("order_N1", "pay_P1", "")).isFalse();
        assertThat(verifier.isValidPaymentSignature("order_N1", "pay_P1", null)).isFalse();
    }

    @Test
    @DisplayName("webhook signature uses the webhook secret over the raw body")
    void webhookSignature_usesWebhookSecret() {
        byte[] body = "{\"event\":\"payment.captured\"}".getBytes(StandardCharsets.UTF_8);
        String signature = SignatureVerifier.hmacHex(WEBHOOK_SECRET, body);

        assertThat(verifier.isValidWebhookSignature(body, signature)).isTrue();
        assertThat(verifier.isValidWebhookSignature(body, SignatureVerifier.hmacHex(KEY_SECRET, body))).isFalse();
    }

    @Test
    @DisplayName("webhook signature is rejected for a re-serialized or modified body")
    void webhookSignature_bodyChanged() {
        byte[] body = "{\"event\":\"payment.captured\"}".getBytes(StandardCharsets.UTF_8);
        String signature = SignatureVerifier.hmacHex(WEBHOOK_SECRET, body);
        byte[] reformatted = "{ \"event\": \"payment.captured\" }".getBytes(StandardCharsets.UTF_8);

        assertThat(verifier.isValidWebhookSignature(reformatted, signature)).isFalse();
    }

    @Test
    @DisplayName("missing secret never validates")
    void missingSecret_rejects() {
        SignatureVerifier unconfigured = new SignatureVerifier(
                new RazorpayProperties("http://localhost", "rzp_test_key", "", null, "INR"));
        byte[] body = "{}".getBytes(StandardCharsets.UTF_8);

        assertThat(unconfigured.isValidPaymentSignature("order_N1", "pay_P1", PAYMENT_SIGNATURE)).isFalse();
        assertThat(unconfigured.isValidWebhookSignature(body, SignatureVerifier.hmacHex("x", body))).isFalse();
    }
}
