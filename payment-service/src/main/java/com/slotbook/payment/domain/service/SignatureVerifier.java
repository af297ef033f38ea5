package com.slotbook.payment.domain.service;

import com.slotbook.payment.config.RazorpayProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * HMAC-SHA256 checks for processor callbacks, using the JCA {@link Mac} and a
 * constant-time comparison.
 *
 * Two independent secrets: the key secret signs {@code orderId|paymentId} handed back by
 * the checkout UI, the webhook secret signs raw webhook bodies.
 */
@Component
@RequiredArgsConstructor
public class SignatureVerifier {

    private static final String HMAC_SHA256 = "HmacSHA256";

    private final RazorpayProperties properties;

    public boolean isValidPaymentSignature(String orderId, String paymentId, String signature) {
        if (orderId == null || paymentId == null) {
            return false;
        }
        byte[] payload = (orderId + "|" + paymentId).getBytes(StandardCharsets.UTF_8);
        return matches(properties.keySecret(), payload, signature);
    }

    public boolean isValidWebhookSignature(byte[] rawBody, String signature) {
        return rawBody != null && matches(properties.webhookSecret(), rawBody, signature);
    }

    public static String hmacHex(String secret, byte[] payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            return HexFormat.of().formatHex(mac.doFinal(payload));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 is not available", e);
        }
    }

    private static boolean matches(String secret, byte[] payload, String signature) {
        if (secret == null || secret.isEmpty() || signature == null || signature.isBlank()) {
            return false;
        }
        byte[] expected = hmacHex(secret, payload).getBytes(StandardCharsets.US_ASCII);
        byte[] provided = signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, provided);
    }
}
