package com.slotbook.payment.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Payment processor settings bound from {@code payment.razorpay.*}.
 *
 * @param baseUrl       processor REST endpoint
 * @param keyId         public key id, handed to the checkout UI
 * @param keySecret     signs redirect confirmations ({@code orderId|paymentId}) and authenticates API calls
 * @param webhookSecret signs webhook bodies; independent of {@code keySecret}
 * @param currency      ISO currency of every order
 */
@ConfigurationProperties(prefix = "payment.razorpay")
public record RazorpayProperties(
        String baseUrl,
        String keyId,
        String keySecret,
        String webhookSecret,
        String currency
) {
}
