package com.slotbook.payment.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Optional;

/**
 * Webhook envelope. Only the payment entity is read; other payload members are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RazorpayWebhookEvent(
        String event,
        Payload payload
) {
    public static final String PAYMENT_CAPTURED = "payment.captured";

    public Optional<RazorpayPayment> payment() {
        if (payload == null || payload.payment() == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(payload.payment().entity());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Payload(PaymentWrapper payment) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PaymentWrapper(RazorpayPayment entity) {
    }
}
