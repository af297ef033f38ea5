package com.slotbook.payment.client.dto;

public record SettleBookingRequest(
        String paymentId,
        String paymentMethod
) {
}
