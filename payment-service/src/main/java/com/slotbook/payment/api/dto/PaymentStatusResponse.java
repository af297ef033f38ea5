package com.slotbook.payment.api.dto;

public record PaymentStatusResponse(
        Long bookingId,
        String orderId,
        Status status,
        String paymentId
) {
    public enum Status {
        PENDING,
        SETTLED,
        /** Captured, but the slots went to another booking; refund pending. */
        SLOT_ALREADY_SOLD
    }

    public static PaymentStatusResponse pending(Long bookingId, String orderId) {
        return new PaymentStatusResponse(bookingId, orderId, Status.PENDING, null);
    }

    public boolean isTerminal() {
        return status != Status.PENDING;
    }
}
