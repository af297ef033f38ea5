package com.slotbook.payment.api.dto;

public record ConfirmationResponse(
        Long bookingId,
        Status status,
        String paymentId,
        String reason
) {
    public enum Status {
        SETTLED,
        FAILED
    }

    public static ConfirmationResponse settled(Long bookingId, String paymentId) {
        return new ConfirmationResponse(bookingId, Status.SETTLED, paymentId, null);
    }

    public static ConfirmationResponse failed(Long bookingId, String paymentId, String reason) {
        return new ConfirmationResponse(bookingId, Status.FAILED, paymentId, reason);
    }
}
