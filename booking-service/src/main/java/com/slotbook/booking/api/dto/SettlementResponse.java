package com.slotbook.booking.api.dto;

import com.slotbook.booking.domain.model.Booking;

import java.time.LocalDateTime;

public record SettlementResponse(
        Long bookingId,
        Outcome outcome,
        String paymentId,
        String paymentMethod,
        LocalDateTime paidAt
) {
    public enum Outcome {
        SETTLED,
        /** The booking was paid by an earlier delivery of the same or another confirmation. */
        ALREADY_SETTLED
    }

    public static SettlementResponse of(Booking booking, Outcome outcome) {
        return new SettlementResponse(booking.getId(), outcome, booking.getPaymentId(),
                booking.getPaymentMethod(), booking.getPaidAt());
    }
}
