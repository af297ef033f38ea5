package com.slotbook.payment.api.dto;

import com.slotbook.payment.domain.polling.PaymentWatch;

import java.time.Instant;

public record PaymentWatchResponse(
        Long bookingId,
        String orderId,
        PaymentWatch.State state,
        int attempts,
        int maxAttempts,
        Instant startedAt,
        Instant finishedAt
) {
    public static PaymentWatchResponse from(PaymentWatch watch) {
        return new PaymentWatchResponse(
                watch.getBookingId(),
                watch.getOrderId(),
                watch.state(),
                watch.attempts(),
                watch.getMaxAttempts(),
                watch.getStartedAt(),
                watch.getFinishedAt()
        );
    }
}
