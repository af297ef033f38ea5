package com.slotbook.payment.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDateTime;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SettlementView(
        Long bookingId,
        String outcome,
        String paymentId,
        String paymentMethod,
        LocalDateTime paidAt
) {
    public static final String ALREADY_SETTLED = "ALREADY_SETTLED";

    public boolean alreadySettled() {
        return ALREADY_SETTLED.equals(outcome);
    }
}
