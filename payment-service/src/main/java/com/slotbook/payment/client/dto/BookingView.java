package com.slotbook.payment.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;
import java.util.List;

/**
 * Booking as exposed by booking-service.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BookingView(
        Long id,
        Long userId,
        Long venueId,
        String date,
        List<String> slots,
        BigDecimal totalAmount,
        boolean paid,
        String status,
        String paymentId
) {
}
