package com.slotbook.booking.api.dto;

import jakarta.validation.constraints.NotBlank;

public record SettleBookingRequest(
        @NotBlank(message = "Payment ID cannot be blank")
        String paymentId,

        String paymentMethod
) {
}
