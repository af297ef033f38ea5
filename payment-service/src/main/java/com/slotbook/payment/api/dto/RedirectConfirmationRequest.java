package com.slotbook.payment.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Fields the processor's checkout hands back to the browser after payment.
 */
public record RedirectConfirmationRequest(
        @NotNull(message = "Booking ID cannot be null")
        Long bookingId,

        @NotBlank(message = "Payment ID cannot be blank")
        String paymentId,

        @NotBlank(message = "Order ID cannot be blank")
        String orderId,

        @NotBlank(message = "Signature cannot be blank")
        String signature
) {
}
