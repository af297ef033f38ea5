package com.slotbook.payment.api.dto;

/**
 * @param upiUri payload to render as a QR code
 */
public record UpiQrResponse(
        Long bookingId,
        String orderId,
        String upiUri,
        PaymentWatchResponse watch
) {
}
