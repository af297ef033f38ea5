package com.slotbook.payment.api.dto;

import com.slotbook.payment.domain.model.PaymentOrder;

/**
 * What the checkout UI needs to open the processor's payment sheet.
 *
 * @param amount minor units (paise)
 * @param keyId  public key id of the merchant account
 */
public record CreateOrderResponse(
        Long bookingId,
        String orderId,
        long amount,
        String currency,
        String keyId
) {
    public static CreateOrderResponse from(PaymentOrder order, String keyId) {
        return new CreateOrderResponse(order.getBookingId(), order.getOrderId(), order.getAmount(),
                order.getCurrency(), keyId);
    }
}
