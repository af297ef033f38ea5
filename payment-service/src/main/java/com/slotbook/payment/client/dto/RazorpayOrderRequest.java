package com.slotbook.payment.client.dto;

import java.util.Map;

/**
 * @param amount  in minor units (paise)
 * @param receipt our booking id
 * @param notes   processor metadata echoed back on payments and webhooks
 */
public record RazorpayOrderRequest(
        long amount,
        String currency,
        String receipt,
        Map<String, String> notes
) {
}
