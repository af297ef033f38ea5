package com.slotbook.payment.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RazorpayOrder(
        String id,
        long amount,
        String currency,
        String receipt,
        String status
) {
}
