package com.slotbook.payment.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RazorpayPaymentCollection(
        int count,
        List<RazorpayPayment> items
) {
    public List<RazorpayPayment> itemsOrEmpty() {
        return items == null ? List.of() : items;
    }
}
