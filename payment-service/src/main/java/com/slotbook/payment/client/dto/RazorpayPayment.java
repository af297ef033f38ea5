package com.slotbook.payment.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Payment entity as returned by the processor API and embedded in webhook events.
 * {@code notes} is kept as a tree: the processor sends {@code []} instead of {@code {}} when empty.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RazorpayPayment(
        String id,
        @JsonProperty("order_id") String orderId,
        String status,
        String method,
        Long amount,
        String currency,
        JsonNode notes
) {
    public static final String STATUS_CAPTURED = "captured";

    public boolean isCaptured() {
        return STATUS_CAPTURED.equals(status);
    }

    public Optional<String> note(String key) {
        if (notes == null || !notes.isObject()) {
            return Optional.empty();
        }
        JsonNode value = notes.get(key);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }
}
