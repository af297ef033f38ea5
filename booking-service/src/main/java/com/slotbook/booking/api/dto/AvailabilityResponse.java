package com.slotbook.booking.api.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * Hourly slots of a venue on a date. {@code availableSlots} excludes every slot of a paid
 * booking; unpaid holds are not reflected.
 */
public record AvailabilityResponse(
        Long venueId,
        String date,
        BigDecimal pricePerHour,
        List<String> slots,
        List<String> availableSlots
) {
}
