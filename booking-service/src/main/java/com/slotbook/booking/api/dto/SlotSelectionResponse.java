package com.slotbook.booking.api.dto;

import java.math.BigDecimal;
import java.util.List;

public record SlotSelectionResponse(
        String date,
        List<String> selectedSlots,
        boolean accepted,
        String message,
        BigDecimal totalAmount
) {
}
