package com.slotbook.booking.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

import java.util.List;

public record SlotSelectionRequest(
        @NotBlank(message = "Date cannot be blank")
        @Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}", message = "Date must be in YYYY-MM-DD format")
        String date,

        List<String> selectedSlots,

        @NotBlank(message = "Slot to toggle cannot be blank")
        String toggle
) {
    public List<String> selectedSlotsOrEmpty() {
        return selectedSlots == null ? List.of() : selectedSlots;
    }
}
