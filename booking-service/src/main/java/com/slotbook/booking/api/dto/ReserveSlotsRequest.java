package com.slotbook.booking.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.util.List;

public record ReserveSlotsRequest(
        @NotNull(message = "User ID cannot be null")
        Long userId,

        @NotNull(message = "Venue ID cannot be null")
        Long venueId,

        @NotBlank(message = "Date cannot be blank")
        @Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}", message = "Date must be in YYYY-MM-DD format")
        String date,

        @NotEmpty(message = "At least one slot must be selected")
        List<@NotBlank(message = "Slot label cannot be blank") String> slots
) {
}
