package com.slotbook.booking.exception;

import com.slotbook.common.exception.ConflictException;
import lombok.Getter;

import java.util.List;

/**
 * Reservation rejected because some requested slots are already paid for.
 * The client should refresh availability and choose again.
 */
@Getter
public class SlotConflictException extends ConflictException {

    private final List<String> conflictingSlots;

    public SlotConflictException(Long venueId, String date, List<String> conflictingSlots) {
        super(String.format("Slot(s) %s at venue %s on %s are no longer available", conflictingSlots, venueId, date),
                "SLOT_CONFLICT");
        this.conflictingSlots = List.copyOf(conflictingSlots);
    }
}
