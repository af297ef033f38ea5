package com.slotbook.common.exception;

import lombok.Getter;

import java.util.List;

/**
 * Settlement lost: another booking already holds a paid claim on one of the slots.
 * The payment for the losing booking may already be captured, so callers must steer
 * the customer to a refund path.
 */
@Getter
public class SlotAlreadySoldException extends ConflictException {

    public static final String ERROR_CODE = "SLOT_ALREADY_SOLD";

    private final Long bookingId;
    private final List<String> slots;

    public SlotAlreadySoldException(Long bookingId, List<String> slots) {
        super(String.format("Slot(s) %s were booked by another customer before payment of booking %s completed. "
                + "Your payment will be refunded.", slots, bookingId), ERROR_CODE);
        this.bookingId = bookingId;
        this.slots = List.copyOf(slots);
    }

    /** Conflict reported by a remote booking-service, where only the message is known. */
    public SlotAlreadySoldException(String message) {
        super(message, ERROR_CODE);
        this.bookingId = null;
        this.slots = List.of();
    }

    public SlotAlreadySoldException(Long bookingId, List<String> slots, Throwable cause) {
        super(String.format("Slot(s) %s were booked by another customer before payment of booking %s completed. "
                + "Your payment will be refunded.", slots, bookingId), cause, ERROR_CODE);
        this.bookingId = bookingId;
        this.slots = List.copyOf(slots);
    }
}
