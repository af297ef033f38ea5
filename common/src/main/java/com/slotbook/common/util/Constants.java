package com.slotbook.common.util;

/**
 * Constants shared by the booking and payment services.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String CACHE_AVAILABILITY_PREFIX = "venue:availability:";

    /** Separator of the legacy delimited slot string, e.g. "10:00 - 11:00 - 12:00". */
    public static final String SLOT_DELIMITER = " - ";

    /** Processor metadata key carrying the booking reference of an order. */
    public static final String BOOKING_ID_NOTE = "bookingId";

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
}
