package com.slotbook.booking.domain.model;

import com.slotbook.common.exception.BusinessException;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Booking dates travel and are stored as plain {@code YYYY-MM-DD} text.
 */
public final class BookingDates {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private BookingDates() {
    }

    public static LocalDate parse(String date) {
        try {
            return LocalDate.parse(date, FORMAT);
        } catch (DateTimeParseException | NullPointerException e) {
            throw new BusinessException("Date must be in YYYY-MM-DD format: " + date, "INVALID_DATE");
        }
    }

    public static String format(LocalDate date) {
        return FORMAT.format(date);
    }
}
