package com.slotbook.booking.domain.model;

import com.slotbook.common.exception.BusinessException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One-hour interval identified by its start time, written {@code HH:00}.
 */
public record SlotLabel(int hour) {

    private static final Pattern LABEL = Pattern.compile("^(\\d{2}):00$");

    public SlotLabel {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("Slot hour out of range: " + hour);
        }
    }

    public static SlotLabel ofHour(int hour) {
        return new SlotLabel(hour);
    }

    public static SlotLabel parse(String label) {
        Matcher matcher = label == null ? null : LABEL.matcher(label.trim());
        if (matcher == null || !matcher.matches() || Integer.parseInt(matcher.group(1)) > 23) {
            throw new BusinessException("Invalid slot label '" + label + "', expected HH:00", "INVALID_SLOT");
        }
        return new SlotLabel(Integer.parseInt(matcher.group(1)));
    }

    public String label() {
        return String.format("%02d:00", hour);
    }

    @Override
    public String toString() {
        return label();
    }
}
