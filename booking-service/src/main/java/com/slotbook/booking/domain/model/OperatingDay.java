package com.slotbook.booking.domain.model;

import com.slotbook.common.exception.BusinessException;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered hourly slots of a venue, from the first whole hour after opening up to (excluding) the closing hour.
 * A closing time at or before the opening time means the venue closes after midnight, so
 * 18:00-02:00 yields 18:00 ... 23:00, 00:00, 01:00. Adjacency is measured on this order.
 */
public final class OperatingDay {

    private static final int MINUTES_PER_DAY = 24 * 60;

    private final List<SlotLabel> slots;
    private final Map<SlotLabel, Integer> positions;

    private OperatingDay(List<SlotLabel> slots) {
        this.slots = Collections.unmodifiableList(slots);
        this.positions = new HashMap<>();
        for (int i = 0; i < slots.size(); i++) {
            positions.put(slots.get(i), i);
        }
    }

    /**
     * Whole hours that start at or after {@code opening} and end by {@code closing}. A closing time
     * at or before the opening time belongs to the next day.
     */
    public static OperatingDay between(LocalTime opening, LocalTime closing) {
        int openMinute = opening.toSecondOfDay() / 60 + (opening.toSecondOfDay() % 60 == 0 ? 0 : 1);
        int closeMinute = closing.toSecondOfDay() / 60;
        if (closing.toSecondOfDay() <= opening.toSecondOfDay()) {
            closeMinute += MINUTES_PER_DAY;
        }
        int firstHour = Math.floorDiv(openMinute + 59, 60);
        int endHour = Math.floorDiv(closeMinute, 60);
        List<SlotLabel> slots = new ArrayList<>(Math.max(0, endHour - firstHour));
        for (int h = firstHour; h < endHour; h++) {
            slots.add(SlotLabel.ofHour(h % 24));
        }
        return new OperatingDay(slots);
    }

    public List<SlotLabel> slots() {
        return slots;
    }

    public boolean contains(SlotLabel slot) {
        return positions.containsKey(slot);
    }

    public int positionOf(SlotLabel slot) {
        Integer position = positions.get(slot);
        if (position == null) {
            throw new IllegalArgumentException("Slot " + slot + " is outside operating hours");
        }
        return position;
    }

    public boolean areAdjacent(SlotLabel a, SlotLabel b) {
        return contains(a) && contains(b) && Math.abs(positionOf(a) - positionOf(b)) == 1;
    }

    /** Sorts slots in operating-day order. Every slot must be within operating hours. */
    public List<SlotLabel> inOrder(Collection<SlotLabel> selection) {
        List<SlotLabel> ordered = new ArrayList<>(selection);
        ordered.sort(Comparator.comparingInt(this::positionOf));
        return ordered;
    }

    public boolean isContiguous(Collection<SlotLabel> selection) {
        if (selection.isEmpty() || !positions.keySet().containsAll(selection)
                || new HashSet<>(selection).size() != selection.size()) {
            return false;
        }
        List<SlotLabel> ordered = inOrder(selection);
        for (int i = 1; i < ordered.size(); i++) {
            if (positionOf(ordered.get(i)) != positionOf(ordered.get(i - 1)) + 1) {
                return false;
            }
        }
        return true;
    }

    /**
     * Validates a requested slot-set and returns it in operating-day order.
     *
     * @throws BusinessException with code {@code INVALID_SLOTS} when the set is empty, repeats a slot,
     *                           falls outside operating hours or has a gap
     */
    public List<SlotLabel> requireContiguousRun(Collection<SlotLabel> selection) {
        if (selection.isEmpty()) {
            throw new BusinessException("At least one slot must be selected", "INVALID_SLOTS");
        }
        Set<SlotLabel> unique = new HashSet<>(selection);
        if (unique.size() != selection.size()) {
            throw new BusinessException("Slots must not repeat", "INVALID_SLOTS");
        }
        List<SlotLabel> outside = selection.stream().filter(s -> !contains(s)).toList();
        if (!outside.isEmpty()) {
            throw new BusinessException("Slots " + outside + " are outside the venue's operating hours", "INVALID_SLOTS");
        }
        if (!isContiguous(selection)) {
            throw new BusinessException("Only consecutive hours can be booked", "INVALID_SLOTS");
        }
        return inOrder(selection);
    }
}
