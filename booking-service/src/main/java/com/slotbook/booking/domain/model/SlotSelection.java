package com.slotbook.booking.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * A customer's in-progress choice of slots for one venue and date. Always empty or a
 * contiguous run. Advisory only: the reservation ledger validates the final set again.
 */
public final class SlotSelection {

    public static final String NOT_CONSECUTIVE = "Only consecutive hours can be selected";
    public static final String NOT_AVAILABLE = "Slot is not available";

    private final OperatingDay day;
    private final List<SlotLabel> slots;

    private SlotSelection(OperatingDay day, List<SlotLabel> slots) {
        this.day = day;
        this.slots = List.copyOf(slots);
    }

    public static SlotSelection empty(OperatingDay day) {
        return new SlotSelection(day, List.of());
    }

    /**
     * Restores a selection held by the client. Anything that is not a contiguous run within
     * operating hours is discarded.
     */
    public static SlotSelection of(OperatingDay day, Collection<SlotLabel> slots) {
        if (slots.isEmpty() || !day.isContiguous(slots)) {
            return empty(day);
        }
        return new SlotSelection(day, day.inOrder(slots));
    }

    public List<SlotLabel> slots() {
        return slots;
    }

    public boolean isEmpty() {
        return slots.isEmpty();
    }

    /**
     * Drops slots that are no longer available. If that opens a gap the selection is reset.
     */
    public SlotSelection retainAvailable(Set<SlotLabel> available) {
        List<SlotLabel> kept = slots.stream().filter(available::contains).toList();
        if (kept.size() == slots.size()) {
            return this;
        }
        return of(day, kept);
    }

    /**
     * Selects or deselects one slot.
     * <ul>
     *   <li>deselecting the first or last slot shrinks the run</li>
     *   <li>deselecting an interior slot clears the whole selection</li>
     *   <li>selecting is accepted only on an empty selection or directly next to either end</li>
     * </ul>
     */
    public Toggle toggle(SlotLabel slot, Set<SlotLabel> available) {
        if (slots.contains(slot)) {
            if (slot.equals(first()) || slot.equals(last())) {
                List<SlotLabel> remaining = new ArrayList<>(slots);
                remaining.remove(slot);
                return Toggle.accepted(new SlotSelection(day, remaining));
            }
            return Toggle.accepted(empty(day));
        }
        if (!day.contains(slot) || !available.contains(slot)) {
            return Toggle.rejected(this, NOT_AVAILABLE);
        }
        if (slots.isEmpty() || day.areAdjacent(slot, first()) || day.areAdjacent(slot, last())) {
            List<SlotLabel> extended = new ArrayList<>(slots);
            extended.add(slot);
            return Toggle.accepted(new SlotSelection(day, day.inOrder(extended)));
        }
        return Toggle.rejected(this, NOT_CONSECUTIVE);
    }

    private SlotLabel first() {
        return slots.get(0);
    }

    private SlotLabel last() {
        return slots.get(slots.size() - 1);
    }

    public record Toggle(SlotSelection selection, boolean accepted, String message) {
        static Toggle accepted(SlotSelection selection) {
            return new Toggle(selection, true, null);
        }

        static Toggle rejected(SlotSelection selection, String message) {
            return new Toggle(selection, false, message);
        }
    }
}
