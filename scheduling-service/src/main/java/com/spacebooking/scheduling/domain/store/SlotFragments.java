package com.spacebooking.scheduling.domain.store;

import com.spacebooking.common.exception.BusinessException;
import com.spacebooking.scheduling.domain.interval.TimeInterval;
import com.spacebooking.scheduling.domain.model.Slot;
import com.spacebooking.scheduling.domain.model.SlotStatus;
import com.spacebooking.scheduling.exception.StaleSlotException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Cuts free slots down to a requested interval and joins the pieces again once they are free.
 * <p>
 * Callers hold the (resource, day) exclusion. Every write goes through the version-checked store operations,
 * so a slot changed behind the caller's back surfaces as {@link StaleSlotException} or a skipped piece.
 */
public final class SlotFragments {

    private SlotFragments() {
    }

    /**
     * Narrows an AVAILABLE slot to its part inside {@code interval}. Time outside the interval stays
     * AVAILABLE as separate pieces of the same lineage.
     *
     * @return the piece inside {@code interval}, as stored
     */
    public static Slot carve(SlotStore store, Slot slot, TimeInterval interval) {
        Slot piece = slot;
        if (piece.getStartMinute() < interval.startMinute()) {
            piece = store.split(piece, interval.startMinute()).get(1);
        }
        if (piece.getEndMinute() > interval.endMinute()) {
            piece = store.split(piece, interval.endMinute()).get(0);
        }
        return piece;
    }

    /**
     * Joins touching AVAILABLE pieces of the given lineages back into one slot per run.
     *
     * @return the number of pieces absorbed into a neighbour
     */
    public static int rejoin(SlotStore store, String resourceId, LocalDate date, Collection<Long> lineages) {
        List<Slot> pieces = store.get(resourceId, date).stream()
                .filter(SlotFragments::isFreeSupply)
                .filter(slot -> lineages.contains(slot.lineageId()))
                .toList();
        int absorbed = 0;
        List<Slot> run = new ArrayList<>();
        for (Slot piece : pieces) {
            if (!run.isEmpty() && !continues(run.get(run.size() - 1), piece)) {
                absorbed += absorbRun(store, run);
                run = new ArrayList<>();
            }
            run.add(piece);
        }
        return absorbed + absorbRun(store, run);
    }

    /**
     * Removes {@code absorbed}, touching free slots that follow {@code survivor} in start order, and stretches
     * {@code survivor} over the time they covered. Stops at the first slot that changed, so covered time is
     * never dropped.
     *
     * @return the number of slots removed
     * @throws StaleSlotException if the survivor changed after neighbours were removed; the caller's
     *                            transaction must roll back
     */
    public static int absorb(SlotStore store, Slot survivor, List<Slot> absorbed) {
        int removed = 0;
        int end = survivor.getEndMinute();
        for (Slot slot : absorbed) {
            if (slot.getStartMinute() != end || !store.removeIfUnchanged(slot)) {
                break;
            }
            removed++;
            end = slot.getEndMinute();
        }
        if (removed > 0 && !store.resizeIfUnchanged(survivor, end)) {
            throw new StaleSlotException(String.format(
                    "Slot %d changed after %d neighbour(s) were absorbed into it", survivor.getId(), removed));
        }
        return removed;
    }

    static void requireInside(Slot slot, int atMinute) {
        if (atMinute <= slot.getStartMinute() || atMinute >= slot.getEndMinute()) {
            throw new IllegalArgumentException(String.format("Cannot split slot %d [%d, %d) at minute %d",
                    slot.getId(), slot.getStartMinute(), slot.getEndMinute(), atMinute));
        }
    }

    static void requireSameStatus(Slot current, Slot replacement) {
        if (current.getStatus() != replacement.getStatus()) {
            throw new BusinessException(String.format("Slot %d cannot move from %s to %s outside a transition",
                    current.getId(), current.getStatus(), replacement.getStatus()), "ILLEGAL_SLOT_TRANSITION");
        }
    }

    private static int absorbRun(SlotStore store, List<Slot> run) {
        if (run.size() < 2) {
            return 0;
        }
        return absorb(store, run.get(0), run.subList(1, run.size()));
    }

    private static boolean continues(Slot left, Slot right) {
        return left.getEndMinute().equals(right.getStartMinute())
                && Objects.equals(left.lineageId(), right.lineageId());
    }

    private static boolean isFreeSupply(Slot slot) {
        return slot.getStatus() == SlotStatus.AVAILABLE && slot.getBookingRef() == null;
    }
}
