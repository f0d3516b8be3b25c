package com.spacebooking.scheduling.domain.store;

import com.spacebooking.scheduling.domain.interval.TimeInterval;
import com.spacebooking.scheduling.domain.model.Slot;
import com.spacebooking.scheduling.domain.model.SlotStatus;
import com.spacebooking.scheduling.domain.model.SlotTransition;
import com.spacebooking.scheduling.exception.StaleSlotException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class SlotFragmentsTest {

    private static final String RESOURCE = "room-1";
    private static final LocalDate DAY = LocalDate.of(2026, 3, 2);

    private InMemorySlotStore store;

    @BeforeEach
    void setUp() {
        store = new InMemorySlotStore();
    }

    @Test
    @DisplayName("carve returns only the part inside the interval")
    void carve_narrowsToInterval() {
        Slot stored = store.upsert(slot(480, 720));

        Slot piece = SlotFragments.carve(store, stored, TimeInterval.of(DAY, "09:00", "10:00"));

        assertThat(piece.getStartMinute()).isEqualTo(540);
        assertThat(piece.getEndMinute()).isEqualTo(600);
        assertThat(store.get(RESOURCE, DAY)).extracting(Slot::getStartMinute, Slot::getEndMinute)
                .containsExactly(tuple(480, 540), tuple(540, 600), tuple(600, 720));
    }

    @Test
    @DisplayName("carve leaves a slot already inside the interval untouched")
    void carve_slotInsideInterval() {
        Slot stored = store.upsert(slot(540, 600));

        Slot piece = SlotFragments.carve(store, stored, TimeInterval.of(DAY, "08:00", "11:00"));

        assertThat(piece.getId()).isEqualTo(stored.getId());
        assertThat(piece.getVersion()).isZero();
    }

    @Test
    @DisplayName("rejoin merges free pieces of one lineage and ignores other slots")
    void rejoin_mergesOnlyOwnLineage() {
        Slot original = store.upsert(slot(480, 600));
        store.upsert(slot(600, 660));
        SlotFragments.carve(store, original, TimeInterval.of(DAY, "08:30", "09:00"));

        int absorbed = SlotFragments.rejoin(store, RESOURCE, DAY, Set.of(original.getId()));

        assertThat(absorbed).isEqualTo(2);
        assertThat(store.get(RESOURCE, DAY)).extracting(Slot::getStartMinute, Slot::getEndMinute)
                .containsExactly(tuple(480, 600), tuple(600, 660));
    }

    @Test
    @DisplayName("absorb stops at a neighbour that changed and stretches the survivor over what was removed")
    void absorb_stopsAtChangedNeighbour() {
        Slot survivor = store.upsert(slot(540, 600));
        Slot next = store.upsert(slot(600, 660));
        Slot last = store.upsert(slot(660, 720));
        store.transition(last, SlotTransition.toBusy("booking-1"));

        int removed = SlotFragments.absorb(store, survivor, List.of(next, last));

        assertThat(removed).isEqualTo(1);
        assertThat(store.get(RESOURCE, DAY))
                .extracting(Slot::getStartMinute, Slot::getEndMinute, Slot::getStatus)
                .containsExactly(
                        tuple(540, 660, SlotStatus.AVAILABLE),
                        tuple(660, 720, SlotStatus.BUSY));
    }

    @Test
    @DisplayName("absorb fails when the survivor changed after neighbours were removed")
    void absorb_changedSurvivorIsStale() {
        Slot survivor = store.upsert(slot(540, 600));
        Slot next = store.upsert(slot(600, 660));
        store.transition(survivor, SlotTransition.toMaintenance());

        assertThatThrownBy(() -> SlotFragments.absorb(store, survivor, List.of(next)))
                .isInstanceOf(StaleSlotException.class);
    }

    private static Slot slot(int start, int end) {
        return Slot.builder()
                .resourceId(RESOURCE)
                .slotDate(DAY)
                .startMinute(start)
                .endMinute(end)
                .status(SlotStatus.AVAILABLE)
                .build();
    }
}
