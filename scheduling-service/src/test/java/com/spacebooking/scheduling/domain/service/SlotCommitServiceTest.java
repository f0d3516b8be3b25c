package com.spacebooking.scheduling.domain.service;

import com.spacebooking.common.exception.BusinessException;
import com.spacebooking.scheduling.domain.interval.TimeInterval;
import com.spacebooking.scheduling.domain.model.BookingStatus;
import com.spacebooking.scheduling.domain.model.CommitOutcome;
import com.spacebooking.scheduling.domain.model.Slot;
import com.spacebooking.scheduling.domain.model.SlotStatus;
import com.spacebooking.scheduling.domain.model.SlotTransition;
import com.spacebooking.scheduling.domain.store.InMemorySlotStore;
import com.spacebooking.scheduling.domain.store.SlotStore;
import com.spacebooking.scheduling.domain.strategy.CommitLockStrategy;
import com.spacebooking.scheduling.domain.strategy.LocalCommitLockStrategy;
import com.spacebooking.scheduling.events.SlotEventPublisher;
import com.spacebooking.scheduling.exception.CommitFailedException;
import com.spacebooking.scheduling.exception.StaleSlotException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.support.TransactionOperations;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Tests for {@link SlotCommitService} with the local lock strategy and the in-memory store:
 * commit/replay/release semantics, mutual exclusion under concurrency, and the stale-slot retry budget.
 */
@ExtendWith(MockitoExtension.class)
class SlotCommitServiceTest {

    private static final String RESOURCE = "room-1";
    private static final LocalDate DAY = LocalDate.of(2026, 3, 2);

    @Mock
    private SlotEventPublisher eventPublisher;

    private InMemorySlotStore store;
    private SlotCommitService service;

    @BeforeEach
    void setUp() {
        store = new InMemorySlotStore();
        service = newService(store);
    }

    @Test
    @DisplayName("commit turns overlapping free slots BUSY and publishes one event")
    void commit_marksFreeSlotsBusy() {
        store.upsert(slot(540, 600));
        store.upsert(slot(600, 660));

        CommitOutcome outcome = service.commit(RESOURCE, DAY, TimeInterval.of(DAY, "09:00", "11:00"), "booking-1");

        assertThat(outcome.isCommitted()).isTrue();
        assertThat(outcome.replayed()).isFalse();
        assertThat(outcome.conflictReport().canProceed()).isTrue();
        assertThat(outcome.slots()).extracting(Slot::getStatus).containsOnly(SlotStatus.BUSY);
        assertThat(store.findByBookingRef(RESOURCE, DAY, "booking-1")).hasSize(2);
        verify(eventPublisher).publishSlotsCommitted(eq(RESOURCE), any(), eq("booking-1"), anyList());
    }

    @Test
    @DisplayName("commit fills uncovered time with new BUSY slots")
    void commit_createsSlotsForGaps() {
        store.upsert(slot(600, 660));

        CommitOutcome outcome = service.commit(RESOURCE, DAY, TimeInterval.of(DAY, "09:30", "11:30"), "booking-1");

        assertThat(outcome.slots()).extracting(Slot::getStartMinute, Slot::getEndMinute)
                .containsExactly(
                        tuple(570, 600),
                        tuple(600, 660),
                        tuple(660, 690));
        assertThat(store.get(RESOURCE, DAY)).allSatisfy(slot -> {
            assertThat(slot.getStatus()).isEqualTo(SlotStatus.BUSY);
            assertThat(slot.getBookingRef()).isEqualTo("booking-1");
        });
    }

    @Test
    @DisplayName("two bookings take back-to-back halves of one free slot")
    void commit_splitsFreeSlotAtIntervalEdges() {
        store.upsert(slot(540, 600));

        CommitOutcome first = service.commit(RESOURCE, DAY, TimeInterval.of(DAY, "09:00", "09:30"), "booking-1");
        CommitOutcome second = service.commit(RESOURCE, DAY, TimeInterval.of(DAY, "09:30", "10:00"), "booking-2");

        assertThat(first.slots()).extracting(Slot::getStartMinute, Slot::getEndMinute)
                .containsExactly(tuple(540, 570));
        assertThat(second.isCommitted()).isTrue();
        assertThat(second.slots()).extracting(Slot::getStartMinute, Slot::getEndMinute)
                .containsExactly(tuple(570, 600));
        assertThat(store.get(RESOURCE, DAY))
                .extracting(Slot::getStartMinute, Slot::getEndMinute, Slot::getStatus, Slot::getBookingRef)
                .containsExactly(
                        tuple(540, 570, SlotStatus.BUSY, "booking-1"),
                        tuple(570, 600, SlotStatus.BUSY, "booking-2"));
    }

    @Test
    @DisplayName("a commit inside a long free slot leaves the time around it free")
    void commit_keepsRemaindersAvailable() {
        store.upsert(slot(480, 660));

        service.commit(RESOURCE, DAY, TimeInterval.of(DAY, "09:00", "10:00"), "booking-1");

        assertThat(store.get(RESOURCE, DAY))
                .extracting(Slot::getStartMinute, Slot::getEndMinute, Slot::getStatus)
                .containsExactly(
                        tuple(480, 540, SlotStatus.AVAILABLE),
                        tuple(540, 600, SlotStatus.BUSY),
                        tuple(600, 660, SlotStatus.AVAILABLE));
        assertThat(new ConflictDetector(store).checkConflicts(RESOURCE, DAY, TimeInterval.of(DAY, "10:00", "11:00"),
                null).canProceed()).isTrue();
    }

    @Test
    @DisplayName("release joins the freed piece back with the remainders it was cut from")
    void release_rejoinsSplitPieces() {
        store.upsert(slot(480, 660));
        TimeInterval interval = TimeInterval.of(DAY, "09:00", "10:00");
        service.commit(RESOURCE, DAY, interval, "booking-1");

        service.release(RESOURCE, DAY, interval, "booking-1");

        assertThat(store.get(RESOURCE, DAY)).singleElement().satisfies(slot -> {
            assertThat(slot.getStartMinute()).isEqualTo(480);
            assertThat(slot.getEndMinute()).isEqualTo(660);
            assertThat(slot.getStatus()).isEqualTo(SlotStatus.AVAILABLE);
        });
    }

    @Test
    @DisplayName("release never joins separately generated slots that merely touch")
    void release_keepsUnrelatedNeighboursApart() {
        store.upsert(slot(540, 600));
        store.upsert(slot(600, 660));
        TimeInterval interval = TimeInterval.of(DAY, "09:00", "10:00");
        service.commit(RESOURCE, DAY, interval, "booking-1");

        service.release(RESOURCE, DAY, interval, "booking-1");

        assertThat(store.get(RESOURCE, DAY)).extracting(Slot::getStartMinute, Slot::getEndMinute)
                .containsExactly(tuple(540, 600), tuple(600, 660));
    }

    @Test
    @DisplayName("repeating a commit for the same booking is a replay: nothing changes, no second event")
    void commit_isIdempotentPerBooking() {
        TimeInterval interval = TimeInterval.of(DAY, "09:00", "10:00");
        service.commit(RESOURCE, DAY, interval, "booking-1");

        CommitOutcome replay = service.commit(RESOURCE, DAY, interval, "booking-1");

        assertThat(replay.isCommitted()).isTrue();
        assertThat(replay.replayed()).isTrue();
        assertThat(store.get(RESOURCE, DAY)).hasSize(1);
        verify(eventPublisher, times(1)).publishSlotsCommitted(anyString(), any(), anyString(), anyList());
    }

    @Test
    @DisplayName("time held by another booking is refused with a conflict report")
    void commit_conflictWithOtherBooking() {
        service.commit(RESOURCE, DAY, TimeInterval.of(DAY, "09:00", "10:00"), "booking-1");

        CommitOutcome outcome = service.commit(RESOURCE, DAY, TimeInterval.of(DAY, "09:30", "10:30"), "booking-2");

        assertThat(outcome.isCommitted()).isFalse();
        assertThat(outcome.slots()).isEmpty();
        assertThat(outcome.conflictReport().conflicts()).hasSize(1);
        assertThat(store.findByBookingRef(RESOURCE, DAY, "booking-2")).isEmpty();
        verify(eventPublisher, never()).publishSlotsCommitted(anyString(), any(), eq("booking-2"), anyList());
    }

    @Test
    @DisplayName("concurrent commits of the same interval: exactly one booking wins")
    void commit_concurrentRequestsSingleWinner() throws Exception {
        store.upsert(slot(540, 600));
        TimeInterval interval = TimeInterval.of(DAY, "09:00", "10:00");
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<CommitOutcome>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < threads; i++) {
                String bookingId = "booking-" + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    return service.commit(RESOURCE, DAY, interval, bookingId);
                }));
            }
            start.countDown();

            int committed = 0;
            for (Future<CommitOutcome> future : futures) {
                if (future.get(10, TimeUnit.SECONDS).isCommitted()) {
                    committed++;
                }
            }

            assertThat(committed).isEqualTo(1);
            assertThat(store.get(RESOURCE, DAY)).singleElement()
                    .satisfies(slot -> assertThat(slot.getStatus()).isEqualTo(SlotStatus.BUSY));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("release frees the booking's slots and makes the time bookable again")
    void release_makesIntervalBookableAgain() {
        TimeInterval interval = TimeInterval.of(DAY, "09:00", "10:00");
        service.commit(RESOURCE, DAY, interval, "booking-1");

        List<Slot> released = service.release(RESOURCE, DAY, interval, "booking-1");
        CommitOutcome rebooked = service.commit(RESOURCE, DAY, interval, "booking-2");

        assertThat(released).singleElement()
                .satisfies(slot -> assertThat(slot.getStatus()).isEqualTo(SlotStatus.AVAILABLE));
        assertThat(rebooked.isCommitted()).isTrue();
        assertThat(rebooked.replayed()).isFalse();
        verify(eventPublisher).publishSlotsReleased(eq(RESOURCE), any(), eq("booking-1"), anyList());
    }

    @Test
    @DisplayName("releasing time the booking does not hold is a no-op")
    void release_nothingHeld() {
        service.commit(RESOURCE, DAY, TimeInterval.of(DAY, "09:00", "10:00"), "booking-1");

        List<Slot> released = service.release(RESOURCE, DAY, TimeInterval.of(DAY, "09:00", "10:00"), "booking-2");

        assertThat(released).isEmpty();
        assertThat(store.findByBookingRef(RESOURCE, DAY, "booking-1")).hasSize(1);
        verify(eventPublisher, never()).publishSlotsReleased(anyString(), any(), anyString(), anyList());
    }

    @Test
    @DisplayName("a cancelled booking stops blocking: its slots are released and the time can be booked")
    void applyBookingStatus_cancelledReleases() {
        TimeInterval interval = TimeInterval.of(DAY, "09:00", "10:00");
        service.commit(RESOURCE, DAY, interval, "booking-1");

        List<Slot> released = service.applyBookingStatus(RESOURCE, DAY, interval, "booking-1", BookingStatus.CANCELLED);

        assertThat(released).hasSize(1);
        assertThat(new ConflictDetector(store).checkConflicts(RESOURCE, DAY, interval, null).canProceed()).isTrue();
    }

    @Test
    @DisplayName("completed and no-show bookings keep their slots")
    void applyBookingStatus_occupyingStatusesKeepSlots() {
        TimeInterval interval = TimeInterval.of(DAY, "09:00", "10:00");
        service.commit(RESOURCE, DAY, interval, "booking-1");

        assertThat(service.applyBookingStatus(RESOURCE, DAY, interval, "booking-1", BookingStatus.COMPLETED)).isEmpty();
        assertThat(service.applyBookingStatus(RESOURCE, DAY, interval, "booking-1", BookingStatus.NO_SHOW)).isEmpty();
        assertThat(store.findByBookingRef(RESOURCE, DAY, "booking-1"))
                .extracting(Slot::getStatus).containsExactly(SlotStatus.BUSY);
    }

    @Test
    @DisplayName("a slot that keeps changing underneath: retried, then CommitFailedException")
    void commit_staleSlotExhaustsRetries() {
        SlotStore flakyStore = mock(SlotStore.class);
        Slot free = slot(540, 600).toBuilder().id(1L).version(0L).build();
        given(flakyStore.get(RESOURCE, DAY)).willReturn(List.of(free));
        given(flakyStore.transition(any(Slot.class), any(SlotTransition.class)))
                .willThrow(new StaleSlotException("Slot 1 changed"));
        SlotCommitService flakyService = newService(flakyStore);

        assertThatThrownBy(() -> flakyService.commit(RESOURCE, DAY, TimeInterval.of(DAY, "09:00", "10:00"), "b-1"))
                .isInstanceOf(CommitFailedException.class)
                .hasCauseInstanceOf(StaleSlotException.class);
        verify(flakyStore, times(3)).get(RESOURCE, DAY);
        verify(eventPublisher, never()).publishSlotsCommitted(anyString(), any(), anyString(), anyList());
    }

    @Test
    @DisplayName("a non-stale failure is not retried and surfaces unchanged")
    void commit_otherFailuresNotRetried() {
        SlotStore brokenStore = mock(SlotStore.class);
        given(brokenStore.get(RESOURCE, DAY)).willThrow(new BusinessException("Illegal move", "ILLEGAL_SLOT_TRANSITION"));
        SlotCommitService brokenService = newService(brokenStore);

        assertThatThrownBy(() -> brokenService.commit(RESOURCE, DAY, TimeInterval.of(DAY, "09:00", "10:00"), "b-1"))
                .isInstanceOf(BusinessException.class)
                .isNotInstanceOf(CommitFailedException.class)
                .hasFieldOrPropertyWithValue("errorCode", "ILLEGAL_SLOT_TRANSITION");
        verify(brokenStore, times(1)).get(RESOURCE, DAY);
    }

    @Test
    @DisplayName("a commit without booking id is rejected")
    void commit_requiresBookingId() {
        assertThatThrownBy(() -> service.commit(RESOURCE, DAY, TimeInterval.of(DAY, "09:00", "10:00"), " "))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", "BOOKING_ID_REQUIRED");
    }

    private SlotCommitService newService(SlotStore slotStore) {
        LocalCommitLockStrategy lockStrategy = new LocalCommitLockStrategy();
        ReflectionTestUtils.setField(lockStrategy, "lockWaitMs", 5_000L);
        Map<String, CommitLockStrategy> strategies = Map.of("local", lockStrategy);
        SlotDayExclusion exclusion = new SlotDayExclusion(strategies, TransactionOperations.withoutTransaction());
        ReflectionTestUtils.setField(exclusion, "strategyType", "local");

        SlotCommitService commitService = new SlotCommitService(
                exclusion, slotStore, new ConflictDetector(slotStore), eventPublisher);
        ReflectionTestUtils.setField(commitService, "maxAttempts", 3);
        ReflectionTestUtils.setField(commitService, "backoffInitialMs", 1L);
        ReflectionTestUtils.setField(commitService, "backoffMaxMs", 5L);
        commitService.init();
        return commitService;
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
