package com.spacebooking.scheduling.domain.service;

import com.spacebooking.common.exception.BusinessException;
import com.spacebooking.scheduling.domain.model.OperatingHours;
import com.spacebooking.scheduling.domain.model.RecurringFrequency;
import com.spacebooking.scheduling.domain.model.RecurringPattern;
import com.spacebooking.scheduling.domain.model.Slot;
import com.spacebooking.scheduling.domain.model.SlotGenerationOptions;
import com.spacebooking.scheduling.domain.model.SlotStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Unit tests for {@link SlotGenerator}: layout within operating hours, closed days and recurrence rules.
 */
class SlotGeneratorTest {

    private static final String RESOURCE = "room-1";
    // Monday
    private static final LocalDate MONDAY = LocalDate.of(2026, 3, 2);

    private final SlotGenerator generator = new SlotGenerator();

    @Test
    @DisplayName("generate lays out duration + break blocks from opening time, last block ending by closing")
    void generate_laysOutBlocksWithinHours() {
        List<Slot> slots = generator.generate(RESOURCE, MONDAY, MONDAY,
                day -> Optional.of(OperatingHours.of("09:00", "12:00")),
                new SlotGenerationOptions(60, 15, 12));

        assertThat(slots).extracting(Slot::getStartMinute, Slot::getEndMinute).containsExactly(
                tuple(540, 600),
                tuple(615, 675));
        assertThat(slots).allSatisfy(slot -> {
            assertThat(slot.getId()).isNull();
            assertThat(slot.getStatus()).isEqualTo(SlotStatus.AVAILABLE);
            assertThat(slot.getResourceId()).isEqualTo(RESOURCE);
        });
    }

    @Test
    @DisplayName("generate stops at maxSlotsPerDay and skips closed days")
    void generate_respectsCapAndClosedDays() {
        List<Slot> slots = generator.generate(RESOURCE, MONDAY, MONDAY.plusDays(6),
                day -> day.getDayOfWeek() == DayOfWeek.SUNDAY
                        ? Optional.empty()
                        : Optional.of(OperatingHours.of("08:00", "20:00")),
                new SlotGenerationOptions(30, 0, 4));

        assertThat(slots).hasSize(6 * 4);
        assertThat(slots).noneMatch(slot -> slot.getSlotDate().getDayOfWeek() == DayOfWeek.SUNDAY);
    }

    @Test
    @DisplayName("generate clamps a 24:00 closing to the last minute of the day")
    void generate_clampsMidnightClosing() {
        List<Slot> slots = generator.generate(RESOURCE, MONDAY, MONDAY,
                day -> Optional.of(OperatingHours.of("22:00", "24:00")),
                new SlotGenerationOptions(60, 0, 12));

        assertThat(slots).extracting(Slot::getStartMinute, Slot::getEndMinute)
                .containsExactly(tuple(1320, 1380));
    }

    @Test
    @DisplayName("generate rejects an end date before the start date")
    void generate_rejectsReversedRange() {
        assertThatThrownBy(() -> generator.generate(RESOURCE, MONDAY, MONDAY.minusDays(1),
                day -> Optional.empty(), SlotGenerationOptions.defaults()))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("Invalid date range");
    }

    @Test
    @DisplayName("daily recurrence every 2 days")
    void generateRecurring_daily() {
        List<Slot> slots = generator.generateRecurring(RESOURCE, MONDAY, MONDAY.plusDays(6), 540, 600,
                new RecurringPattern(RecurringFrequency.DAILY, 2, null));

        assertThat(slots).extracting(Slot::getSlotDate)
                .containsExactly(MONDAY, MONDAY.plusDays(2), MONDAY.plusDays(4), MONDAY.plusDays(6));
        assertThat(slots).allSatisfy(slot -> assertThat(slot.getRecurring()).isNotNull());
    }

    @Test
    @DisplayName("weekly recurrence on Monday and Wednesday every other week")
    void generateRecurring_weeklyOnDays() {
        List<Slot> slots = generator.generateRecurring(RESOURCE, MONDAY, MONDAY.plusDays(20), 540, 600,
                new RecurringPattern(RecurringFrequency.WEEKLY, 2, Set.of(1, 3)));

        assertThat(slots).extracting(Slot::getSlotDate).containsExactly(
                MONDAY, MONDAY.plusDays(2),
                MONDAY.plusDays(14), MONDAY.plusDays(16));
    }

    @Test
    @DisplayName("weekly recurrence without days repeats on the start weekday")
    void generateRecurring_weeklyWithoutDays() {
        List<Slot> slots = generator.generateRecurring(RESOURCE, MONDAY, MONDAY.plusDays(15), 540, 600,
                new RecurringPattern(RecurringFrequency.WEEKLY, 1, Set.of()));

        assertThat(slots).extracting(Slot::getSlotDate)
                .containsExactly(MONDAY, MONDAY.plusWeeks(1), MONDAY.plusWeeks(2));
    }

    @Test
    @DisplayName("monthly recurrence clamps to the last day of shorter months")
    void generateRecurring_monthly() {
        LocalDate start = LocalDate.of(2026, 1, 31);

        List<Slot> slots = generator.generateRecurring(RESOURCE, start, LocalDate.of(2026, 4, 30), 540, 600,
                new RecurringPattern(RecurringFrequency.MONTHLY, 1, null));

        assertThat(slots).extracting(Slot::getSlotDate).containsExactly(
                LocalDate.of(2026, 1, 31),
                LocalDate.of(2026, 2, 28),
                LocalDate.of(2026, 3, 31),
                LocalDate.of(2026, 4, 30));
    }

    @Test
    @DisplayName("dayIndex numbers Sunday as 0 and Saturday as 6")
    void dayIndex_sundayFirst() {
        assertThat(SlotGenerator.dayIndex(MONDAY.minusDays(1))).isZero();
        assertThat(SlotGenerator.dayIndex(MONDAY)).isEqualTo(1);
        assertThat(SlotGenerator.dayIndex(MONDAY.plusDays(5))).isEqualTo(6);
    }

    @Test
    @DisplayName("recurrence rules reject intervals below 1 and unknown weekdays")
    void recurringPattern_validates() {
        assertThatThrownBy(() -> new RecurringPattern(RecurringFrequency.DAILY, 0, null))
                .isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> new RecurringPattern(RecurringFrequency.WEEKLY, 1, Set.of(7)))
                .isInstanceOf(BusinessException.class);
    }
}
