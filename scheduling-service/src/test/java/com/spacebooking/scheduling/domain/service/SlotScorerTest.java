package com.spacebooking.scheduling.domain.service;

import com.spacebooking.scheduling.config.SchedulingProperties;
import com.spacebooking.scheduling.domain.interval.TimeInterval;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SlotScorerTest {

    private static final LocalDate DAY = LocalDate.of(2026, 3, 2);

    private final SchedulingProperties properties = new SchedulingProperties();
    private final SlotScorer scorer = new SlotScorer(properties);

    @Test
    @DisplayName("peak start hours earn the peak bonus, lunch hours lose the low-value penalty")
    void score_appliesHourWindows() {
        assertThat(scorer.score(TimeInterval.of(DAY, "08:00", "09:00"))).isEqualTo(50);
        assertThat(scorer.score(TimeInterval.of(DAY, "10:00", "11:00"))).isEqualTo(80);
        assertThat(scorer.score(TimeInterval.of(DAY, "12:30", "13:30"))).isEqualTo(30);
        // 14:00 sits in both windows
        assertThat(scorer.score(TimeInterval.of(DAY, "14:00", "15:00"))).isEqualTo(60);
    }

    @Test
    @DisplayName("long intervals earn the duration bonus")
    void score_longDurationBonus() {
        assertThat(scorer.score(TimeInterval.of(DAY, "09:00", "11:00"))).isEqualTo(95);
        assertThat(scorer.score(TimeInterval.of(DAY, "17:00", "18:59"))).isEqualTo(50);
    }

    @Test
    @DisplayName("weights and windows follow configuration")
    void score_usesConfiguredWeights() {
        properties.getScoring().setBaseScore(10);
        properties.getScoring().setPeakWindows(List.of(new SchedulingProperties.HourWindow(18, 19)));

        assertThat(scorer.isPeakHour(18)).isTrue();
        assertThat(scorer.isPeakHour(10)).isFalse();
        assertThat(scorer.score(TimeInterval.of(DAY, "18:00", "19:00"))).isEqualTo(40);
    }
}
