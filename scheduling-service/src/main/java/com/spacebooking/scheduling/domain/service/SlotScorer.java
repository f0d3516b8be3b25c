package com.spacebooking.scheduling.domain.service;

import com.spacebooking.scheduling.config.SchedulingProperties;
import com.spacebooking.scheduling.domain.interval.Intervals;
import com.spacebooking.scheduling.domain.interval.TimeInterval;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Desirability heuristic for a slot or proposed interval. All weights come from {@code scheduling.scoring}.
 */
@Component
@RequiredArgsConstructor
public class SlotScorer {

    private final SchedulingProperties properties;

    public int score(TimeInterval interval) {
        SchedulingProperties.Scoring scoring = properties.getScoring();
        int hour = interval.startHour();
        int score = scoring.getBaseScore();
        if (isPeakHour(hour)) {
            score += scoring.getPeakBonus();
        }
        if (isLowValueHour(hour)) {
            score -= scoring.getLowValuePenalty();
        }
        if (Intervals.duration(interval) >= scoring.getLongDurationMinutes()) {
            score += scoring.getLongDurationBonus();
        }
        return score;
    }

    public boolean isPeakHour(int hour) {
        return properties.getScoring().getPeakWindows().stream().anyMatch(window -> window.contains(hour));
    }

    public boolean isLowValueHour(int hour) {
        return properties.getScoring().getLowValueWindows().stream().anyMatch(window -> window.contains(hour));
    }
}
