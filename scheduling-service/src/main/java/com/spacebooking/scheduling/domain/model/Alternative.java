package com.spacebooking.scheduling.domain.model;

import com.spacebooking.scheduling.domain.interval.TimeInterval;

import java.time.LocalDate;

public record Alternative(LocalDate date, TimeInterval interval, int score, String reason) {
}
