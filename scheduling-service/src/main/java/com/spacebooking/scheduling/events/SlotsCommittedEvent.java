package com.spacebooking.scheduling.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Published when an interval has been committed to a booking.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlotsCommittedEvent {
    private String resourceId;
    private LocalDate date;
    private String startTime;
    private String endTime;
    private String bookingId;
    private List<Long> slotIds;
    private Instant timestamp;
}
