package com.spacebooking.scheduling.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlotsReleasedEvent {
    private String resourceId;
    private LocalDate date;
    private String bookingId;
    private List<Long> slotIds;
    private Instant timestamp;
}
