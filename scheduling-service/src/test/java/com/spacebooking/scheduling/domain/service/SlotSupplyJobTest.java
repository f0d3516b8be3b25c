package com.spacebooking.scheduling.domain.service;

import com.spacebooking.scheduling.config.SchedulingProperties;
import com.spacebooking.scheduling.exception.UpstreamUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class SlotSupplyJobTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T02:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate TODAY = LocalDate.of(2026, 3, 1);

    @Mock
    private SlotSupplyService supplyService;

    private SchedulingProperties properties;
    private SlotSupplyJob job;

    @BeforeEach
    void setUp() {
        properties = new SchedulingProperties();
        properties.getSupply().setHorizonDays(14);
        job = new SlotSupplyJob(supplyService, properties, CLOCK);
    }

    @Test
    @DisplayName("disabled: nothing is generated")
    void replenishHorizon_disabled() {
        properties.getSupply().setEnabled(false);
        properties.getSupply().setResources(List.of("room-1"));

        job.replenishHorizon();

        verifyNoInteractions(supplyService);
    }

    @Test
    @DisplayName("enabled: every configured resource is topped up from today through the horizon")
    void replenishHorizon_generatesHorizon() {
        properties.getSupply().setEnabled(true);
        properties.getSupply().setResources(List.of("room-1", "desk-7"));

        job.replenishHorizon();

        verify(supplyService).generateSlots("room-1", TODAY, TODAY.plusDays(13), null);
        verify(supplyService).generateSlots("desk-7", TODAY, TODAY.plusDays(13), null);
    }

    @Test
    @DisplayName("a failing resource does not stop the others")
    void replenishHorizon_continuesAfterFailure() {
        properties.getSupply().setEnabled(true);
        properties.getSupply().setResources(List.of("room-1", "desk-7"));
        given(supplyService.generateSlots(any(), any(), any(), any()))
                .willThrow(new UpstreamUnavailableException("resource-service down", null))
                .willReturn(List.of());

        job.replenishHorizon();

        verify(supplyService).generateSlots("desk-7", TODAY, TODAY.plusDays(13), null);
    }
}
