package com.spacebooking.scheduling.domain.service;

import com.spacebooking.scheduling.config.SchedulingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Keeps {@code scheduling.supply.horizon-days} of slots generated ahead for the configured resources.
 * Generation is gap-fill only, so each run just tops up days that entered the horizon.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlotSupplyJob {

    private final SlotSupplyService supplyService;
    private final SchedulingProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${scheduling.supply.cron:0 0 2 * * *}")
    public void replenishHorizon() {
        SchedulingProperties.Supply supply = properties.getSupply();
        if (!supply.isEnabled() || supply.getResources().isEmpty()) return;

        LocalDate today = LocalDate.now(clock);
        LocalDate until = today.plusDays(supply.getHorizonDays() - 1L);
        log.info("Slot supply: replenishing {} resource(s) until {}", supply.getResources().size(), until);
        for (String resourceId : supply.getResources()) {
            try {
                supplyService.generateSlots(resourceId, today, until, null);
            } catch (Exception e) {
                log.error("Slot supply failed for resource {}", resourceId, e);
            }
        }
    }
}
