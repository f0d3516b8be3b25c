package com.spacebooking.scheduling.domain.service;

import com.spacebooking.scheduling.domain.strategy.CommitLockStrategy;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs slot writes for one (resource, day) one at a time, each inside a transaction that commits
 * before the exclusion is released.
 * <p>
 * Spring injects every {@link CommitLockStrategy} keyed by bean name (local, distributed, pessimistic);
 * {@code scheduling.commit.lock-strategy} picks one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlotDayExclusion {

    private static final String DEFAULT_STRATEGY = "local";

    private final Map<String, CommitLockStrategy> lockStrategies;
    private final TransactionOperations transactionOperations;

    @Value("${scheduling.commit.lock-strategy:local}")
    private String strategyType;

    @PostConstruct
    public void init() {
        log.info("Slot writes serialized with strategy: {}", getLockStrategy().getStrategyType());
    }

    public <T> T execute(String resourceId, LocalDate date, Supplier<T> work) {
        return getLockStrategy().withExclusiveAccess(resourceId, date,
                () -> transactionOperations.execute(status -> work.get()));
    }

    CommitLockStrategy getLockStrategy() {
        CommitLockStrategy strategy = lockStrategies.get(strategyType.toLowerCase(Locale.ROOT));
        if (strategy == null) {
            log.warn("Unknown lock strategy: {}. Available strategies: {}. Defaulting to {}",
                    strategyType, lockStrategies.keySet(), DEFAULT_STRATEGY);
            strategy = lockStrategies.get(DEFAULT_STRATEGY);
            if (strategy == null) {
                throw new IllegalStateException(
                        DEFAULT_STRATEGY + " strategy not found. Available strategies: " + lockStrategies.keySet());
            }
        }
        return strategy;
    }
}
