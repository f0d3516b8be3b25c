package com.spacebooking.scheduling.domain.strategy;

import java.time.LocalDate;
import java.util.function.Supplier;

/**
 * Mutual exclusion for writers of one (resource, day).
 * <p>
 * Implementations (bean names):
 * - local: in-process ReentrantLock per key
 * - distributed: Redisson RLock shared by all service instances
 * - pessimistic: SELECT ... FOR UPDATE on a per-day guard row
 * <p>
 * When the exclusion cannot be obtained within the configured wait, implementations throw
 * {@link com.spacebooking.scheduling.exception.StaleSlotException} so the caller retries.
 */
public interface CommitLockStrategy {

    /**
     * Runs {@code work} while holding the exclusion for {@code (resourceId, date)}.
     * The exclusion is released after {@code work} returns or throws.
     */
    <T> T withExclusiveAccess(String resourceId, LocalDate date, Supplier<T> work);

    /**
     * @return Strategy type (LOCAL_LOCK, DISTRIBUTED_LOCK, PESSIMISTIC_LOCK)
     */
    String getStrategyType();
}
