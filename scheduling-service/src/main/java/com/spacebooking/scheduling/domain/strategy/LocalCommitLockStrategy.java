package com.spacebooking.scheduling.domain.strategy;

import com.spacebooking.common.exception.BusinessException;
import com.spacebooking.common.util.Constants;
import com.spacebooking.scheduling.exception.StaleSlotException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process lock per (resource, day). Only correct while a single service instance writes slots.
 * <p>
 * An entry lives only while some thread holds or waits for it: each caller counts itself in before locking and
 * out afterwards, and the last one out removes the entry.
 */
@Slf4j
@Component("local")
public class LocalCommitLockStrategy implements CommitLockStrategy {

    private final Map<String, DayLock> locks = new ConcurrentHashMap<>();

    @Value("${scheduling.commit.lock-wait-ms:5000}")
    private long lockWaitMs;

    @Override
    public <T> T withExclusiveAccess(String resourceId, LocalDate date, Supplier<T> work) {
        String lockKey = Constants.LOCK_PREFIX + resourceId + ":" + date;
        DayLock dayLock = locks.compute(lockKey, (key, existing) -> {
            DayLock entry = existing != null ? existing : new DayLock();
            entry.users++;
            return entry;
        });
        try {
            return runLocked(lockKey, dayLock.lock, work);
        } finally {
            locks.computeIfPresent(lockKey, (key, entry) -> --entry.users == 0 ? null : entry);
        }
    }

    private <T> T runLocked(String lockKey, ReentrantLock lock, Supplier<T> work) {
        boolean acquired;
        try {
            acquired = lock.tryLock(lockWaitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException("Slot commit interrupted", e, "COMMIT_INTERRUPTED");
        }
        if (!acquired) {
            throw new StaleSlotException("Timed out waiting for local lock " + lockKey);
        }
        log.debug("Acquired local lock: {}", lockKey);
        try {
            return work.get();
        } finally {
            lock.unlock();
            log.debug("Released local lock: {}", lockKey);
        }
    }

    int activeLockCount() {
        return locks.size();
    }

    @Override
    public String getStrategyType() {
        return "LOCAL_LOCK";
    }

    /**
     * Lock plus the number of threads currently using it. {@code users} is only touched inside map compute calls.
     */
    private static final class DayLock {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
