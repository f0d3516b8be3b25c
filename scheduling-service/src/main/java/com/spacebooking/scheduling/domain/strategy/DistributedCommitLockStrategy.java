package com.spacebooking.scheduling.domain.strategy;

import com.spacebooking.common.exception.BusinessException;
import com.spacebooking.common.util.Constants;
import com.spacebooking.scheduling.exception.StaleSlotException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Redis lock (Redisson) on {@code lock:slots:{resourceId}:{date}}, shared by every service instance.
 * The lease bounds how long a crashed holder can block the day; the work must finish well within it.
 */
@Slf4j
@Component("distributed")
@RequiredArgsConstructor
public class DistributedCommitLockStrategy implements CommitLockStrategy {

    private final RedissonClient redissonClient;

    @Value("${scheduling.commit.lock-wait-ms:5000}")
    private long lockWaitMs;

    @Value("${scheduling.commit.lock-lease-ms:30000}")
    private long lockLeaseMs;

    @Override
    public <T> T withExclusiveAccess(String resourceId, LocalDate date, Supplier<T> work) {
        String lockKey = buildLockKey(resourceId, date);
        RLock lock = redissonClient.getLock(lockKey);

        try {
            boolean acquired = lock.tryLock(lockWaitMs, lockLeaseMs, TimeUnit.MILLISECONDS);
            if (!acquired) {
                throw new StaleSlotException("Unable to acquire distributed lock " + lockKey);
            }

            log.debug("Acquired distributed lock: {}", lockKey);
            return work.get();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException("Slot commit interrupted", e, "COMMIT_INTERRUPTED");
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Released distributed lock: {}", lockKey);
            }
        }
    }

    @Override
    public String getStrategyType() {
        return "DISTRIBUTED_LOCK";
    }

    private String buildLockKey(String resourceId, LocalDate date) {
        return Constants.LOCK_PREFIX + resourceId + ":" + date;
    }
}
