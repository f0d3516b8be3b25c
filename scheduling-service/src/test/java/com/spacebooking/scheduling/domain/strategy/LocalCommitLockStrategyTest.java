package com.spacebooking.scheduling.domain.strategy;

import com.spacebooking.scheduling.exception.StaleSlotException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link LocalCommitLockStrategy}: mutual exclusion per (resource, day) and no lock entries left
 * behind once nobody uses them.
 */
class LocalCommitLockStrategyTest {

    private static final LocalDate DAY = LocalDate.of(2026, 3, 2);

    private LocalCommitLockStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new LocalCommitLockStrategy();
        ReflectionTestUtils.setField(strategy, "lockWaitMs", 2_000L);
    }

    @Test
    @DisplayName("a rolling horizon of days leaves no lock entries behind")
    void withExclusiveAccess_removesIdleEntries() {
        for (int offset = 0; offset < 30; offset++) {
            strategy.withExclusiveAccess("room-1", DAY.plusDays(offset), () -> "done");
        }

        assertThat(strategy.activeLockCount()).isZero();
    }

    @Test
    @DisplayName("failing work still releases and removes the entry")
    void withExclusiveAccess_failingWork() {
        assertThatThrownBy(() -> strategy.withExclusiveAccess("room-1", DAY, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(strategy.activeLockCount()).isZero();
    }

    @Test
    @DisplayName("nested use on the same thread is reentrant and cleans up once")
    void withExclusiveAccess_reentrant() {
        String result = strategy.withExclusiveAccess("room-1", DAY,
                () -> strategy.withExclusiveAccess("room-1", DAY, () -> {
                    assertThat(strategy.activeLockCount()).isEqualTo(1);
                    return "inner";
                }));

        assertThat(result).isEqualTo("inner");
        assertThat(strategy.activeLockCount()).isZero();
    }

    @Test
    @DisplayName("a waiter that times out gets StaleSlotException and the entry is still cleaned up")
    void withExclusiveAccess_timeout() throws Exception {
        ReflectionTestUtils.setField(strategy, "lockWaitMs", 50L);
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<String> holder = executor.submit(() -> strategy.withExclusiveAccess("room-1", DAY, () -> {
                held.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "holder";
            }));
            assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> strategy.withExclusiveAccess("room-1", DAY, () -> "waiter"))
                    .isInstanceOf(StaleSlotException.class);

            release.countDown();
            assertThat(holder.get(5, TimeUnit.SECONDS)).isEqualTo("holder");
            assertThat(strategy.activeLockCount()).isZero();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("concurrent callers on one day run one at a time and leave the map empty")
    void withExclusiveAccess_serializesSameDay() throws Exception {
        int threads = 8;
        int rounds = 200;
        int[] counter = {0};
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int round = 0; round < rounds; round++) {
                        strategy.withExclusiveAccess("room-1", DAY, () -> counter[0]++);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }

            assertThat(counter[0]).isEqualTo(threads * rounds);
            assertThat(strategy.activeLockCount()).isZero();
        } finally {
            executor.shutdownNow();
        }
    }
}
