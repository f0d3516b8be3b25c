package com.spacebooking.scheduling.domain.strategy;

import com.spacebooking.scheduling.domain.model.SlotDayGuard;
import com.spacebooking.scheduling.domain.repository.SlotDayGuardRepository;
import com.spacebooking.scheduling.exception.StaleSlotException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.function.Supplier;

/**
 * Database-level exclusion: row lock (SELECT FOR UPDATE) on the day's guard row.
 * <p>
 * Flow:
 * 1. Make sure the guard row exists (own transaction, concurrent creators tolerated)
 * 2. Open a transaction and lock the guard row
 * 3. Run the work inside that transaction
 * 4. Commit (releases the row lock)
 */
@Slf4j
@Component("pessimistic")
@ConditionalOnProperty(name = "scheduling.slot-store", havingValue = "jpa", matchIfMissing = true)
public class PessimisticCommitLockStrategy implements CommitLockStrategy {

    private final SlotDayGuardRepository guardRepository;
    private final TransactionTemplate lockingTransaction;
    private final TransactionTemplate guardCreation;

    public PessimisticCommitLockStrategy(SlotDayGuardRepository guardRepository,
                                         PlatformTransactionManager transactionManager) {
        this.guardRepository = guardRepository;
        this.lockingTransaction = new TransactionTemplate(transactionManager);
        this.guardCreation = new TransactionTemplate(transactionManager);
        this.guardCreation.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public <T> T withExclusiveAccess(String resourceId, LocalDate date, Supplier<T> work) {
        ensureGuardExists(resourceId, date);
        try {
            return lockingTransaction.execute(status -> {
                guardRepository.findForUpdate(resourceId, date)
                        .orElseThrow(() -> new StaleSlotException(
                                "Guard row for " + resourceId + " on " + date + " disappeared"));
                log.debug("Locked guard row for resource {} on {}", resourceId, date);
                return work.get();
            });
        } catch (PessimisticLockingFailureException e) {
            throw new StaleSlotException("Timed out waiting for row lock on " + resourceId + " / " + date, e);
        }
    }

    @Override
    public String getStrategyType() {
        return "PESSIMISTIC_LOCK";
    }

    private void ensureGuardExists(String resourceId, LocalDate date) {
        try {
            guardCreation.executeWithoutResult(status -> {
                if (!guardRepository.existsByResourceIdAndGuardDate(resourceId, date)) {
                    guardRepository.saveAndFlush(SlotDayGuard.builder()
                            .resourceId(resourceId)
                            .guardDate(date)
                            .build());
                }
            });
        } catch (DataIntegrityViolationException e) {
            log.debug("Guard row for resource {} on {} created concurrently", resourceId, date);
        }
    }
}
