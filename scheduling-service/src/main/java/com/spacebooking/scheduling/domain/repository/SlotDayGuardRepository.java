package com.spacebooking.scheduling.domain.repository;

import com.spacebooking.scheduling.domain.model.SlotDayGuard;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Optional;

public interface SlotDayGuardRepository extends JpaRepository<SlotDayGuard, Long> {

    boolean existsByResourceIdAndGuardDate(String resourceId, LocalDate guardDate);

    /**
     * SELECT ... FOR UPDATE on the guard row of one (resource, day). The lock is held until the
     * surrounding transaction ends; waiting is bounded by the lock timeout hint.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT g FROM SlotDayGuard g WHERE g.resourceId = :resourceId AND g.guardDate = :date")
    Optional<SlotDayGuard> findForUpdate(@Param("resourceId") String resourceId,
                                         @Param("date") LocalDate date);
}
