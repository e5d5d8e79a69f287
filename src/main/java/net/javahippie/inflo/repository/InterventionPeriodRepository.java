package net.javahippie.inflo.repository;

import net.javahippie.inflo.model.entity.InterventionPeriod;
import net.javahippie.inflo.model.entity.PeriodStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for InterventionPeriod entities.
 */
@Repository
public interface InterventionPeriodRepository extends JpaRepository<InterventionPeriod, UUID> {

    /**
     * Find all periods of a user, newest first.
     *
     * @param userId the user ID
     * @return list of periods
     */
    List<InterventionPeriod> findByUserIdOrderByCreatedAtDesc(UUID userId);

    /**
     * Find the most recently created period of a user in the given status.
     *
     * @param userId the user ID
     * @param status the status to match
     * @return the period, if any
     */
    Optional<InterventionPeriod> findFirstByUserIdAndStatusOrderByCreatedAtDesc(UUID userId, PeriodStatus status);

    /**
     * Find periods in the given status whose planned end date is on or before a date.
     *
     * @param status the status to match
     * @param date the cutoff date (inclusive)
     * @return list of periods, earliest planned end first
     */
    List<InterventionPeriod> findByStatusAndPlannedEndDateLessThanEqualOrderByPlannedEndDateAsc(
        PeriodStatus status,
        LocalDate date
    );

    /**
     * Mark a period as completed unless it already is.
     * The status check and the write happen in one statement, so of two concurrent callers only one sees 1.
     *
     * @param id the period ID
     * @param completedAt the actual end timestamp
     * @param notes completion notes to store
     * @return number of rows updated (0 if the period is missing or already completed)
     */
    default int markCompleted(UUID id, LocalDateTime completedAt, String notes) {
        return updateStatusUnlessAlready(id, PeriodStatus.COMPLETED, completedAt, notes);
    }

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE InterventionPeriod p SET p.status = :status, p.actualEndDate = :endedAt, " +
           "p.notes = :notes, p.updatedAt = :endedAt " +
           "WHERE p.id = :id AND p.status <> :status")
    int updateStatusUnlessAlready(@Param("id") UUID id,
                                  @Param("status") PeriodStatus status,
                                  @Param("endedAt") LocalDateTime endedAt,
                                  @Param("notes") String notes);

    /**
     * Claim an active period for auto-completion by one scheduler instance.
     * A claim older than {@code staleBefore} is considered abandoned and may be taken over.
     *
     * @param id the period ID
     * @param instanceId the claiming scheduler instance
     * @param claimedAt the claim timestamp
     * @param staleBefore claims made before this instant are expired
     * @return 1 if the claim was taken, 0 otherwise
     */
    default int claimForAutoCompletion(UUID id, String instanceId, LocalDateTime claimedAt, LocalDateTime staleBefore) {
        return claimInStatus(id, PeriodStatus.ACTIVE, instanceId, claimedAt, staleBefore);
    }

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE InterventionPeriod p SET p.claimedBy = :instanceId, p.claimedAt = :claimedAt " +
           "WHERE p.id = :id AND p.status = :status " +
           "AND (p.claimedAt IS NULL OR p.claimedAt < :staleBefore OR p.claimedBy = :instanceId)")
    int claimInStatus(@Param("id") UUID id,
                      @Param("status") PeriodStatus status,
                      @Param("instanceId") String instanceId,
                      @Param("claimedAt") LocalDateTime claimedAt,
                      @Param("staleBefore") LocalDateTime staleBefore);
}
