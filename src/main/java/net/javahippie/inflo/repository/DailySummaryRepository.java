package net.javahippie.inflo.repository;

import net.javahippie.inflo.model.entity.DailySummary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Repository
public interface DailySummaryRepository extends JpaRepository<DailySummary, UUID> {

    /**
     * Find daily summaries explicitly linked to an intervention period.
     */
    List<DailySummary> findByUserIdAndInterventionPeriodIdOrderByEntryDateAsc(UUID userId, UUID interventionPeriodId);

    /**
     * Find daily summaries for a user within a date range (both ends inclusive).
     */
    List<DailySummary> findByUserIdAndEntryDateBetweenOrderByEntryDateAsc(
            UUID userId,
            LocalDate startDate,
            LocalDate endDate
    );
}
