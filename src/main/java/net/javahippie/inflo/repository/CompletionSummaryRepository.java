package net.javahippie.inflo.repository;

import net.javahippie.inflo.model.entity.CompletionSummary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CompletionSummaryRepository extends JpaRepository<CompletionSummary, UUID> {

    /**
     * Find the summary written for a completed period.
     */
    Optional<CompletionSummary> findFirstByInterventionPeriodIdOrderByCreatedAtDesc(UUID interventionPeriodId);
}
