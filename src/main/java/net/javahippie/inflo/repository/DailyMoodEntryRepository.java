package net.javahippie.inflo.repository;

import net.javahippie.inflo.model.entity.DailyMoodEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Repository
public interface DailyMoodEntryRepository extends JpaRepository<DailyMoodEntry, UUID> {

    List<DailyMoodEntry> findByUserIdAndInterventionPeriodIdOrderByEntryDateAsc(UUID userId, UUID interventionPeriodId);

    List<DailyMoodEntry> findByUserIdAndEntryDateBetweenOrderByEntryDateAsc(
            UUID userId,
            LocalDate startDate,
            LocalDate endDate
    );
}
