package net.javahippie.inflo.integration;

import lombok.extern.slf4j.Slf4j;
import net.javahippie.inflo.config.TestcontainersConfiguration;
import net.javahippie.inflo.model.dto.CompletionResult;
import net.javahippie.inflo.model.dto.SweepResult;
import net.javahippie.inflo.model.entity.CompletionSummary;
import net.javahippie.inflo.model.entity.DailyMoodEntry;
import net.javahippie.inflo.model.entity.DailySummary;
import net.javahippie.inflo.model.entity.HabitStatus;
import net.javahippie.inflo.model.entity.InterventionPeriod;
import net.javahippie.inflo.model.entity.Notification;
import net.javahippie.inflo.model.entity.PeriodStatus;
import net.javahippie.inflo.model.entity.UserHabit;
import net.javahippie.inflo.repository.CompletionSummaryRepository;
import net.javahippie.inflo.repository.DailyMoodEntryRepository;
import net.javahippie.inflo.repository.DailySummaryRepository;
import net.javahippie.inflo.repository.InterventionPeriodRepository;
import net.javahippie.inflo.repository.NotificationRepository;
import net.javahippie.inflo.repository.UserHabitRepository;
import net.javahippie.inflo.scheduler.InterventionAutoCompletionScheduler;
import net.javahippie.inflo.service.InterventionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the completion pipeline against PostgreSQL.
 * Not transactional: every repository write commits on its own, as it does in production.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestcontainersConfiguration.class)
@Testcontainers(disabledWithoutDocker = true)
@Slf4j
class InterventionCompletionIntegrationTest {

    @Autowired
    private InterventionService interventionService;

    @Autowired
    private InterventionAutoCompletionScheduler scheduler;

    @Autowired
    private InterventionPeriodRepository periodRepository;

    @Autowired
    private UserHabitRepository userHabitRepository;

    @Autowired
    private DailySummaryRepository dailySummaryRepository;

    @Autowired
    private DailyMoodEntryRepository dailyMoodEntryRepository;

    @Autowired
    private CompletionSummaryRepository completionSummaryRepository;

    @Autowired
    private NotificationRepository notificationRepository;

    private UUID userId;

    @BeforeEach
    void setUp() {
        notificationRepository.deleteAll();
        completionSummaryRepository.deleteAll();
        dailyMoodEntryRepository.deleteAll();
        dailySummaryRepository.deleteAll();
        userHabitRepository.deleteAll();
        periodRepository.deleteAll();
        userId = UUID.randomUUID();
    }

    @Test
    @DisplayName("Completing twice should run the side effects once")
    void testComplete_Idempotent() {
        // Given
        LocalDate start = LocalDate.now().minusDays(6);
        InterventionPeriod period = savePeriod("Mindful Mornings", start, LocalDate.now(), PeriodStatus.ACTIVE,
            List.of("Meditate", "Journal"));
        saveHabit("Meditate", HabitStatus.ACTIVE);
        saveHabit("Journal", HabitStatus.ACTIVE);
        saveHabit("Stretch", HabitStatus.ACTIVE);
        for (int i = 0; i < 7; i++) {
            saveDay(period, start.plusDays(i), 100, 2 + i / 4);
        }

        // When
        CompletionResult first = interventionService.complete(period.getId(), "Loved it");
        CompletionResult second = interventionService.complete(period.getId(), "Again");

        // Then
        assertTrue(first.isSuccess());
        assertFalse(first.hasListenerFailures(), () -> "Listener failures: " + first.getListenerResults());
        assertTrue(second.isAlreadyCompleted());

        InterventionPeriod stored = periodRepository.findById(period.getId()).orElseThrow();
        assertEquals(PeriodStatus.COMPLETED, stored.getStatus());
        assertNotNull(stored.getActualEndDate());
        assertEquals("Loved it", stored.getNotes());

        assertEquals(HabitStatus.COMPLETED, habitStatus("Meditate"));
        assertEquals(HabitStatus.COMPLETED, habitStatus("Journal"));
        assertEquals(HabitStatus.ACTIVE, habitStatus("Stretch"));

        List<Notification> notifications =
            notificationRepository.findByUserIdAndType(userId, Notification.TYPE_INTERVENTION_COMPLETED);
        assertEquals(1, notifications.size());
        assertEquals("You've completed your Mindful Mornings journey!", notifications.get(0).getBody());
        assertEquals(1, notificationRepository.countUnreadByUserId(userId));

        CompletionSummary summary = interventionService.getCompletionSummary(period.getId()).orElseThrow();
        assertEquals(0, new BigDecimal("100.00").compareTo(summary.getAdherenceRate()));
        assertEquals(7, ((Number) summary.getSummaryJson().get("longest_streak")).intValue());
        assertEquals(1, completionSummaryRepository.count());
    }

    @Test
    @DisplayName("Sweep should only auto-complete active periods that have expired")
    void testSweep_SelectsExpiredActivePeriods() {
        // Given
        LocalDate today = LocalDate.now();
        InterventionPeriod expired = savePeriod("Expired", today.minusDays(30), today.minusDays(1),
            PeriodStatus.ACTIVE, List.of());
        InterventionPeriod running = savePeriod("Running", today.minusDays(5), today.plusDays(1),
            PeriodStatus.ACTIVE, List.of());
        savePeriod("Done", today.minusDays(30), today.minusDays(1), PeriodStatus.COMPLETED, List.of());

        // When
        SweepResult result = scheduler.sweep();

        // Then
        assertEquals(1, result.getFoundCount());
        assertEquals(1, result.getCompletedCount());
        assertEquals(expired.getId(), result.getCompleted().get(0).getPeriodId());

        InterventionPeriod storedExpired = periodRepository.findById(expired.getId()).orElseThrow();
        assertEquals(PeriodStatus.COMPLETED, storedExpired.getStatus());
        assertEquals("Auto-completed: period expired", storedExpired.getNotes());
        assertEquals("test-instance", storedExpired.getClaimedBy());
        assertEquals(PeriodStatus.ACTIVE, periodRepository.findById(running.getId()).orElseThrow().getStatus());

        Notification notification =
            notificationRepository.findByUserIdAndType(userId, Notification.TYPE_INTERVENTION_COMPLETED).get(0);
        assertEquals("Intervention Period Ended", notification.getTitle());
        assertEquals(true, notification.getData().get("auto_completed"));
    }

    @Test
    @DisplayName("A second sweep should find nothing left to do")
    void testSweep_Rerun() {
        LocalDate today = LocalDate.now();
        savePeriod("Expired", today.minusDays(14), today, PeriodStatus.ACTIVE, List.of());

        SweepResult first = scheduler.sweep();
        SweepResult second = scheduler.sweep();

        assertEquals(1, first.getCompletedCount());
        assertEquals(0, second.getFoundCount());
        assertEquals(1, notificationRepository.count());
    }

    @Test
    @DisplayName("Active period lookup should ignore completed periods")
    void testGetActivePeriod() {
        LocalDate today = LocalDate.now();
        savePeriod("Old", today.minusDays(60), today.minusDays(30), PeriodStatus.COMPLETED, List.of());
        InterventionPeriod current = savePeriod("Current", today, today.plusDays(28), PeriodStatus.ACTIVE,
            List.of("Walk"));

        InterventionPeriod found = interventionService.getActivePeriod(userId).orElseThrow();

        assertEquals(current.getId(), found.getId());
        assertEquals(List.of("Walk"), found.getSelectedHabits());
        assertEquals(2, interventionService.getUserPeriods(userId).size());
    }

    private InterventionPeriod savePeriod(String name, LocalDate start, LocalDate plannedEnd,
                                          PeriodStatus status, List<String> habits) {
        return periodRepository.save(InterventionPeriod.builder()
            .userId(userId)
            .interventionName(name)
            .selectedHabits(new ArrayList<>(habits))
            .startDate(start)
            .plannedEndDate(plannedEnd)
            .status(status)
            .build());
    }

    private void saveHabit(String name, HabitStatus status) {
        userHabitRepository.save(UserHabit.builder()
            .userId(userId)
            .habitName(name)
            .status(status)
            .build());
    }

    private void saveDay(InterventionPeriod period, LocalDate date, int percentage, int mood) {
        dailySummaryRepository.save(DailySummary.builder()
            .userId(userId)
            .entryDate(date)
            .totalHabits(2)
            .completedHabits(percentage == 100 ? 2 : 1)
            .completionPercentage(BigDecimal.valueOf(percentage))
            .interventionPeriodId(period.getId())
            .build());
        dailyMoodEntryRepository.save(DailyMoodEntry.builder()
            .userId(userId)
            .entryDate(date)
            .mood(mood)
            .interventionPeriodId(period.getId())
            .build());
    }

    private HabitStatus habitStatus(String name) {
        return userHabitRepository.findByUserIdAndHabitName(userId, name).get(0).getStatus();
    }
}
