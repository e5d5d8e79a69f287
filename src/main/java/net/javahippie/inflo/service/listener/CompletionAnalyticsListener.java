package net.javahippie.inflo.service.listener;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.inflo.event.PeriodCompletedEvent;
import net.javahippie.inflo.exception.InterventionPeriodNotFoundException;
import net.javahippie.inflo.model.dto.CompletionAnalyticsResult;
import net.javahippie.inflo.model.dto.CompletionMetrics;
import net.javahippie.inflo.model.entity.CompletionSummary;
import net.javahippie.inflo.model.entity.DailyMoodEntry;
import net.javahippie.inflo.model.entity.DailySummary;
import net.javahippie.inflo.model.entity.InterventionPeriod;
import net.javahippie.inflo.repository.CompletionSummaryRepository;
import net.javahippie.inflo.repository.DailyMoodEntryRepository;
import net.javahippie.inflo.repository.DailySummaryRepository;
import net.javahippie.inflo.repository.InterventionPeriodRepository;
import net.javahippie.inflo.service.CompletionMetricsCalculator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Generates the analytics summary of a completed intervention period.
 *
 * Daily summaries and moods are looked up by their period link first. Rows written before period linking
 * existed carry no link, so when the linked lookup finds nothing (or the link column is unavailable) the
 * lookup falls back to the period's date range.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CompletionAnalyticsListener {

    private final InterventionPeriodRepository periodRepository;
    private final DailySummaryRepository dailySummaryRepository;
    private final DailyMoodEntryRepository dailyMoodEntryRepository;
    private final CompletionSummaryRepository completionSummaryRepository;
    private final CompletionMetricsCalculator metricsCalculator;
    private final Clock clock;

    /**
     * Handle a {@value PeriodCompletedEvent#TOPIC} event.
     * A failure to store the summary is reported as a warning; the computed metrics are still returned.
     *
     * @param payload the event payload
     * @return the computed metrics and whether they were stored
     */
    public CompletionAnalyticsResult onPeriodCompleted(Map<String, Object> payload) {
        PeriodCompletedEvent event = PeriodCompletedEvent.fromPayload(payload);
        UUID periodId = event.getPeriodId();
        UUID userId = event.getUserId();

        InterventionPeriod period = periodRepository.findById(periodId)
            .orElseThrow(() -> new InterventionPeriodNotFoundException(periodId));

        LocalDate startDate = period.getStartDate();
        LocalDate endDate = period.getPlannedEndDate() != null ? period.getPlannedEndDate() : LocalDate.now(clock);

        List<DailySummary> summaries = findForPeriod("daily summaries",
            () -> dailySummaryRepository.findByUserIdAndInterventionPeriodIdOrderByEntryDateAsc(userId, periodId),
            () -> dailySummaryRepository.findByUserIdAndEntryDateBetweenOrderByEntryDateAsc(userId, startDate, endDate));

        List<DailyMoodEntry> moods = findForPeriod("daily moods",
            () -> dailyMoodEntryRepository.findByUserIdAndInterventionPeriodIdOrderByEntryDateAsc(userId, periodId),
            () -> dailyMoodEntryRepository.findByUserIdAndEntryDateBetweenOrderByEntryDateAsc(userId, startDate, endDate));

        int totalHabits = period.getSelectedHabits() != null ? period.getSelectedHabits().size() : 0;
        CompletionMetrics metrics = metricsCalculator.calculate(startDate, endDate, totalHabits, summaries, moods);

        log.debug("Period {} metrics: adherence={}, avgMood={}, trend={}, streak={}/{}",
            periodId, metrics.getAdherenceRate(), metrics.getAverageMood(), metrics.getMoodTrend(),
            metrics.getCurrentStreak(), metrics.getLongestStreak());

        CompletionSummary summary = CompletionSummary.builder()
            .interventionPeriodId(periodId)
            .userId(userId)
            .adherenceRate(round(metrics.getAdherenceRate() * 100))
            .averageMood(metrics.getAverageMood() != null ? round(metrics.getAverageMood()) : null)
            .moodTrend(metrics.getMoodTrend())
            .summaryJson(toSummaryJson(metrics))
            .build();

        try {
            CompletionSummary saved = completionSummaryRepository.save(summary);
            log.info("Generated completion summary {} for period {}", saved.getId(), periodId);
            return CompletionAnalyticsResult.builder()
                .summaryId(saved.getId())
                .metrics(metrics)
                .persisted(true)
                .build();
        } catch (DataAccessException e) {
            log.warn("Could not store completion summary for period {}, returning unsaved metrics: {}",
                periodId, e.getMessage());
            return CompletionAnalyticsResult.builder()
                .metrics(metrics)
                .persisted(false)
                .warning("Summary calculated but not stored: " + e.getMessage())
                .build();
        }
    }

    private <T> List<T> findForPeriod(String what, Supplier<List<T>> byPeriodLink, Supplier<List<T>> byDateRange) {
        try {
            List<T> linked = byPeriodLink.get();
            if (!linked.isEmpty()) {
                return linked;
            }
        } catch (DataAccessException e) {
            log.warn("Period-linked lookup of {} failed, using date range instead: {}", what, e.getMessage());
        }
        return byDateRange.get();
    }

    private Map<String, Object> toSummaryJson(CompletionMetrics metrics) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("total_days", metrics.getTotalDays());
        json.put("tracked_days", metrics.getTrackedDays());
        json.put("missed_days", metrics.getMissedDays());
        json.put("total_habits", metrics.getTotalHabits());
        json.put("current_streak", metrics.getCurrentStreak());
        json.put("longest_streak", metrics.getLongestStreak());
        json.put("completion_percentages", metrics.getCompletionPercentages());
        json.put("mood_values", metrics.getMoodValues());
        return json;
    }

    private static BigDecimal round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }
}
