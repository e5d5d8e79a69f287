package net.javahippie.inflo.service;

import net.javahippie.inflo.model.dto.CompletionMetrics;
import net.javahippie.inflo.model.entity.DailyMoodEntry;
import net.javahippie.inflo.model.entity.DailySummary;
import net.javahippie.inflo.model.entity.MoodTrend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CompletionMetricsCalculator.
 * Covers adherence, mood trend and streak calculation.
 */
class CompletionMetricsCalculatorTest {

    private static final LocalDate START = LocalDate.of(2025, 3, 1);

    private CompletionMetricsCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new CompletionMetricsCalculator();
    }

    @Test
    @DisplayName("Should weight adherence by the share of tracked days")
    void testCalculate_AdherenceWithUntrackedDays() {
        // Given: a 10-day period with 8 fully completed days
        List<DailySummary> summaries = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            summaries.add(summary(START.plusDays(i), 100));
        }

        // When
        CompletionMetrics metrics = calculator.calculate(START, START.plusDays(9), 3, summaries, List.of());

        // Then
        assertEquals(10, metrics.getTotalDays());
        assertEquals(8, metrics.getTrackedDays());
        assertEquals(2, metrics.getMissedDays());
        assertEquals(0.8, metrics.getAdherenceRate(), 0.0001);
        assertEquals(100.0, metrics.getAverageCompletion(), 0.0001);
        assertEquals(3, metrics.getTotalHabits());
    }

    @Test
    @DisplayName("Should return zero adherence and no mood when nothing was tracked")
    void testCalculate_NoData() {
        CompletionMetrics metrics = calculator.calculate(START, START.plusDays(6), 2, List.of(), List.of());

        assertEquals(0.0, metrics.getAdherenceRate());
        assertNull(metrics.getAverageMood());
        assertEquals(MoodTrend.STABLE, metrics.getMoodTrend());
        assertEquals(0, metrics.getCurrentStreak());
        assertEquals(0, metrics.getLongestStreak());
        assertEquals(7, metrics.getMissedDays());
    }

    @Test
    @DisplayName("Should detect an improving mood")
    void testMoodTrend_Improved() {
        assertEquals(MoodTrend.IMPROVED, calculator.calculateMoodTrend(List.of(2, 2, 2, 2, 5, 5, 5, 5)));
    }

    @Test
    @DisplayName("Should detect a declining mood")
    void testMoodTrend_Declined() {
        assertEquals(MoodTrend.DECLINED, calculator.calculateMoodTrend(List.of(5, 4, 2, 1)));
    }

    @Test
    @DisplayName("Should call small changes and short series stable")
    void testMoodTrend_Stable() {
        assertEquals(MoodTrend.STABLE, calculator.calculateMoodTrend(List.of(3, 3, 3)));
        assertEquals(MoodTrend.STABLE, calculator.calculateMoodTrend(List.of(1, 5, 5)));
        assertEquals(MoodTrend.STABLE, calculator.calculateMoodTrend(List.of(3, 3, 3, 3, 3, 3, 3, 3, 3, 4)));
    }

    @Test
    @DisplayName("Should order moods by date and average them")
    void testCalculate_MoodSeries() {
        // Given
        List<DailyMoodEntry> moods = List.of(
            mood(START.plusDays(3), 5),
            mood(START, 2),
            mood(START.plusDays(1), null),
            mood(START.plusDays(2), 3));

        // When
        CompletionMetrics metrics = calculator.calculate(START, START.plusDays(3), 1, List.of(), moods);

        // Then
        assertEquals(List.of(2, 3, 5), metrics.getMoodValues());
        assertEquals(10.0 / 3, metrics.getAverageMood(), 0.0001);
    }

    @Test
    @DisplayName("Should count the current streak from the most recent day")
    void testStreaks_CurrentAndLongest() {
        // Given: newest first 90, 85, 40, 95 on consecutive days
        List<DailySummary> summaries = List.of(
            summary(START, 95),
            summary(START.plusDays(1), 40),
            summary(START.plusDays(2), 85),
            summary(START.plusDays(3), 90));

        // When
        int[] streaks = calculator.calculateStreaks(summaries);

        // Then
        assertEquals(2, streaks[0]);
        assertEquals(2, streaks[1]);
    }

    @Test
    @DisplayName("Should break a streak on an untracked day")
    void testStreaks_GapBreaksStreak() {
        // Given: three good days, a missing day, then two good days
        List<DailySummary> summaries = List.of(
            summary(START, 100),
            summary(START.plusDays(1), 100),
            summary(START.plusDays(2), 100),
            summary(START.plusDays(4), 80),
            summary(START.plusDays(5), 90));

        // When
        int[] streaks = calculator.calculateStreaks(summaries);

        // Then
        assertEquals(2, streaks[0]);
        assertEquals(3, streaks[1]);
    }

    @Test
    @DisplayName("Should report no current streak when the last day is below threshold")
    void testStreaks_LastDayBelowThreshold() {
        List<DailySummary> summaries = List.of(
            summary(START, 100),
            summary(START.plusDays(1), 100),
            summary(START.plusDays(2), 79.99));

        int[] streaks = calculator.calculateStreaks(summaries);

        assertEquals(0, streaks[0]);
        assertEquals(2, streaks[1]);
    }

    @Test
    @DisplayName("Should ignore summaries outside the range when counting missed days")
    void testMissedDays_OutOfRange() {
        List<DailySummary> summaries = List.of(
            summary(START.minusDays(1), 100),
            summary(START, 100),
            summary(START.plusDays(1), 100));

        assertEquals(3, calculator.calculateMissedDays(START, START.plusDays(4), summaries));
    }

    private DailySummary summary(LocalDate date, double percentage) {
        return DailySummary.builder()
            .entryDate(date)
            .totalHabits(3)
            .completionPercentage(BigDecimal.valueOf(percentage))
            .build();
    }

    private DailyMoodEntry mood(LocalDate date, Integer value) {
        return DailyMoodEntry.builder()
            .entryDate(date)
            .mood(value)
            .build();
    }
}
